package com.iksanov.surveyshield.node.http;

import com.iksanov.surveyshield.node.config.HttpServerConfig;
import com.iksanov.surveyshield.node.http.admin.AdminStatusHandler;
import com.iksanov.surveyshield.node.transfer.InstanceCommunicationHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * HttpServer - Netty HTTP server for the internal, admin and operational routes.
 * <p>
 * Responsibilities:
 *  - Initializes and manages Netty event loops (boss, worker and business groups)
 *  - Binds synchronously so startup fails fast when the port is taken
 *  - Handles lifecycle: start(), stop(), graceful shutdown
 */
public final class HttpServer {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);
    private final HttpServerConfig config;
    private final InstanceCommunicationHandler instanceHandler;
    private final AdminStatusHandler adminHandler;
    private final Supplier<String> metricsScraper;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup businessGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    public HttpServer(HttpServerConfig config, InstanceCommunicationHandler instanceHandler, AdminStatusHandler adminHandler, Supplier<String> metricsScraper) {
        this.config = Objects.requireNonNull(config, "config");
        this.instanceHandler = Objects.requireNonNull(instanceHandler, "instanceHandler");
        this.adminHandler = Objects.requireNonNull(adminHandler, "adminHandler");
        this.metricsScraper = Objects.requireNonNull(metricsScraper, "metricsScraper");
    }

    public synchronized void start() {
        if (running) {
            log.warn("HttpServer is already running on {}:{}", config.host(), config.port());
            return;
        }

        bossGroup = new NioEventLoopGroup(Math.max(1, config.bossThreads()));
        workerGroup = config.workerThreads() > 0 ? new NioEventLoopGroup(config.workerThreads()) : new NioEventLoopGroup();
        businessGroup = new DefaultEventExecutorGroup(Math.max(1, config.businessThreads()));

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, config.backlog())
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .childHandler(new HttpServerInitializer(instanceHandler, adminHandler, metricsScraper, config.maxContentLength(), businessGroup));

            log.info("Starting HttpServer on {}:{} with config: {}", config.host(), config.port(), config);
            serverChannel = bootstrap.bind(new InetSocketAddress(config.host(), config.port())).sync().channel();
            running = true;
            log.info("HttpServer started successfully on {}", serverChannel.localAddress());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownEventLoopGroupsQuietly();
            throw new IllegalStateException("Interrupted while starting HttpServer", e);
        } catch (Exception e) {
            log.error("Failed to bind HttpServer on {}:{}", config.host(), config.port(), e);
            shutdownEventLoopGroupsQuietly();
            throw new IllegalStateException("HttpServer startup failed", e);
        }
    }

    public synchronized void stop() {
        if (!running) {
            log.warn("HttpServer is not running");
            return;
        }

        log.info("Stopping HttpServer on {}:{}", config.host(), config.port());
        try {
            if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        } catch (Exception e) {
            log.error("Error closing HttpServer channel: {}", e.getMessage(), e);
        } finally {
            shutdownEventLoopGroups();
            running = false;
            log.info("HttpServer stopped successfully");
        }
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int boundPort() {
        if (serverChannel == null) throw new IllegalStateException("HttpServer is not running");
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return running;
    }

    private void shutdownEventLoopGroups() {
        try {
            for (EventExecutorGroup group : new EventExecutorGroup[]{workerGroup, bossGroup, businessGroup}) {
                if (group == null) continue;
                group.shutdownGracefully(config.shutdownQuietPeriodSeconds(), config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)
                        .await(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during HttpServer shutdown");
        }
    }

    private void shutdownEventLoopGroupsQuietly() {
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (businessGroup != null) businessGroup.shutdownGracefully();
    }
}
