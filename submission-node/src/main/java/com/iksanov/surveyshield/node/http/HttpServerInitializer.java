package com.iksanov.surveyshield.node.http;

import com.iksanov.surveyshield.node.http.admin.AdminStatusHandler;
import com.iksanov.surveyshield.node.transfer.InstanceCommunicationHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.function.Supplier;

/**
 * Configures the pipeline for each accepted connection:
 * HTTP codec, aggregation up to {@code maxContentLength}, then the router on the business group.
 */
public class HttpServerInitializer extends ChannelInitializer<SocketChannel> {
    private final InstanceCommunicationHandler instanceHandler;
    private final AdminStatusHandler adminHandler;
    private final Supplier<String> metricsScraper;
    private final int maxContentLength;
    private final EventExecutorGroup businessGroup;

    public HttpServerInitializer(InstanceCommunicationHandler instanceHandler, AdminStatusHandler adminHandler, Supplier<String> metricsScraper,
                                 int maxContentLength, EventExecutorGroup businessGroup) {
        this.instanceHandler = instanceHandler;
        this.adminHandler = adminHandler;
        this.metricsScraper = metricsScraper;
        this.maxContentLength = maxContentLength;
        this.businessGroup = businessGroup;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline p = ch.pipeline();
        p.addLast(new HttpServerCodec());
        p.addLast(new HttpObjectAggregator(maxContentLength));
        p.addLast(businessGroup, "router", new HttpRequestRouter(instanceHandler, adminHandler, metricsScraper));
    }
}
