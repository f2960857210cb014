package com.iksanov.surveyshield.node.transfer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.iksanov.surveyshield.common.cluster.InstanceInfo;
import com.iksanov.surveyshield.common.cluster.InstanceProtocol;
import com.iksanov.surveyshield.common.codec.JsonCodec;
import com.iksanov.surveyshield.common.dto.InstanceCommunicationPayload;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.common.exception.SerializationException;
import com.iksanov.surveyshield.common.exception.TransferException;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP/1.1 client for the internal transfer endpoint. One short-lived connection per request,
 * bounded by a fixed timeout.
 */
public class NettyLeaderTransport implements LeaderTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyLeaderTransport.class);
    private static final AttributeKey<CompletableFuture<Reply>> REPLY_KEY = AttributeKey.valueOf("transfer-reply");
    private static final int MAX_RESPONSE_BYTES = 1024 * 1024;
    private final String instanceSecret;
    private final Duration timeout;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyLeaderTransport(String instanceSecret, Duration timeout) {
        this.instanceSecret = Objects.requireNonNull(instanceSecret, "instanceSecret");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_RESPONSE_BYTES));
                        p.addLast(new ReplyHandler());
                    }
                });
    }

    @Override
    public <T> ServiceResult<T> send(String targetInstanceId, InstanceCommunicationPayload payload, TypeReference<ServiceResult<T>> responseType) {
        InstanceInfo target;
        try {
            target = InstanceInfo.fromInstanceId(targetInstanceId);
        } catch (IllegalArgumentException e) {
            throw new TransferException("Invalid target instance id '" + targetInstanceId + "'", e);
        }

        Reply reply = exchange(target, JsonCodec.encode(payload));
        if (reply.status() < 200 || reply.status() >= 300) {
            log.debug("Instance {} answered {} with status {}", targetInstanceId, payload.communicationType(), reply.status());
            return ServiceResult.failure("Request failed with status code: " + reply.status());
        }
        try {
            return JsonCodec.decode(reply.body(), responseType);
        } catch (SerializationException e) {
            throw new TransferException("Unreadable reply from " + targetInstanceId, e);
        }
    }

    private Reply exchange(InstanceInfo target, byte[] body) {
        CompletableFuture<Reply> future = new CompletableFuture<>();
        ChannelFuture connect = bootstrap.connect(target.host(), target.port());
        connect.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                future.completeExceptionally(f.cause());
                return;
            }
            Channel ch = f.channel();
            ch.attr(REPLY_KEY).set(future);
            ch.writeAndFlush(buildRequest(target, body)).addListener((ChannelFutureListener) w -> {
                if (!w.isSuccess()) future.completeExceptionally(w.cause());
            });
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransferException("Timed out after " + timeout.toMillis() + "ms waiting for " + target.instanceId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransferException("Request to " + target.instanceId() + " failed: " + cause.getClass().getSimpleName(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException("Interrupted while waiting for " + target.instanceId(), e);
        } finally {
            connect.channel().close();
        }
    }

    private FullHttpRequest buildRequest(InstanceInfo target, byte[] body) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST,
                InstanceProtocol.TRANSFER_PATH, Unpooled.wrappedBuffer(body));
        request.headers()
                .set(HttpHeaderNames.HOST, target.instanceId())
                .set(HttpHeaderNames.CONTENT_TYPE, InstanceProtocol.CONTENT_TYPE_JSON)
                .set(HttpHeaderNames.CONTENT_LENGTH, body.length)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
                .set(InstanceProtocol.AUTH_HEADER, instanceSecret);
        return request;
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.info("Leader transport stopped");
    }

    record Reply(int status, byte[] body) {
    }

    private static final class ReplyHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            CompletableFuture<Reply> future = ctx.channel().attr(REPLY_KEY).get();
            if (future != null) future.complete(new Reply(msg.status().code(), ByteBufUtil.getBytes(msg.content())));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            CompletableFuture<Reply> future = ctx.channel().attr(REPLY_KEY).get();
            if (future != null && !future.isDone()) future.completeExceptionally(new TransferException("Connection closed before reply"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            CompletableFuture<Reply> future = ctx.channel().attr(REPLY_KEY).get();
            if (future != null) future.completeExceptionally(cause);
            ctx.close();
        }
    }
}
