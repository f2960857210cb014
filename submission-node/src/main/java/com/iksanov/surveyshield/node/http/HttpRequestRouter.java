package com.iksanov.surveyshield.node.http;

import com.iksanov.surveyshield.common.cluster.InstanceProtocol;
import com.iksanov.surveyshield.common.codec.JsonCodec;
import com.iksanov.surveyshield.node.http.admin.AdminStatusHandler;
import com.iksanov.surveyshield.node.transfer.InstanceCommunicationHandler;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Maps requests to route handlers and writes their results back as JSON.
 * <p>
 * Routes:
 * <ul>
 *   <li>{@code POST /api/internal/responses/transfer}</li>
 *   <li>{@code GET /admin/instance-info}</li>
 *   <li>{@code POST /admin/surveys/{surveyId}/flush}</li>
 *   <li>{@code GET /health}, {@code GET /metrics}</li>
 * </ul>
 * Runs on the business executor group, so handlers may block.
 */
public class HttpRequestRouter extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestRouter.class);
    private static final String ADMIN_SURVEYS_PREFIX = "/admin/surveys/";
    private static final String FLUSH_SUFFIX = "/flush";
    private static final String CLOSE_SUFFIX = "/close";
    private final InstanceCommunicationHandler instanceHandler;
    private final AdminStatusHandler adminHandler;
    private final Supplier<String> metricsScraper;

    public HttpRequestRouter(InstanceCommunicationHandler instanceHandler, AdminStatusHandler adminHandler, Supplier<String> metricsScraper) {
        this.instanceHandler = Objects.requireNonNull(instanceHandler, "instanceHandler");
        this.adminHandler = Objects.requireNonNull(adminHandler, "adminHandler");
        this.metricsScraper = Objects.requireNonNull(metricsScraper, "metricsScraper");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        HttpMethod method = request.method();
        try {
            if (HttpMethod.GET.equals(method) && "/metrics".equals(path)) {
                writeText(ctx, request, metricsScraper.get());
                return;
            }
            writeJson(ctx, request, route(method, path, request));
        } catch (RuntimeException e) {
            log.error("Unhandled error on {} {} ({})", method, path, e.getClass().getSimpleName());
            writeJson(ctx, request, HttpResult.serverError("Internal error"));
        }
    }

    HttpResult route(HttpMethod method, String path, FullHttpRequest request) {
        String authorization = request.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (HttpMethod.POST.equals(method) && InstanceProtocol.TRANSFER_PATH.equals(path)) {
            return instanceHandler.handle(request.headers().get(InstanceProtocol.AUTH_HEADER), ByteBufUtil.getBytes(request.content()));
        }
        if (HttpMethod.GET.equals(method) && "/admin/instance-info".equals(path)) {
            return adminHandler.instanceInfo(authorization);
        }
        if (HttpMethod.POST.equals(method) && path.startsWith(ADMIN_SURVEYS_PREFIX) && path.endsWith(FLUSH_SUFFIX)) {
            String surveyId = path.substring(ADMIN_SURVEYS_PREFIX.length(), path.length() - FLUSH_SUFFIX.length());
            return adminHandler.flushSurvey(authorization, surveyId);
        }
        if (HttpMethod.POST.equals(method) && path.startsWith(ADMIN_SURVEYS_PREFIX) && path.endsWith(CLOSE_SUFFIX)) {
            String surveyId = path.substring(ADMIN_SURVEYS_PREFIX.length(), path.length() - CLOSE_SUFFIX.length());
            return adminHandler.closeSurvey(authorization, surveyId);
        }
        if (HttpMethod.POST.equals(method) && "/admin/flush".equals(path)) {
            return adminHandler.forceFlushAll(authorization);
        }
        if (HttpMethod.GET.equals(method) && "/health".equals(path)) {
            return HttpResult.ok(new Health("UP"));
        }
        return HttpResult.notFound();
    }

    private void writeJson(ChannelHandlerContext ctx, FullHttpRequest request, HttpResult result) {
        write(ctx, request, HttpResponseStatus.valueOf(result.status()), JsonCodec.encode(result.body()), InstanceProtocol.CONTENT_TYPE_JSON);
    }

    private void writeText(ChannelHandlerContext ctx, FullHttpRequest request, String body) {
        write(ctx, request, HttpResponseStatus.OK, body.getBytes(StandardCharsets.UTF_8), "text/plain; version=0.0.4; charset=utf-8");
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status, byte[] body, String contentType) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        if (HttpUtil.isKeepAlive(request)) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Error in HTTP channel {}: {}", ctx.channel().remoteAddress(), cause.getClass().getSimpleName());
        ctx.close();
    }

    record Health(String status) {
    }
}
