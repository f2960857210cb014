package com.iksanov.surveyshield.node.config;

/**
 * Configuration holder for the HTTP server.
 * Blocking handlers (persistence, survey close) run on {@code businessThreads}, never on the IO workers.
 */
public record HttpServerConfig(String host, int port, int bossThreads, int workerThreads, int businessThreads,
                               int backlog, int maxContentLength, int shutdownQuietPeriodSeconds, int shutdownTimeoutSeconds) {
    public static HttpServerConfig defaults() {
        return new HttpServerConfig("0.0.0.0", 8080, 1, 2, 4, 256, 4 * 1024 * 1024, 1, 5);
    }

    public HttpServerConfig withPort(int newPort) {
        return new HttpServerConfig(host, newPort, bossThreads, workerThreads, businessThreads, backlog,
                maxContentLength, shutdownQuietPeriodSeconds, shutdownTimeoutSeconds);
    }
}
