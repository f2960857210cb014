package com.iksanov.surveyshield.node.http;

import com.iksanov.surveyshield.common.dto.ServiceResult;

/**
 * Status code plus JSON body produced by a route handler. Handlers stay free of Netty types.
 */
public record HttpResult(int status, Object body) {

    public static HttpResult ok(Object body) {
        return new HttpResult(200, body);
    }

    public static HttpResult badRequest(String message) {
        return new HttpResult(400, ServiceResult.failure(message));
    }

    public static HttpResult unauthorized() {
        return new HttpResult(401, ServiceResult.failure("Unauthorized"));
    }

    public static HttpResult notFound() {
        return new HttpResult(404, ServiceResult.failure("Not Found"));
    }

    public static HttpResult serverError(String message) {
        return new HttpResult(500, ServiceResult.failure(message));
    }
}
