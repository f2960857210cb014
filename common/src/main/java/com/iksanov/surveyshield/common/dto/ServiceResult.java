package com.iksanov.surveyshield.common.dto;

/**
 * Success/failure envelope returned to callers and over the wire as {@code {successful, message, data}}.
 */
public record ServiceResult<T>(boolean successful, String message, T data) {

    public static <T> ServiceResult<T> success(T data, String message) {
        return new ServiceResult<>(true, message, data);
    }

    public static <T> ServiceResult<T> failure(String message) {
        return new ServiceResult<>(false, message, null);
    }
}
