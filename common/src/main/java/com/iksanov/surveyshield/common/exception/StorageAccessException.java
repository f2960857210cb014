package com.iksanov.surveyshield.common.exception;

public class StorageAccessException extends SurveyShieldException {
    public StorageAccessException(String message) {
        super(message);
    }
    public StorageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
