package com.iksanov.surveyshield.common.exception;

public class CoordinationException extends SurveyShieldException {
    public CoordinationException(String message) {
        super(message);
    }
    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
