package com.iksanov.surveyshield.common.exception;

public class SerializationException extends SurveyShieldException {
    public SerializationException(String message) {
        super(message);
    }
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
