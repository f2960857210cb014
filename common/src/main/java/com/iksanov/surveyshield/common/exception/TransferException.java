package com.iksanov.surveyshield.common.exception;

public class TransferException extends SurveyShieldException {
    public TransferException(String message) {
        super(message);
    }
    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
