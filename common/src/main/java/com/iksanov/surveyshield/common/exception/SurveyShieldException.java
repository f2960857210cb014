package com.iksanov.surveyshield.common.exception;

/**
 * Base unchecked exception for the submission subsystem.
 */
public class SurveyShieldException extends RuntimeException {
    public SurveyShieldException(String message) {
        super(message);
    }
    public SurveyShieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
