package com.iksanov.surveyshield.common.exception;

public class ConfigurationException extends SurveyShieldException {
    public ConfigurationException(String message) {
        super(message);
    }
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
