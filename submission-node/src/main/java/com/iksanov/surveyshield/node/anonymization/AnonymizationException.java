package com.iksanov.surveyshield.node.anonymization;

import com.iksanov.surveyshield.common.exception.SurveyShieldException;

public class AnonymizationException extends SurveyShieldException {
    public AnonymizationException(String message) {
        super(message);
    }
    public AnonymizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
