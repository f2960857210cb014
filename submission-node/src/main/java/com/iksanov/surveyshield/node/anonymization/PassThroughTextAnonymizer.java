package com.iksanov.surveyshield.node.anonymization;

/**
 * Used when no anonymization service is configured; returns the text unchanged.
 */
public class PassThroughTextAnonymizer implements TextAnonymizer {
    @Override
    public String anonymize(String text) {
        return text;
    }
}
