package com.iksanov.surveyshield.node.anonymization;

/**
 * Rewrites free-text answers to strip identifying details before they are persisted.
 */
public interface TextAnonymizer {

    /**
     * @throws AnonymizationException if the transform is unavailable
     */
    String anonymize(String text);
}
