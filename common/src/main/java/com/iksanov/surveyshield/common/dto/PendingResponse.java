package com.iksanov.surveyshield.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.UUID;

/**
 * A single answer waiting for delayed, randomized persistence.
 * <p>
 * Deliberately carries no participant identifier. {@code entryId} is a random token minted when the
 * record is first queued; it only de-duplicates in-memory and in-flight copies and is never persisted.
 * <p>
 * {@link #toString()} never renders the answer.
 */
public record PendingResponse(UUID entryId, UUID surveyId, int questionId, QuestionType questionType,
                              String answer, double discrepancy) {

    public PendingResponse {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(surveyId, "surveyId");
        Objects.requireNonNull(questionType, "questionType");
        if (questionId <= 0) throw new IllegalArgumentException("questionId must be > 0");
    }

    public static PendingResponse of(UUID surveyId, int questionId, QuestionType questionType, String answer) {
        return new PendingResponse(UUID.randomUUID(), surveyId, questionId, questionType, answer, 0.0);
    }

    public PendingResponse withDiscrepancy(double value) {
        return new PendingResponse(entryId, surveyId, questionId, questionType, answer, value);
    }

    public PendingResponse withAnswer(String value) {
        return new PendingResponse(entryId, surveyId, questionId, questionType, value, discrepancy);
    }

    @JsonIgnore
    public boolean isFreeText() {
        return questionType == QuestionType.TEXT && answer != null && !answer.isBlank();
    }

    @Override
    public String toString() {
        return "PendingResponse[surveyId=%s, questionId=%d, type=%s]".formatted(surveyId, questionId, questionType);
    }
}
