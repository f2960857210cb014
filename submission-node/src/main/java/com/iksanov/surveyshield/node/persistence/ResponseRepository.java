package com.iksanov.surveyshield.node.persistence;

import com.iksanov.surveyshield.common.dto.PendingResponse;

import java.util.List;
import java.util.UUID;

/**
 * Durable storage for finalized responses.
 * Implementations throw {@link com.iksanov.surveyshield.common.exception.StorageAccessException} on failure.
 */
public interface ResponseRepository {

    int countQuestions(UUID surveyId);

    /**
     * Persists all responses atomically: either every record is stored or none is.
     */
    void saveAll(List<PendingResponse> responses);
}
