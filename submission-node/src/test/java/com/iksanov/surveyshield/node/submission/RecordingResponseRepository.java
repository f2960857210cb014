package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.common.exception.StorageAccessException;
import com.iksanov.surveyshield.node.persistence.ResponseRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Repository double that keeps saved batches in memory and can be told to fail.
 */
class RecordingResponseRepository implements ResponseRepository {

    final Map<UUID, Integer> questionCounts = new ConcurrentHashMap<>();
    final Set<UUID> unreadableSurveys = ConcurrentHashMap.newKeySet();
    final List<List<PendingResponse>> savedBatches = new CopyOnWriteArrayList<>();
    volatile boolean failSaves = false;

    @Override
    public int countQuestions(UUID surveyId) {
        if (unreadableSurveys.contains(surveyId)) throw new StorageAccessException("count unavailable");
        return questionCounts.getOrDefault(surveyId, 0);
    }

    @Override
    public void saveAll(List<PendingResponse> responses) {
        if (failSaves) throw new StorageAccessException("save failed");
        savedBatches.add(List.copyOf(responses));
    }

    List<PendingResponse> saved() {
        List<PendingResponse> all = new ArrayList<>();
        savedBatches.forEach(all::addAll);
        return all;
    }
}
