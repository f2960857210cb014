package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;

import java.util.*;

/**
 * Decides which pending responses a flush cycle persists.
 * <p>
 * A survey is eligible only while its pending count exceeds {@code questionCount * minimumSurveySubmissions};
 * at most {@code pending - minimumEligible} records leave per cycle, chosen uniformly at random.
 */
public class FlushPlanner {

    private final int minimumSurveySubmissions;
    private final Random random;

    public FlushPlanner(int minimumSurveySubmissions, Random random) {
        if (minimumSurveySubmissions < 0) throw new IllegalArgumentException("minimumSurveySubmissions must be >= 0");
        this.minimumSurveySubmissions = minimumSurveySubmissions;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param bySurvey       pending records grouped by survey
     * @param questionCounts question count per survey; surveys without an entry are skipped
     * @param percentage     current flush percentage
     */
    public List<PendingResponse> select(Map<UUID, List<PendingResponse>> bySurvey, Map<UUID, Integer> questionCounts, int percentage) {
        List<PendingResponse> selected = new ArrayList<>();
        for (Map.Entry<UUID, List<PendingResponse>> group : bySurvey.entrySet()) {
            Integer questionCount = questionCounts.get(group.getKey());
            if (questionCount == null) continue;
            List<PendingResponse> responses = group.getValue();
            int amount = amountToSubmit(responses.size(), minimumEligible(questionCount), percentage);
            if (amount > 0) selected.addAll(shuffled(responses).subList(0, amount));
        }
        return selected;
    }

    public int minimumEligible(int questionCount) {
        return Math.max(questionCount, 0) * minimumSurveySubmissions;
    }

    static int amountToSubmit(int pending, int minimumEligible, int percentage) {
        if (pending <= minimumEligible) return 0;
        int byPercentage = (int) ((pending * (long) percentage + 99) / 100);
        return Math.min(byPercentage, pending - minimumEligible);
    }

    public List<PendingResponse> shuffled(Collection<PendingResponse> responses) {
        List<PendingResponse> copy = new ArrayList<>(responses);
        Collections.shuffle(copy, random);
        return copy;
    }
}
