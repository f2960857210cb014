package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.common.dto.QuestionType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives each rating's distance from the batch mean. The mean covers only ratings that parse as
 * integers; every other record keeps its current discrepancy.
 */
public final class DiscrepancyAnalyzer {

    private DiscrepancyAnalyzer() {
    }

    public static List<PendingResponse> analyze(List<PendingResponse> batch) {
        long sum = 0;
        int count = 0;
        for (PendingResponse r : batch) {
            Integer rating = parseRating(r);
            if (rating != null) {
                sum += rating;
                count++;
            }
        }
        if (count == 0) return List.copyOf(batch);

        double mean = (double) sum / count;
        List<PendingResponse> analyzed = new ArrayList<>(batch.size());
        for (PendingResponse r : batch) {
            Integer rating = parseRating(r);
            analyzed.add(rating == null ? r : r.withDiscrepancy(round2(rating - mean)));
        }
        return analyzed;
    }

    static Integer parseRating(PendingResponse r) {
        if (r.questionType() != QuestionType.RATING || r.answer() == null) return null;
        try {
            return Integer.parseInt(r.answer().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
