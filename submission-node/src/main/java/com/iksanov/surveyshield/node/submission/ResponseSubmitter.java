package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.node.anonymization.TextAnonymizer;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.persistence.ResponseRepository;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Anonymizes free-text answers and persists a selection in one transaction.
 * <p>
 * Anonymization failures never block persistence: the original text is kept and only the number of
 * failures is logged. Exceptions from this path are never logged with their message.
 */
public class ResponseSubmitter {

    private static final Logger log = LoggerFactory.getLogger(ResponseSubmitter.class);
    private final ResponseRepository repository;
    private final TextAnonymizer anonymizer;
    private final SubmissionMetrics metrics;

    public ResponseSubmitter(ResponseRepository repository, TextAnonymizer anonymizer, SubmissionMetrics metrics) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.anonymizer = Objects.requireNonNull(anonymizer, "anonymizer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @throws com.iksanov.surveyshield.common.exception.StorageAccessException if nothing could be persisted
     */
    public void submit(List<PendingResponse> responses) {
        if (responses.isEmpty()) return;
        Timer.Sample sample = metrics.startFlushTimer();
        try {
            repository.saveAll(anonymizeFreeText(responses));
            metrics.recordPersisted(responses.size());
        } finally {
            metrics.stopFlushTimer(sample);
        }
    }

    List<PendingResponse> anonymizeFreeText(List<PendingResponse> responses) {
        List<PendingResponse> prepared = new ArrayList<>(responses.size());
        int failures = 0;
        for (PendingResponse r : responses) {
            if (!r.isFreeText()) {
                prepared.add(r);
                continue;
            }
            try {
                prepared.add(r.withAnswer(anonymizer.anonymize(r.answer())));
            } catch (RuntimeException e) {
                failures++;
                metrics.recordAnonymizationFailure();
                prepared.add(r);
            }
        }
        if (failures > 0) {
            log.warn("Text anonymization failed for {} answer(s), proceeding with original text (details omitted)", failures);
        }
        return prepared;
    }
}
