package com.iksanov.surveyshield.node.persistence;

import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.node.submission.DelayedSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;
import java.util.UUID;

/**
 * Closes a survey: flushes whatever is still pending for it, then marks it CLOSED.
 * A failed flush is logged and does not prevent closing.
 */
public class PostgresSurveyCloser implements SurveyCloser {

    private static final Logger log = LoggerFactory.getLogger(PostgresSurveyCloser.class);
    static final String CLOSE_SUCCESS = "Survey closed successfully";
    private final DataSource ds;
    private final DelayedSubmissionService submissionService;

    public PostgresSurveyCloser(DataSource ds, DelayedSubmissionService submissionService) {
        this.ds = Objects.requireNonNull(ds, "ds");
        this.submissionService = Objects.requireNonNull(submissionService, "submissionService");
    }

    @Override
    public ServiceResult<Boolean> closeSurvey(UUID surveyId) {
        ServiceResult<Integer> flush = submissionService.flushPendingResponses(surveyId);
        if (!flush.successful()) log.warn("Failed to flush responses for survey {} before closing: {}", surveyId, flush.message());

        final String sql = "UPDATE surveys SET state = 'CLOSED' WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, surveyId);
            if (ps.executeUpdate() == 0) {
                log.warn("Attempt to close non-existent survey {}", surveyId);
                return ServiceResult.failure("Survey not found");
            }
            log.info("Closed survey {} (flushed {} pending responses)", surveyId, flush.successful() ? flush.data() : 0);
            return ServiceResult.success(true, CLOSE_SUCCESS);
        } catch (SQLException e) {
            log.error("Failed to close survey {}: SQLState {}", surveyId, e.getSQLState());
            return ServiceResult.failure("Error closing survey");
        }
    }
}
