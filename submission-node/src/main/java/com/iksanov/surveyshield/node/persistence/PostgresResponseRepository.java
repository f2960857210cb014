package com.iksanov.surveyshield.node.persistence;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.common.exception.StorageAccessException;

import javax.sql.DataSource;
import java.sql.*;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Postgres-backed ResponseRepository.
 * Table DDL (owned by the survey application, shown for reference):
 * CREATE TABLE responses (
 *   id BIGSERIAL PRIMARY KEY,
 *   survey_id UUID NOT NULL,
 *   question_id INT NOT NULL,
 *   question_type TEXT NOT NULL,
 *   answer TEXT,
 *   discrepancy DOUBLE PRECISION NOT NULL DEFAULT 0
 * );
 * <p>
 * No timestamp column is written: insertion time would correlate rows with flush cycles.
 * Exception messages never include row values.
 */
public class PostgresResponseRepository implements ResponseRepository {

    private final DataSource ds;

    public PostgresResponseRepository(DataSource ds) {
        this.ds = Objects.requireNonNull(ds, "ds");
    }

    @Override
    public int countQuestions(UUID surveyId) {
        final String sql = "SELECT COUNT(*) FROM questions WHERE survey_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, surveyId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageAccessException("Failed to count questions for survey " + surveyId, e);
        }
    }

    @Override
    public void saveAll(List<PendingResponse> responses) {
        if (responses.isEmpty()) return;
        final String sql = "INSERT INTO responses(survey_id, question_id, question_type, answer, discrepancy) VALUES (?, ?, ?, ?, ?)";
        try (Connection c = ds.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (PendingResponse r : responses) {
                    ps.setObject(1, r.surveyId());
                    ps.setInt(2, r.questionId());
                    ps.setString(3, r.questionType().name());
                    if (r.answer() == null) ps.setNull(4, Types.VARCHAR);
                    else ps.setString(4, r.answer());
                    ps.setDouble(5, r.discrepancy());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            // Driver messages can echo bound values, so only the SQL state travels on.
            throw new StorageAccessException("Failed to persist " + responses.size() + " responses (SQLState " + e.getSQLState() + ")");
        }
    }
}
