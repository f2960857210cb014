package com.iksanov.surveyshield.node.election.lease;

import com.iksanov.surveyshield.common.exception.CoordinationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.Objects;

/**
 * Postgres-backed LeaseStore.
 * Table DDL:
 * CREATE TABLE IF NOT EXISTS leader_lease (
 *   lease_name TEXT PRIMARY KEY,
 *   holder_id TEXT,
 *   heartbeat_at BIGINT NOT NULL DEFAULT 0
 * );
 * <p>
 * Each conditional mutation is a single UPDATE, so the row lock taken by Postgres arbitrates
 * concurrent claims.
 */
public class PostgresLeaseStore implements LeaseStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresLeaseStore.class);

    private final DataSource ds;
    private final String leaseName;

    public PostgresLeaseStore(DataSource ds, String leaseName) {
        this.ds = Objects.requireNonNull(ds, "ds");
        this.leaseName = Objects.requireNonNull(leaseName, "leaseName");
        ensureRowExists();
    }

    private void ensureRowExists() {
        final String sql = "INSERT INTO leader_lease(lease_name, holder_id, heartbeat_at) VALUES (?, NULL, 0) ON CONFLICT (lease_name) DO NOTHING";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, leaseName);
            if (ps.executeUpdate() > 0) log.info("Created leader lease row '{}'", leaseName);
        } catch (SQLException e) {
            throw new CoordinationException("Failed to ensure leader_lease row exists for " + leaseName, e);
        }
    }

    @Override
    public LeaseRecord read() {
        final String sql = "SELECT holder_id, heartbeat_at FROM leader_lease WHERE lease_name = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, leaseName);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return LeaseRecord.vacant();
                String holder = rs.getString(1);
                return new LeaseRecord(holder == null || holder.isEmpty() ? null : holder, rs.getLong(2));
            }
        } catch (SQLException e) {
            throw new CoordinationException("Failed to read leader lease", e);
        }
    }

    @Override
    public boolean tryAcquire(String candidateId, String expectedHolderId, long nowMs) {
        final String sql = expectedHolderId == null
                ? "UPDATE leader_lease SET holder_id = ?, heartbeat_at = ? WHERE lease_name = ? AND (holder_id IS NULL OR holder_id = '')"
                : "UPDATE leader_lease SET holder_id = ?, heartbeat_at = ? WHERE lease_name = ? AND holder_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, candidateId);
            ps.setLong(2, nowMs);
            ps.setString(3, leaseName);
            if (expectedHolderId != null) ps.setString(4, expectedHolderId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new CoordinationException("Failed to claim leader lease", e);
        }
    }

    @Override
    public boolean renew(String holderId, long nowMs) {
        final String sql = "UPDATE leader_lease SET heartbeat_at = ? WHERE lease_name = ? AND holder_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, leaseName);
            ps.setString(3, holderId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new CoordinationException("Failed to renew leader lease", e);
        }
    }

    @Override
    public boolean release(String holderId) {
        final String sql = "UPDATE leader_lease SET holder_id = NULL WHERE lease_name = ? AND holder_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, leaseName);
            ps.setString(2, holderId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new CoordinationException("Failed to release leader lease", e);
        }
    }
}
