package com.iksanov.surveyshield.node.election.lease;

/**
 * Snapshot of the shared leadership lease.
 *
 * @param holderId       instance currently holding the lease, null when vacant
 * @param heartbeatAtMs  epoch millis of the holder's last renewal
 */
public record LeaseRecord(String holderId, long heartbeatAtMs) {

    public static LeaseRecord vacant() {
        return new LeaseRecord(null, 0L);
    }

    public boolean isVacant() {
        return holderId == null || holderId.isBlank();
    }

    public boolean isHeldBy(String instanceId) {
        return !isVacant() && holderId.equals(instanceId);
    }

    public boolean isExpired(long nowMs, long timeoutMs) {
        return nowMs - heartbeatAtMs > timeoutMs;
    }
}
