package com.iksanov.surveyshield.node.election.lease;

/**
 * Shared coordination record used for leader election.
 * <p>
 * Every mutation is conditional on the current holder so that concurrent claimants cannot both win.
 * Implementations throw {@link com.iksanov.surveyshield.common.exception.CoordinationException} when
 * the store cannot be reached.
 */
public interface LeaseStore {

    LeaseRecord read();

    /**
     * Sets the holder to {@code candidateId} only if the current holder equals {@code expectedHolderId}
     * (null meaning vacant).
     *
     * @return true if the lease was claimed
     */
    boolean tryAcquire(String candidateId, String expectedHolderId, long nowMs);

    /**
     * Refreshes the heartbeat only while {@code holderId} still holds the lease.
     */
    boolean renew(String holderId, long nowMs);

    /**
     * Vacates the lease only while {@code holderId} still holds it.
     */
    boolean release(String holderId);
}
