package com.iksanov.surveyshield.node.election;

import java.time.Instant;

/**
 * Published exactly when an instance's leadership flips.
 *
 * @param instanceId the local instance
 * @param leader     leadership after the flip
 * @param leaderId   leader known at the time of the flip, may be null when none is known
 * @param changedAt  time of the flip
 */
public record LeadershipChange(String instanceId, boolean leader, String leaderId, Instant changedAt) {

    public boolean isPromotion() {
        return leader;
    }

    public boolean isDemotion() {
        return !leader;
    }
}
