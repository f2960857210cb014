package com.iksanov.surveyshield.common.dto;

import java.time.Instant;

/**
 * Operator-facing snapshot of the delayed submission subsystem. Counts and timestamps only.
 */
public record DssStatus(
        int pending,
        Instant lastFlushTime,
        Instant nextFlushTime,
        int lastFlushAmount,
        int currentPercentage,
        boolean leader,
        boolean ready,
        String instanceId,
        boolean hasTransferredResponses
) {
}
