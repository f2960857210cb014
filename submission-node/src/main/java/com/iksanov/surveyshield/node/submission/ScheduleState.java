package com.iksanov.surveyshield.node.submission;

import java.time.Instant;

/**
 * Consistent snapshot of the queue size and scheduler counters, taken under the queue lock.
 *
 * @param nextFlushTime null while no cycle is armed
 * @param lastFlushTime null until the first successful flush
 */
public record ScheduleState(int pending, int currentPercentage, Instant nextFlushTime, Instant lastFlushTime,
                            int lastFlushAmount, boolean armed) {
}
