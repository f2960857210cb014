package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.IntUnaryOperator;

/**
 * In-memory holding area for responses that are not yet persisted, together with the scheduler's
 * counters. One lock guards both; callers copy records out and release it before doing any I/O.
 * <p>
 * Records are de-duplicated by entry id, so re-queueing a batch that is already held is harmless.
 */
public class SubmissionQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<UUID, PendingResponse> pending = new LinkedHashMap<>();
    private final int minPercentage;
    private int currentPercentage;
    private Instant nextFlushTime;
    private Instant lastFlushTime;
    private int lastFlushAmount;
    private boolean armed;
    private long generation;

    public SubmissionQueue(int minPercentage) {
        if (minPercentage < 1 || minPercentage > 100) throw new IllegalArgumentException("minPercentage must be between 1 and 100");
        this.minPercentage = minPercentage;
        this.currentPercentage = minPercentage;
    }

    /**
     * Appends a batch and, if no flush cycle is armed, claims the right to arm one.
     * Only one concurrent caller can see {@code armingClaimed == true} until the queue goes idle again.
     */
    public EnqueueResult enqueue(Collection<PendingResponse> batch) {
        lock.lock();
        try {
            int added = putAll(batch);
            boolean claim = !armed && !pending.isEmpty();
            if (claim) armed = true;
            return new EnqueueResult(added, claim);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts records back, e.g. after a failed transfer or persistence attempt. Does not arm anything.
     */
    public int retain(Collection<PendingResponse> records) {
        lock.lock();
        try {
            return putAll(records);
        } finally {
            lock.unlock();
        }
    }

    private int putAll(Collection<PendingResponse> records) {
        int added = 0;
        for (PendingResponse r : records) {
            if (pending.putIfAbsent(r.entryId(), r) == null) added++;
        }
        if (added > 0) generation++;
        return added;
    }

    public Set<UUID> pendingSurveyIds() {
        lock.lock();
        try {
            Set<UUID> ids = new LinkedHashSet<>();
            for (PendingResponse r : pending.values()) ids.add(r.surveyId());
            return ids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Groups the pending records by survey, lets {@code selector} pick a subset and removes that subset,
     * all in one critical section. The selector must be pure computation.
     */
    public List<PendingResponse> takeSelection(Function<Map<UUID, List<PendingResponse>>, List<PendingResponse>> selector) {
        lock.lock();
        try {
            Map<UUID, List<PendingResponse>> bySurvey = new LinkedHashMap<>();
            for (PendingResponse r : pending.values()) {
                bySurvey.computeIfAbsent(r.surveyId(), k -> new ArrayList<>()).add(r);
            }
            List<PendingResponse> selected = selector.apply(bySurvey);
            List<PendingResponse> taken = new ArrayList<>(selected.size());
            for (PendingResponse r : selected) {
                PendingResponse removed = pending.remove(r.entryId());
                if (removed != null) taken.add(removed);
            }
            return taken;
        } finally {
            lock.unlock();
        }
    }

    public List<PendingResponse> drainAll() {
        lock.lock();
        try {
            List<PendingResponse> all = new ArrayList<>(pending.values());
            pending.clear();
            return all;
        } finally {
            lock.unlock();
        }
    }

    public List<PendingResponse> drainSurvey(UUID surveyId) {
        lock.lock();
        try {
            List<PendingResponse> drained = new ArrayList<>();
            Iterator<PendingResponse> it = pending.values().iterator();
            while (it.hasNext()) {
                PendingResponse r = it.next();
                if (r.surveyId().equals(surveyId)) {
                    drained.add(r);
                    it.remove();
                }
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    void markArmed(Instant next) {
        lock.lock();
        try {
            armed = true;
            nextFlushTime = next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * No cycle armed: clears the next flush time and resets the percentage to its minimum.
     */
    void markIdle() {
        lock.lock();
        try {
            armed = false;
            nextFlushTime = null;
            currentPercentage = minPercentage;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counter bumped whenever records are added, by enqueue or retain.
     */
    long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Goes idle after a cycle that selected nothing, unless records were added since {@code observedGeneration}.
     * In that case the queue stays armed and the caller must arm the next cycle. The percentage is reset either way.
     *
     * @return true if the queue went idle
     */
    boolean markIdleUnlessAddedSince(long observedGeneration) {
        lock.lock();
        try {
            currentPercentage = minPercentage;
            if (generation != observedGeneration && !pending.isEmpty()) return false;
            armed = false;
            nextFlushTime = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void recordFlush(int amount, Instant at) {
        lock.lock();
        try {
            lastFlushAmount = amount;
            lastFlushTime = at;
        } finally {
            lock.unlock();
        }
    }

    int currentPercentage() {
        lock.lock();
        try {
            return currentPercentage;
        } finally {
            lock.unlock();
        }
    }

    int adjustPercentage(IntUnaryOperator update) {
        lock.lock();
        try {
            currentPercentage = update.applyAsInt(currentPercentage);
            return currentPercentage;
        } finally {
            lock.unlock();
        }
    }

    public ScheduleState snapshot() {
        lock.lock();
        try {
            return new ScheduleState(pending.size(), currentPercentage, nextFlushTime, lastFlushTime, lastFlushAmount, armed);
        } finally {
            lock.unlock();
        }
    }

    public record EnqueueResult(int added, boolean armingClaimed) {
    }
}
