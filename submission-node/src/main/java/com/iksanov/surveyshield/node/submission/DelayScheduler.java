package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.common.exception.StorageAccessException;
import com.iksanov.surveyshield.node.config.DssConfig;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.persistence.ResponseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leader-only timer that drives flush cycles.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>The first arm after going idle draws a delay from the cold window</li>
 *   <li>Every cycle that persisted or attempted something re-arms with a warm delay</li>
 *   <li>A cycle that selects nothing disarms and resets the percentage; the next enqueue arms again</li>
 * </ul>
 * At most one cycle runs at a time. Question counts are looked up without holding the queue lock.
 */
public class DelayScheduler {

    private static final Logger log = LoggerFactory.getLogger(DelayScheduler.class);
    private final SubmissionQueue queue;
    private final FlushPlanner planner;
    private final ResponseSubmitter submitter;
    private final ResponseRepository repository;
    private final LeaderElector elector;
    private final DssConfig config;
    private final Random random;
    private final Clock clock;
    private final SubmissionMetrics metrics;
    private final ScheduledExecutorService timer;
    private final Object timerLock = new Object();
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private ScheduledFuture<?> pendingCycle;
    private volatile boolean shutdown = false;
    private volatile Runnable stateChangeListener = () -> {};

    public DelayScheduler(SubmissionQueue queue, FlushPlanner planner, ResponseSubmitter submitter, ResponseRepository repository,
                          LeaderElector elector, DssConfig config, Random random, Clock clock, SubmissionMetrics metrics,
                          ScheduledExecutorService timer) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.elector = Objects.requireNonNull(elector, "elector");
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    public static ScheduledExecutorService newTimer(String instanceId) {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("dss-flush-" + instanceId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void setStateChangeListener(Runnable listener) {
        this.stateChangeListener = listener != null ? listener : () -> {};
    }

    public void armCold() {
        schedule(drawDelay(config.coldDelayMin(), config.coldDelayMax()));
    }

    public void armWarm() {
        schedule(drawDelay(config.warmDelayMin(), config.warmDelayMax()));
    }

    Duration drawDelay(Duration min, Duration max) {
        long span = max.toMillis() - min.toMillis();
        return min.plusMillis((long) (random.nextDouble() * span));
    }

    private void schedule(Duration delay) {
        synchronized (timerLock) {
            if (shutdown) {
                log.debug("Scheduler shut down, not arming");
                return;
            }
            if (pendingCycle != null) pendingCycle.cancel(false);
            queue.markArmed(clock.instant().plus(delay));
            pendingCycle = timer.schedule(this::fire, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.debug("Next flush cycle in {}s", delay.toSeconds());
        notifyStateChanged();
    }

    /**
     * Cancels any armed cycle. Pending records stay queued.
     */
    public void stop() {
        disarm();
    }

    private void disarm() {
        synchronized (timerLock) {
            if (pendingCycle != null) {
                pendingCycle.cancel(false);
                pendingCycle = null;
            }
            queue.markIdle();
        }
        notifyStateChanged();
    }

    private boolean goIdleUnlessAddedSince(long generation) {
        boolean idle;
        synchronized (timerLock) {
            idle = queue.markIdleUnlessAddedSince(generation);
            if (idle && pendingCycle != null) {
                pendingCycle.cancel(false);
                pendingCycle = null;
            }
        }
        if (idle) notifyStateChanged();
        return idle;
    }

    public boolean isArmed() {
        synchronized (timerLock) {
            return pendingCycle != null && !pendingCycle.isDone();
        }
    }

    public void shutdown() {
        shutdown = true;
        disarm();
        timer.shutdown();
        try {
            if (!timer.awaitTermination(2, TimeUnit.SECONDS)) timer.shutdownNow();
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void fire() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Flush cycle already running, skipping");
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Flush cycle failed ({}), details omitted", e.getClass().getSimpleName());
        } finally {
            cycleRunning.set(false);
        }
    }

    /**
     * Runs one flush cycle on the calling thread.
     */
    public CycleOutcome runCycle() {
        if (!elector.isLeader()) {
            log.debug("Not the leader, skipping flush cycle");
            disarm();
            return CycleOutcome.SKIPPED;
        }

        long generation = queue.generation();
        Map<UUID, Integer> counts = questionCounts(queue.pendingSurveyIds());
        int percentage = queue.currentPercentage();
        List<PendingResponse> selected = queue.takeSelection(bySurvey -> planner.select(bySurvey, counts, percentage));
        metrics.recordFlushCycle(selected.isEmpty());

        if (selected.isEmpty()) {
            if (goIdleUnlessAddedSince(generation)) {
                log.debug("No survey above its threshold, going idle with {} pending", queue.size());
                return new CycleOutcome(0, false, false);
            }
            log.debug("Responses arrived during an empty cycle, re-arming");
            armCold();
            return new CycleOutcome(0, false, true);
        }

        boolean persisted = persist(selected);
        if (persisted) {
            int next = queue.adjustPercentage(this::nextPercentage);
            log.info("Flushed {} responses at {}%, next percentage {}%", selected.size(), percentage, next);
        }

        if (!elector.isLeader()) {
            disarm();
            return new CycleOutcome(selected.size(), persisted, false);
        }
        armWarm();
        return new CycleOutcome(selected.size(), persisted, true);
    }

    private Map<UUID, Integer> questionCounts(Set<UUID> surveyIds) {
        Map<UUID, Integer> counts = new HashMap<>();
        for (UUID surveyId : surveyIds) {
            try {
                counts.put(surveyId, repository.countQuestions(surveyId));
            } catch (StorageAccessException e) {
                log.warn("Question count unavailable for survey {}, skipping it this cycle", surveyId);
            }
        }
        return counts;
    }

    private boolean persist(List<PendingResponse> selected) {
        try {
            submitter.submit(selected);
            queue.recordFlush(selected.size(), clock.instant());
            return true;
        } catch (RuntimeException e) {
            queue.retain(selected);
            metrics.recordPersistenceFailure();
            log.error("Failed to persist {} responses ({}), returned to queue", selected.size(), e.getClass().getSimpleName());
            return false;
        }
    }

    int nextPercentage(int current) {
        if (random.nextInt(100) < config.resetChancePercentage()) return config.minPercentage();
        return Math.min(current + config.percentageIncrement(), config.maxPercentage());
    }

    private void notifyStateChanged() {
        try {
            stateChangeListener.run();
        } catch (Exception e) {
            log.error("Error in scheduler state listener: {}", e.getMessage(), e);
        }
    }

    public record CycleOutcome(int selected, boolean persisted, boolean rearmed) {
        static final CycleOutcome SKIPPED = new CycleOutcome(0, false, false);
    }
}
