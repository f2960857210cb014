package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.DssStatus;
import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.node.config.DssConfig;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.event.EventChannel;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.transfer.TransferClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the delayed submission subsystem.
 *
 * <p>On the leader, queued responses wait in memory and are persisted in randomized partial batches by the
 * {@link DelayScheduler}. On a follower, every enqueue forwards the new batch together with anything retained
 * from earlier failed transfers to the leader.
 */
public class DelayedSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(DelayedSubmissionService.class);
    public static final String NOT_LEADER = "Only the leader instance can flush pending responses";
    public static final String FORCE_FLUSH_DISABLED = "Force flush is disabled";
    private final LeaderElector elector;
    private final SubmissionQueue queue;
    private final DelayScheduler scheduler;
    private final ResponseSubmitter submitter;
    private final FlushPlanner planner;
    private final TransferClient transferClient;
    private final DssConfig config;
    private final Clock clock;
    private final SubmissionMetrics metrics;
    private final EventChannel<DssStatus> statusChanges;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DelayedSubmissionService(LeaderElector elector, SubmissionQueue queue, DelayScheduler scheduler, ResponseSubmitter submitter,
                                    FlushPlanner planner, TransferClient transferClient, DssConfig config, Clock clock,
                                    SubmissionMetrics metrics, EventChannel<DssStatus> statusChanges) {
        this.elector = Objects.requireNonNull(elector, "elector");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.transferClient = Objects.requireNonNull(transferClient, "transferClient");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.statusChanges = Objects.requireNonNull(statusChanges, "statusChanges");
    }

    public void start() {
        scheduler.setStateChangeListener(this::publishStatus);
        log.info("Delayed submission service started ({})", config);
    }

    /**
     * Accepts a batch from a completed participant submission. Discrepancy is derived for the batch
     * before it is queued or forwarded.
     */
    public void queueResponses(List<PendingResponse> responses) {
        if (responses == null || responses.isEmpty()) return;
        accept(DiscrepancyAnalyzer.analyze(responses));
    }

    /**
     * Accepts a batch forwarded by another instance. Discrepancy was already derived by the sender.
     *
     * @return number of records handed to the queue
     */
    public int queueTransferredResponses(List<PendingResponse> responses) {
        if (responses == null || responses.isEmpty()) return 0;
        metrics.recordTransferReceived();
        accept(responses);
        return responses.size();
    }

    private void accept(List<PendingResponse> batch) {
        if (shutdown.get()) throw new IllegalStateException("Delayed submission service is shut down");
        metrics.recordQueued(batch.size());

        if (elector.isLeader()) {
            SubmissionQueue.EnqueueResult result = queue.enqueue(batch);
            log.debug("Queued {} responses, {} pending", result.added(), queue.size());
            if (result.armingClaimed()) scheduler.armCold();
            publishStatus();
            return;
        }

        Map<UUID, PendingResponse> outgoing = new LinkedHashMap<>();
        for (PendingResponse r : queue.drainAll()) outgoing.put(r.entryId(), r);
        for (PendingResponse r : batch) outgoing.putIfAbsent(r.entryId(), r);
        transferClient.transferResponsesToLeaderAsync(new ArrayList<>(outgoing.values()))
                .whenComplete((result, error) -> publishStatus());
    }

    /**
     * Persists everything pending for one survey immediately, ignoring the threshold.
     */
    public ServiceResult<Integer> flushPendingResponses(UUID surveyId) {
        Objects.requireNonNull(surveyId, "surveyId");
        if (!elector.isLeader()) return ServiceResult.failure(NOT_LEADER);
        List<PendingResponse> drained = queue.drainSurvey(surveyId);
        if (drained.isEmpty()) return ServiceResult.success(0, "No pending responses for survey");
        ServiceResult<Integer> result = persistNow(drained);
        if (result.successful()) log.info("Flushed {} pending responses for survey {}", drained.size(), surveyId);
        return result;
    }

    /**
     * Persists the whole queue immediately. Only available when force flush is enabled.
     */
    public ServiceResult<Integer> forceFlushAllPendingResponses() {
        if (!config.forceFlushEnabled()) return ServiceResult.failure(FORCE_FLUSH_DISABLED);
        if (!elector.isLeader()) return ServiceResult.failure(NOT_LEADER);
        List<PendingResponse> drained = queue.drainAll();
        if (drained.isEmpty()) return ServiceResult.success(0, "No pending responses");
        ServiceResult<Integer> result = persistNow(drained);
        if (result.successful()) {
            log.info("Force flushed {} pending responses", drained.size());
            if (queue.isEmpty()) scheduler.stop();
        }
        return result;
    }

    private ServiceResult<Integer> persistNow(List<PendingResponse> drained) {
        try {
            submitter.submit(planner.shuffled(drained));
            queue.recordFlush(drained.size(), clock.instant());
            return ServiceResult.success(drained.size(), "Flushed " + drained.size() + " responses");
        } catch (RuntimeException e) {
            queue.retain(drained);
            metrics.recordPersistenceFailure();
            log.error("Immediate flush of {} responses failed ({}), returned to queue", drained.size(), e.getClass().getSimpleName());
            return ServiceResult.failure("Failed to persist pending responses");
        } finally {
            publishStatus();
        }
    }

    public DssStatus status() {
        ScheduleState s = queue.snapshot();
        return new DssStatus(s.pending(), s.lastFlushTime(), s.nextFlushTime(), s.lastFlushAmount(), s.currentPercentage(),
                elector.isLeader(), elector.isReady(), elector.instanceId(), transferClient.hasTransferredResponses());
    }

    public EventChannel<DssStatus> statusChanges() {
        return statusChanges;
    }

    public void publishStatus() {
        DssStatus status = status();
        metrics.updatePending(status.pending());
        metrics.updatePercentage(status.currentPercentage());
        statusChanges.publish(status);
    }

    /**
     * Cancels the timer. A follower makes one best-effort handover of what it still holds; a leader
     * does not flush and only logs how many records are dropped.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;
        scheduler.shutdown();

        if (elector.isLeader()) {
            int dropped = queue.drainAll().size();
            if (dropped > 0) log.warn("Shutting down as leader with {} pending responses, they are dropped", dropped);
        } else {
            List<PendingResponse> remaining = queue.drainAll();
            if (!remaining.isEmpty()) {
                ServiceResult<Integer> result = transferClient.transferResponsesToLeader(remaining);
                if (!result.successful()) log.warn("Shutdown handover failed, {} pending responses are dropped", queue.drainAll().size());
            }
        }
        log.info("Delayed submission service stopped");
    }
}
