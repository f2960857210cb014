package com.iksanov.surveyshield.node.election;

import com.iksanov.surveyshield.node.config.ElectionConfig;
import com.iksanov.surveyshield.node.election.lease.LeaseRecord;
import com.iksanov.surveyshield.node.election.lease.LeaseStore;
import com.iksanov.surveyshield.node.event.EventChannel;
import com.iksanov.surveyshield.node.metrics.ElectionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Leader election over a shared {@link LeaseStore} with heartbeat-based fail-over.
 *
 * <p>Each check:
 * <ul>
 *   <li>Holder is self: renew the heartbeat; a refused renewal means another instance took over</li>
 *   <li>No holder: claim the lease if it is still vacant</li>
 *   <li>Holder expired: take over if the expired holder is still recorded</li>
 *   <li>Holder alive: follow it, demoting first if this instance believed it was leader</li>
 * </ul>
 *
 * <p>An unreachable store demotes a leader immediately and retries with exponential backoff. The
 * elector never claims leadership it cannot confirm.
 */
public class LeaseLeaderElector implements LeaderElector {

    private static final Logger log = LoggerFactory.getLogger(LeaseLeaderElector.class);
    private final String instanceId;
    private final LeaseStore store;
    private final ElectionConfig config;
    private final Clock clock;
    private final EventChannel<LeadershipChange> changes;
    private final ElectionMetrics metrics;
    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final Object checkLock = new Object();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> nextCheck;
    private volatile boolean leader = false;
    private volatile boolean running = false;
    private volatile String acknowledgedLeaderId;
    private int consecutiveFailures = 0;

    public LeaseLeaderElector(String instanceId, LeaseStore store, ElectionConfig config, Clock clock,
                              EventChannel<LeadershipChange> changes, ElectionMetrics metrics) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.changes = Objects.requireNonNull(changes, "changes cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("LeaseLeaderElector already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "leader-election-" + instanceId);
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        log.info("Starting leader election for {} ({})", instanceId, config);
        scheduleCheck(Duration.ZERO);
    }

    @Override
    public void stop() {
        ScheduledExecutorService executor;
        synchronized (this) {
            if (!running) return;
            running = false;
            if (nextCheck != null) nextCheck.cancel(false);
            executor = scheduler;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        synchronized (checkLock) {
            if (leader) {
                try {
                    if (store.release(instanceId)) log.info("Instance {} has relinquished leadership", instanceId);
                } catch (RuntimeException e) {
                    log.error("Error relinquishing leadership for instance {}: {}", instanceId, e.getMessage());
                }
                setLeader(false, null);
            }
        }
        log.info("LeaseLeaderElector stopped");
    }

    private void scheduleCheck(Duration delay) {
        synchronized (this) {
            if (!running) return;
            nextCheck = scheduler.schedule(this::runScheduledCheck, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void runScheduledCheck() {
        Duration next;
        try {
            next = checkLeadership();
        } catch (Exception e) {
            log.error("Unexpected error during leadership check: {}", e.getMessage(), e);
            next = config.checkInterval();
        }
        scheduleCheck(next);
    }

    /**
     * Runs one election round.
     *
     * @return delay until the next round: the check interval after success, a backoff after failure
     */
    public Duration checkLeadership() {
        synchronized (checkLock) {
            metrics.recordCheck();
            try {
                runElectionRound();
                consecutiveFailures = 0;
                return config.checkInterval();
            } catch (RuntimeException e) {
                consecutiveFailures++;
                metrics.recordCheckFailure();
                log.warn("Lease store unavailable for {} ({} consecutive failures): {}", instanceId, consecutiveFailures, e.getMessage());
                if (leader) {
                    log.warn("Instance {} cannot confirm its lease, stepping down", instanceId);
                    setLeader(false, null);
                }
                return backoffDelay(consecutiveFailures);
            } finally {
                if (readyLatch.getCount() > 0) {
                    readyLatch.countDown();
                    log.info("Leader election initialization completed for {}", instanceId);
                }
            }
        }
    }

    private void runElectionRound() {
        long now = clock.millis();
        LeaseRecord lease = store.read();

        if (lease.isHeldBy(instanceId)) {
            if (store.renew(instanceId, now)) {
                if (!leader) {
                    log.info("Instance {} confirming leadership status", instanceId);
                    setLeader(true, instanceId);
                }
            } else if (leader) {
                log.warn("Instance {} lost its lease during renewal", instanceId);
                setLeader(false, null);
            }
            return;
        }

        if (lease.isVacant()) {
            log.info("No active leader found. {} attempting to claim leadership", instanceId);
            if (store.tryAcquire(instanceId, null, now)) {
                log.info("Instance {} has been elected as the new leader", instanceId);
                setLeader(true, instanceId);
            } else if (leader) {
                setLeader(false, null);
            }
            return;
        }

        if (lease.isExpired(now, config.leaseTimeout().toMillis())) {
            log.warn("Previous leader {} has expired (last heartbeat {}ms ago)", lease.holderId(), now - lease.heartbeatAtMs());
            if (store.tryAcquire(instanceId, lease.holderId(), now)) {
                log.info("Instance {} has taken over from expired leader {}", instanceId, lease.holderId());
                setLeader(true, instanceId);
            } else if (leader) {
                setLeader(false, null);
            }
            return;
        }

        if (leader) {
            log.warn("Instance {} was leader but has been superseded by {}", instanceId, lease.holderId());
            setLeader(false, lease.holderId());
        } else if (!lease.holderId().equals(acknowledgedLeaderId)) {
            log.info("Accepting {} as current leader", lease.holderId());
            acknowledgedLeaderId = lease.holderId();
        }
    }

    Duration backoffDelay(int failures) {
        long initial = config.initialBackoff().toMillis();
        long cap = config.checkInterval().toMillis();
        int shift = Math.min(Math.max(failures - 1, 0), 30);
        long delay = initial << shift;
        if (delay <= 0 || delay > cap) delay = cap;
        return Duration.ofMillis(delay);
    }

    private void setLeader(boolean isLeader, String leaderId) {
        if (leader == isLeader) return;
        leader = isLeader;
        acknowledgedLeaderId = isLeader ? null : leaderId;
        metrics.recordLeadership(isLeader);
        changes.publish(new LeadershipChange(instanceId, isLeader, leaderId, clock.instant()));
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public boolean isLeader() {
        return leader;
    }

    @Override
    public boolean isReady() {
        return readyLatch.getCount() == 0;
    }

    @Override
    public Optional<String> currentLeaderId() {
        try {
            LeaseRecord lease = store.read();
            return lease.isVacant() ? Optional.empty() : Optional.of(lease.holderId());
        } catch (RuntimeException e) {
            log.warn("Cannot resolve current leader: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public EventChannel<LeadershipChange> leadershipChanges() {
        return changes;
    }

    @Override
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return readyLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    int consecutiveFailures() {
        synchronized (checkLock) {
            return consecutiveFailures;
        }
    }
}
