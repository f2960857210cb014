package com.iksanov.surveyshield.node.election;

import com.iksanov.surveyshield.node.event.EventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Elector for deployments with exactly one instance: the instance is leader and ready as soon as it
 * starts, without touching the lease store.
 */
public class SingleInstanceLeaderElector implements LeaderElector {

    private static final Logger log = LoggerFactory.getLogger(SingleInstanceLeaderElector.class);
    private final String instanceId;
    private final EventChannel<LeadershipChange> changes;
    private final Clock clock;
    private volatile boolean leader = false;
    private volatile boolean ready = false;

    public SingleInstanceLeaderElector(String instanceId, EventChannel<LeadershipChange> changes, Clock clock) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId cannot be null");
        this.changes = Objects.requireNonNull(changes, "changes cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public synchronized void start() {
        if (leader) return;
        log.info("Starting in single-instance mode, {} is the leader", instanceId);
        leader = true;
        ready = true;
        changes.publish(new LeadershipChange(instanceId, true, instanceId, clock.instant()));
    }

    @Override
    public synchronized void stop() {
        if (!leader) return;
        leader = false;
        changes.publish(new LeadershipChange(instanceId, false, null, clock.instant()));
        log.info("Single-instance elector stopped");
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
        return ready;
    }

    @Override
    public Optional<String> currentLeaderId() {
        return leader ? Optional.of(instanceId) : Optional.empty();
    }

    @Override
    public EventChannel<LeadershipChange> leadershipChanges() {
        return changes;
    }

    @Override
    public boolean awaitReady(Duration timeout) {
        return ready;
    }
}
