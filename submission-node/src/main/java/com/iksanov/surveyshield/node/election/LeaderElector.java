package com.iksanov.surveyshield.node.election;

import com.iksanov.surveyshield.node.event.EventChannel;

import java.time.Duration;
import java.util.Optional;

/**
 * Elects a single leader among the running instances.
 */
public interface LeaderElector {

    String instanceId();

    boolean isLeader();

    /**
     * True once the election has completed at least one round, successful or not.
     */
    boolean isReady();

    /**
     * Leader id as currently recorded in the shared store. Read on every call, never cached;
     * empty when no leader is recorded or the store cannot be reached.
     */
    Optional<String> currentLeaderId();

    EventChannel<LeadershipChange> leadershipChanges();

    boolean awaitReady(Duration timeout) throws InterruptedException;

    void start();

    void stop();

    default LeadershipState state() {
        return new LeadershipState(instanceId(), isLeader(), isReady());
    }
}
