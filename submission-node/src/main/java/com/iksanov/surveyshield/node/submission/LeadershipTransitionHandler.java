package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.node.election.LeadershipChange;
import com.iksanov.surveyshield.node.event.EventChannel;
import com.iksanov.surveyshield.node.transfer.TransferClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reacts to leadership flips: a promoted instance arms its scheduler, a demoted one stops it and
 * hands its queue to the new leader in one shot.
 */
public class LeadershipTransitionHandler implements Consumer<LeadershipChange> {

    private static final Logger log = LoggerFactory.getLogger(LeadershipTransitionHandler.class);
    private final DelayScheduler scheduler;
    private final SubmissionQueue queue;
    private final TransferClient transferClient;
    private final Runnable statusPublisher;

    public LeadershipTransitionHandler(DelayScheduler scheduler, SubmissionQueue queue, TransferClient transferClient, Runnable statusPublisher) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.transferClient = Objects.requireNonNull(transferClient, "transferClient");
        this.statusPublisher = Objects.requireNonNull(statusPublisher, "statusPublisher");
    }

    public EventChannel.Subscription register(EventChannel<LeadershipChange> changes) {
        return changes.subscribe(this);
    }

    @Override
    public void accept(LeadershipChange change) {
        if (change.isPromotion()) {
            log.info("Became leader, arming flush scheduler with {} pending", queue.size());
            scheduler.armCold();
        } else if (change.isDemotion()) {
            scheduler.stop();
            List<PendingResponse> drained = queue.drainAll();
            log.info("Lost leadership, handing {} pending responses to the new leader", drained.size());
            if (!drained.isEmpty()) transferClient.transferResponsesToLeader(drained);
        }
        statusPublisher.run();
    }
}
