package com.iksanov.surveyshield.node.transfer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.iksanov.surveyshield.common.dto.InstanceCommunicationPayload;
import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.common.exception.TransferException;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.submission.SubmissionQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Follower-side client of the leader's internal endpoint.
 * <p>
 * A batch that cannot be delivered goes back into the local queue (de-duplicated by entry id) and is
 * retried on the next enqueue, leadership change or shutdown. Log lines carry counts and instance ids only.
 */
public class TransferClient {

    private static final Logger log = LoggerFactory.getLogger(TransferClient.class);
    private static final TypeReference<ServiceResult<Integer>> INT_RESULT = new TypeReference<>() {};
    private static final TypeReference<ServiceResult<Boolean>> BOOL_RESULT = new TypeReference<>() {};
    private final LeaderElector elector;
    private final LeaderTransport transport;
    private final SubmissionQueue queue;
    private final SubmissionMetrics metrics;
    private final Executor transferExecutor;
    private final Runnable localArming;
    private volatile boolean hasTransferredResponses = false;

    /**
     * @param localArming arms a flush cycle when this instance, as leader, queues a batch that claimed arming
     */
    public TransferClient(LeaderElector elector, LeaderTransport transport, SubmissionQueue queue, SubmissionMetrics metrics,
                          Executor transferExecutor, Runnable localArming) {
        this.elector = Objects.requireNonNull(elector, "elector");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.transferExecutor = Objects.requireNonNull(transferExecutor, "transferExecutor");
        this.localArming = Objects.requireNonNull(localArming, "localArming");
    }

    public ServiceResult<Integer> transferResponsesToLeader(List<PendingResponse> batch) {
        if (batch == null || batch.isEmpty()) return ServiceResult.success(0, "Nothing to transfer");
        if (elector.isLeader()) {
            if (queue.enqueue(batch).armingClaimed()) localArming.run();
            return ServiceResult.success(0, "This instance is the leader");
        }

        Optional<String> leader = leaderOtherThanSelf();
        if (leader.isEmpty()) return retain(batch, "No leader available");

        String leaderId = leader.get();
        try {
            ServiceResult<Integer> result = transport.send(leaderId, InstanceCommunicationPayload.transfer(elector.instanceId(), batch), INT_RESULT);
            if (result == null || !result.successful()) {
                String reason = result == null ? "empty reply" : result.message();
                return retain(batch, "Leader " + leaderId + " rejected transfer: " + reason);
            }
            hasTransferredResponses = true;
            metrics.recordTransfer(true);
            log.info("Transferred {} responses to leader {}", batch.size(), leaderId);
            return ServiceResult.success(batch.size(), "Transferred " + batch.size() + " responses");
        } catch (TransferException e) {
            return retain(batch, e.getMessage());
        }
    }

    /**
     * Runs {@link #transferResponsesToLeader} on the transfer executor. If the executor refuses the task
     * the batch is retained locally.
     */
    public CompletableFuture<ServiceResult<Integer>> transferResponsesToLeaderAsync(List<PendingResponse> batch) {
        try {
            return CompletableFuture.supplyAsync(() -> transferResponsesToLeader(batch), transferExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(retain(batch, "Transfer executor unavailable"));
        }
    }

    /**
     * NoOp round trip to the current leader. A leader trivially succeeds.
     */
    public ServiceResult<Boolean> verifyLeaderCommunication() {
        if (elector.isLeader()) return ServiceResult.success(true, "This instance is the leader");
        Optional<String> leader = leaderOtherThanSelf();
        if (leader.isEmpty()) return ServiceResult.failure("No leader available");
        try {
            ServiceResult<Boolean> result = transport.send(leader.get(), InstanceCommunicationPayload.noOp(elector.instanceId()), BOOL_RESULT);
            if (result != null && result.successful()) {
                log.info("Communication with leader {} verified", leader.get());
                return ServiceResult.success(true, "Leader " + leader.get() + " reachable");
            }
            return ServiceResult.failure("Leader " + leader.get() + " did not acknowledge: " + (result == null ? "empty reply" : result.message()));
        } catch (TransferException e) {
            return ServiceResult.failure(e.getMessage());
        }
    }

    /**
     * Asks the leader to close a survey. Returns a failure when this instance is itself the leader,
     * since closing is then a local operation.
     */
    public ServiceResult<Boolean> requestSurveyClose(UUID surveyId) {
        Objects.requireNonNull(surveyId, "surveyId");
        if (elector.isLeader()) return ServiceResult.failure("This instance is the leader, close the survey locally");
        Optional<String> leader = leaderOtherThanSelf();
        if (leader.isEmpty()) return ServiceResult.failure("No leader available");
        try {
            ServiceResult<Boolean> result = transport.send(leader.get(), InstanceCommunicationPayload.closeSurvey(elector.instanceId(), surveyId), BOOL_RESULT);
            return result != null ? result : ServiceResult.failure("Empty reply from leader");
        } catch (TransferException e) {
            log.warn("Close request for survey {} failed: {}", surveyId, e.getMessage());
            return ServiceResult.failure(e.getMessage());
        }
    }

    public boolean hasTransferredResponses() {
        return hasTransferredResponses;
    }

    private Optional<String> leaderOtherThanSelf() {
        return elector.currentLeaderId().filter(id -> !id.equals(elector.instanceId()));
    }

    private ServiceResult<Integer> retain(List<PendingResponse> batch, String reason) {
        queue.retain(batch);
        metrics.recordTransfer(false);
        log.warn("Could not transfer {} responses, kept {} pending locally: {}", batch.size(), queue.size(), reason);
        return ServiceResult.failure(reason);
    }
}
