package com.iksanov.surveyshield.node.transfer;

import com.iksanov.surveyshield.common.dto.*;
import com.iksanov.surveyshield.common.exception.TransferException;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.submission.SubmissionQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TransferClientTest {

    private final LeaderElector elector = mock(LeaderElector.class);
    private final LeaderTransport transport = mock(LeaderTransport.class);
    private final SubmissionQueue queue = new SubmissionQueue(30);
    private final UUID survey = UUID.randomUUID();
    private final AtomicInteger armings = new AtomicInteger();
    private TransferClient client;

    @BeforeEach
    void setUp() {
        when(elector.instanceId()).thenReturn("f:8080");
        when(elector.isLeader()).thenReturn(false);
        when(elector.currentLeaderId()).thenReturn(Optional.of("l:8080"));
        client = new TransferClient(elector, transport, queue, new SubmissionMetrics(), Runnable::run, armings::incrementAndGet);
    }

    private List<PendingResponse> batch(int n) {
        List<PendingResponse> list = new ArrayList<>();
        for (int i = 0; i < n; i++) list.add(PendingResponse.of(survey, 1, QuestionType.RATING, "3"));
        return list;
    }

    @Test
    @DisplayName("Empty batch succeeds without contacting anyone")
    void emptyBatchShouldBeNoOp() {
        assertTrue(client.transferResponsesToLeader(List.of()).successful());
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Leader sends nothing and keeps the batch in its own queue")
    void leaderShouldNotSend() {
        when(elector.isLeader()).thenReturn(true);

        assertTrue(client.transferResponsesToLeader(batch(2)).successful());

        verifyNoInteractions(transport);
        assertEquals(2, queue.size());
    }

    @Test
    @DisplayName("Leader keeping a batch while idle arms a flush cycle once")
    void leaderKeepingBatchWhileIdleShouldArm() {
        when(elector.isLeader()).thenReturn(true);

        client.transferResponsesToLeader(batch(2));
        client.transferResponsesToLeader(batch(3));

        assertEquals(1, armings.get());
        assertTrue(queue.snapshot().armed());
        assertEquals(5, queue.size());
    }

    @Test
    @DisplayName("Failed follower transfers retain the batch without arming")
    void retainedBatchShouldNotArm() {
        when(elector.currentLeaderId()).thenReturn(Optional.empty());

        client.transferResponsesToLeader(batch(2));

        assertEquals(0, armings.get());
        assertFalse(queue.snapshot().armed());
    }

    @Test
    @DisplayName("Successful transfer posts the batch with the sender id and marks the flag")
    void successfulTransferShouldSetFlag() {
        doReturn(ServiceResult.success(3, "ok")).when(transport).send(any(), any(), any());

        ServiceResult<Integer> result = client.transferResponsesToLeader(batch(3));

        ArgumentCaptor<InstanceCommunicationPayload> payload = ArgumentCaptor.forClass(InstanceCommunicationPayload.class);
        verify(transport).send(eq("l:8080"), payload.capture(), any());
        assertEquals("f:8080", payload.getValue().sourceInstanceId());
        assertEquals(CommunicationType.TRANSFER_RESPONSES, payload.getValue().communicationType());
        assertTrue(result.successful());
        assertEquals(3, result.data());
        assertTrue(client.hasTransferredResponses());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("No known leader retains the batch")
    void noLeaderShouldRetain() {
        when(elector.currentLeaderId()).thenReturn(Optional.empty());

        assertFalse(client.transferResponsesToLeader(batch(2)).successful());
        assertEquals(2, queue.size());
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Stale lease naming this instance is treated as no leader")
    void selfAsLeaderShouldRetain() {
        when(elector.currentLeaderId()).thenReturn(Optional.of("f:8080"));

        assertFalse(client.transferResponsesToLeader(batch(1)).successful());
        assertEquals(1, queue.size());
    }

    @Test
    @DisplayName("Rejected or failed transfers retain the batch once")
    void failuresShouldRetainOnce() {
        List<PendingResponse> records = batch(4);
        doReturn(ServiceResult.failure("This instance is not the leader")).when(transport).send(any(), any(), any());
        assertFalse(client.transferResponsesToLeader(records).successful());

        doThrow(new TransferException("Timed out")).when(transport).send(any(), any(), any());
        assertFalse(client.transferResponsesToLeader(records).successful());

        assertEquals(4, queue.size());
        assertFalse(client.hasTransferredResponses());
    }

    @Test
    @DisplayName("Async transfer refused by the executor retains the batch")
    void rejectedAsyncShouldRetain() {
        TransferClient rejecting = new TransferClient(elector, transport, queue, new SubmissionMetrics(), task -> {
            throw new RejectedExecutionException("closed");
        }, armings::incrementAndGet);

        ServiceResult<Integer> result = rejecting.transferResponsesToLeaderAsync(batch(2)).join();

        assertFalse(result.successful());
        assertEquals(2, queue.size());
    }

    @Test
    @DisplayName("Leader communication check sends a NoOp")
    void verifyShouldSendNoOp() {
        doReturn(ServiceResult.success(true, "Acknowledged")).when(transport).send(any(), any(), any());

        assertTrue(client.verifyLeaderCommunication().successful());

        ArgumentCaptor<InstanceCommunicationPayload> payload = ArgumentCaptor.forClass(InstanceCommunicationPayload.class);
        verify(transport).send(eq("l:8080"), payload.capture(), any());
        assertEquals(CommunicationType.NO_OP, payload.getValue().communicationType());
    }

    @Test
    @DisplayName("Leader communication check fails when the leader is unreachable")
    void verifyShouldFailWhenUnreachable() {
        doThrow(new TransferException("refused")).when(transport).send(any(), any(), any());
        assertFalse(client.verifyLeaderCommunication().successful());
    }

    @Test
    @DisplayName("Survey close request is delegated to the leader")
    void closeRequestShouldBeForwarded() {
        UUID toClose = UUID.randomUUID();
        doReturn(ServiceResult.success(true, "Survey closed successfully")).when(transport).send(any(), any(), any());

        assertTrue(client.requestSurveyClose(toClose).successful());

        ArgumentCaptor<InstanceCommunicationPayload> payload = ArgumentCaptor.forClass(InstanceCommunicationPayload.class);
        verify(transport).send(eq("l:8080"), payload.capture(), any());
        assertEquals(CommunicationType.CLOSE_SURVEY, payload.getValue().communicationType());
        assertEquals(toClose, payload.getValue().surveyId());
    }
}
