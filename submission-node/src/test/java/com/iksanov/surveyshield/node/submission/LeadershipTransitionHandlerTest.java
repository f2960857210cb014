package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.InstanceCommunicationPayload;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.common.exception.TransferException;
import com.iksanov.surveyshield.node.anonymization.PassThroughTextAnonymizer;
import com.iksanov.surveyshield.node.config.DssConfig;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.election.LeadershipChange;
import com.iksanov.surveyshield.node.election.MutableClock;
import com.iksanov.surveyshield.node.event.EventChannel;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.transfer.LeaderTransport;
import com.iksanov.surveyshield.node.transfer.TransferClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LeadershipTransitionHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private final LeaderElector elector = mock(LeaderElector.class);
    private final LeaderTransport transport = mock(LeaderTransport.class);
    private final AtomicInteger statusPublications = new AtomicInteger();
    private final UUID survey = UUID.randomUUID();
    private SubmissionQueue queue;
    private DelayScheduler scheduler;
    private EventChannel<LeadershipChange> changes;

    @BeforeEach
    void setUp() {
        when(elector.instanceId()).thenReturn("a:8080");
        when(elector.currentLeaderId()).thenReturn(Optional.of("b:8080"));
        DssConfig config = DssConfig.defaults();
        SubmissionMetrics metrics = new SubmissionMetrics();
        RecordingResponseRepository repository = new RecordingResponseRepository();
        queue = new SubmissionQueue(config.minPercentage());
        scheduler = new DelayScheduler(queue, new FlushPlanner(3, new Random(5)), new ResponseSubmitter(repository, new PassThroughTextAnonymizer(), metrics),
                repository, elector, config, new Random(5), new MutableClock(NOW), metrics, Executors.newSingleThreadScheduledExecutor());
        TransferClient transferClient = new TransferClient(elector, transport, queue, metrics, Runnable::run, scheduler::armCold);
        changes = EventChannel.direct("leadership");
        new LeadershipTransitionHandler(scheduler, queue, transferClient, statusPublications::incrementAndGet).register(changes);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Promotion arms the scheduler even with an empty queue")
    void promotionShouldArmUnconditionally() {
        when(elector.isLeader()).thenReturn(true);

        changes.publish(new LeadershipChange("a:8080", true, "a:8080", NOW));

        assertTrue(scheduler.isArmed());
        assertNotNull(queue.snapshot().nextFlushTime());
        assertEquals(1, statusPublications.get());
    }

    @Test
    @DisplayName("Demotion with 7 queued records stops the scheduler and transfers all 7 in one call")
    void demotionShouldDrainInOneShot() {
        when(elector.isLeader()).thenReturn(true);
        queue.enqueue(Responses.ratings(survey, 7));
        scheduler.armCold();
        when(elector.isLeader()).thenReturn(false);
        doReturn(ServiceResult.success(7, "ok")).when(transport).send(any(), any(), any());

        changes.publish(new LeadershipChange("a:8080", false, "b:8080", NOW));

        ArgumentCaptor<InstanceCommunicationPayload> payload = ArgumentCaptor.forClass(InstanceCommunicationPayload.class);
        verify(transport, times(1)).send(eq("b:8080"), payload.capture(), any());
        assertEquals(7, payload.getValue().responses().size());
        assertEquals(0, queue.size());
        assertFalse(scheduler.isArmed());
        assertEquals(1, statusPublications.get());
    }

    @Test
    @DisplayName("Failed handover on demotion keeps the records locally")
    void failedDemotionHandoverShouldRetain() {
        queue.enqueue(Responses.ratings(survey, 7));
        when(elector.isLeader()).thenReturn(false);
        doThrow(new TransferException("refused")).when(transport).send(any(), any(), any());

        changes.publish(new LeadershipChange("a:8080", false, "b:8080", NOW));

        assertEquals(7, queue.size());
        assertFalse(scheduler.isArmed());
    }

    @Test
    @DisplayName("Demotion with an empty queue makes no transfer")
    void demotionWithEmptyQueueShouldNotTransfer() {
        when(elector.isLeader()).thenReturn(false);

        changes.publish(new LeadershipChange("a:8080", false, null, NOW));

        verifyNoInteractions(transport);
    }
}
