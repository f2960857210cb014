package com.iksanov.surveyshield.node.submission;

import com.iksanov.surveyshield.common.dto.PendingResponse;
import com.iksanov.surveyshield.node.anonymization.PassThroughTextAnonymizer;
import com.iksanov.surveyshield.node.config.DssConfig;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.election.MutableClock;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link DelayScheduler}.
 * <p>
 * Cycles are run directly; the armed timers sit far in the future and are cancelled on teardown.
 */
class DelaySchedulerTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private RecordingResponseRepository repository;
    private SubmissionQueue queue;
    private LeaderElector elector;
    private MutableClock clock;
    private DelayScheduler scheduler;
    private final UUID survey = UUID.randomUUID();

    private DelayScheduler schedulerWith(DssConfig config) {
        return schedulerWith(config, new SubmissionMetrics());
    }

    private DelayScheduler schedulerWith(DssConfig config, SubmissionMetrics metrics) {
        queue = new SubmissionQueue(config.minPercentage());
        return new DelayScheduler(queue, new FlushPlanner(config.minimumSurveySubmissions(), new Random(7)),
                new ResponseSubmitter(repository, new PassThroughTextAnonymizer(), metrics), repository, elector, config,
                new Random(7), clock, metrics, Executors.newSingleThreadScheduledExecutor());
    }

    private static DssConfig config(int resetChance) {
        DssConfig d = DssConfig.defaults();
        return new DssConfig(30, 70, 2, resetChance, 3, d.coldDelayMin(), d.coldDelayMax(), d.warmDelayMin(), d.warmDelayMax(), false);
    }

    @BeforeEach
    void setUp() {
        repository = new RecordingResponseRepository();
        repository.questionCounts.put(survey, 3);
        elector = mock(LeaderElector.class);
        when(elector.isLeader()).thenReturn(true);
        clock = new MutableClock(START);
        scheduler = schedulerWith(config(0));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Cycle persists the capped share, records the flush and re-arms with a warm delay")
    void cycleShouldPersistAndRearmWarm() {
        queue.enqueue(Responses.ratings(survey, 12));

        DelayScheduler.CycleOutcome outcome = scheduler.runCycle();

        assertEquals(new DelayScheduler.CycleOutcome(3, true, true), outcome);
        assertEquals(3, repository.saved().size());
        ScheduleState state = queue.snapshot();
        assertEquals(9, state.pending());
        assertEquals(3, state.lastFlushAmount());
        assertEquals(START, state.lastFlushTime());
        assertEquals(32, state.currentPercentage());
        assertTrue(scheduler.isArmed());
        Duration delay = Duration.between(START, state.nextFlushTime());
        assertTrue(delay.compareTo(Duration.ofSeconds(30)) >= 0 && delay.compareTo(Duration.ofSeconds(90)) <= 0, "warm delay " + delay);
    }

    @Test
    @DisplayName("Repeated cycles never take a survey below its floor, then go idle")
    void cyclesShouldStopAtFloor() {
        queue.enqueue(Responses.ratings(survey, 30));

        int cycles = 0;
        do {
            scheduler.runCycle();
            assertTrue(queue.size() >= 9);
            cycles++;
        } while (scheduler.isArmed() && cycles < 20);

        assertEquals(4, cycles);
        assertEquals(9, queue.size());
        assertEquals(21, repository.saved().size());
        assertFalse(scheduler.isArmed());
        assertNull(queue.snapshot().nextFlushTime());
    }

    @Test
    @DisplayName("Cycle with nothing eligible disarms and resets the percentage")
    void emptyCycleShouldDisarm() {
        queue.enqueue(Responses.ratings(survey, 9));
        queue.adjustPercentage(p -> 44);
        scheduler.armWarm();

        DelayScheduler.CycleOutcome outcome = scheduler.runCycle();

        assertEquals(new DelayScheduler.CycleOutcome(0, false, false), outcome);
        assertFalse(scheduler.isArmed());
        assertEquals(30, queue.snapshot().currentPercentage());
        assertTrue(repository.savedBatches.isEmpty());
    }

    @Test
    @DisplayName("Responses queued while an empty cycle goes idle arm the next cycle")
    void enqueueDuringEmptyCycleShouldRearm() {
        scheduler.shutdown();
        AtomicBoolean raced = new AtomicBoolean(false);
        // recordFlushCycle runs after the selection is taken and before the cycle decides to go idle
        SubmissionMetrics racing = new SubmissionMetrics() {
            @Override
            public void recordFlushCycle(boolean empty) {
                super.recordFlushCycle(empty);
                if (raced.compareAndSet(false, true)) {
                    assertFalse(queue.enqueue(Responses.ratings(survey, 10)).armingClaimed());
                }
            }
        };
        scheduler = schedulerWith(config(0), racing);
        assertTrue(queue.enqueue(Responses.ratings(survey, 5)).armingClaimed());
        scheduler.armCold();

        DelayScheduler.CycleOutcome outcome = scheduler.runCycle();

        assertEquals(new DelayScheduler.CycleOutcome(0, false, true), outcome);
        assertTrue(scheduler.isArmed());
        ScheduleState state = queue.snapshot();
        assertTrue(state.armed());
        assertEquals(15, state.pending());
        assertNotNull(state.nextFlushTime());
        assertFalse(state.nextFlushTime().isBefore(START.plus(DssConfig.defaults().coldDelayMin())));

        DelayScheduler.CycleOutcome next = scheduler.runCycle();

        assertEquals(5, next.selected());
        assertEquals(5, repository.saved().size());
    }

    @Test
    @DisplayName("Cycle on a non-leader does nothing and disarms")
    void nonLeaderCycleShouldSkip() {
        when(elector.isLeader()).thenReturn(false);
        queue.enqueue(Responses.ratings(survey, 12));
        scheduler.armCold();

        assertSame(DelayScheduler.CycleOutcome.SKIPPED, scheduler.runCycle());
        assertFalse(scheduler.isArmed());
        assertEquals(12, queue.size());
    }

    @Test
    @DisplayName("Persistence failure returns the selection to the queue and keeps the percentage")
    void persistenceFailureShouldReturnRecords() {
        queue.enqueue(Responses.ratings(survey, 12));
        repository.failSaves = true;

        DelayScheduler.CycleOutcome outcome = scheduler.runCycle();

        assertFalse(outcome.persisted());
        assertTrue(outcome.rearmed());
        assertEquals(12, queue.size());
        assertEquals(30, queue.snapshot().currentPercentage());
        assertNull(queue.snapshot().lastFlushTime());
    }

    @Test
    @DisplayName("Survey whose question count cannot be read is skipped, others still flush")
    void unreadableCountShouldSkipOnlyThatSurvey() {
        UUID broken = UUID.randomUUID();
        repository.unreadableSurveys.add(broken);
        queue.enqueue(Responses.ratings(survey, 12));
        queue.enqueue(Responses.ratings(broken, 50));

        scheduler.runCycle();

        assertTrue(repository.saved().stream().map(PendingResponse::surveyId).allMatch(survey::equals));
        assertEquals(3, repository.saved().size());
    }

    @Test
    @DisplayName("Certain reset sends the percentage back to the minimum after a flush")
    void resetChanceShouldResetPercentage() {
        scheduler.shutdown();
        scheduler = schedulerWith(config(100));
        queue.enqueue(Responses.ratings(survey, 100));
        queue.adjustPercentage(p -> 60);

        scheduler.runCycle();

        assertEquals(30, queue.snapshot().currentPercentage());
    }

    @Test
    @DisplayName("Percentage ratchets up but never beyond the maximum")
    void percentageShouldBeCapped() {
        assertEquals(32, scheduler.nextPercentage(30));
        assertEquals(70, scheduler.nextPercentage(69));
        assertEquals(70, scheduler.nextPercentage(70));
    }

    @Test
    @DisplayName("Arming from idle draws from the cold window")
    void armColdShouldUseColdWindow() {
        scheduler.armCold();

        Duration delay = Duration.between(START, queue.snapshot().nextFlushTime());
        assertTrue(delay.compareTo(Duration.ofMinutes(15)) >= 0 && delay.compareTo(Duration.ofMinutes(59)) <= 0, "cold delay " + delay);
        assertTrue(scheduler.isArmed());
    }

    @Test
    @DisplayName("Nothing is armed after shutdown")
    void shutdownShouldPreventArming() {
        scheduler.shutdown();
        scheduler.armCold();

        assertFalse(scheduler.isArmed());
        assertNull(queue.snapshot().nextFlushTime());
    }
}
