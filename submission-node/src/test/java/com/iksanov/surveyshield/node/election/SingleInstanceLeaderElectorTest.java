package com.iksanov.surveyshield.node.election;

import com.iksanov.surveyshield.node.event.EventChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SingleInstanceLeaderElectorTest {

    @Test
    @DisplayName("Single instance is leader and ready immediately after start")
    void shouldLeadAfterStart() {
        EventChannel<LeadershipChange> changes = EventChannel.direct("single");
        List<LeadershipChange> published = new CopyOnWriteArrayList<>();
        changes.subscribe(published::add);
        SingleInstanceLeaderElector elector = new SingleInstanceLeaderElector("solo:8080", changes, Clock.systemUTC());

        assertFalse(elector.isLeader());
        elector.start();

        assertTrue(elector.isLeader());
        assertTrue(elector.isReady());
        assertTrue(elector.awaitReady(Duration.ZERO));
        assertEquals(Optional.of("solo:8080"), elector.currentLeaderId());
        assertEquals(1, published.size());
        assertTrue(published.get(0).isPromotion());

        elector.stop();
        assertFalse(elector.isLeader());
        assertTrue(published.get(1).isDemotion());
    }
}
