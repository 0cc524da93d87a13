package com.kotsin.margin.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RiskEventDispatcher
 */
class RiskEventDispatcherTest {

    private final RiskEventDispatcher dispatcher = new RiskEventDispatcher();

    private static RiskEngineEvent event(RiskEngineEventType type) {
        return RiskEngineEvent.of(type, "acc-1", RiskEngineEvent.Severity.INFO, "test", null,
                Instant.parse("2026-01-16T10:00:00Z"));
    }

    @Test
    @DisplayName("Listeners receive events in registration order")
    void testOrdering() {
        List<String> calls = new ArrayList<>();
        dispatcher.register(e -> calls.add("first:" + e.getType()));
        dispatcher.register(e -> calls.add("second:" + e.getType()));

        dispatcher.dispatch(event(RiskEngineEventType.WARNING_THRESHOLD));
        dispatcher.dispatch(event(RiskEngineEventType.DANGER_THRESHOLD));

        assertEquals(List.of(
                "first:WARNING_THRESHOLD", "second:WARNING_THRESHOLD",
                "first:DANGER_THRESHOLD", "second:DANGER_THRESHOLD"), calls);
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void testFailingListener() {
        List<RiskEngineEvent> received = new ArrayList<>();
        dispatcher.register(e -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.register(received::add);

        dispatcher.dispatch(event(RiskEngineEventType.LOSSCUT_DETECTED));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Unregistered listeners stop receiving events")
    void testUnregister() {
        List<RiskEngineEvent> received = new ArrayList<>();
        RiskEventListener listener = received::add;
        dispatcher.register(listener);
        dispatcher.unregister(listener);

        dispatcher.dispatch(event(RiskEngineEventType.ALERT_GENERATED));

        assertTrue(received.isEmpty());
        assertEquals(0, dispatcher.listenerCount());
    }
}
