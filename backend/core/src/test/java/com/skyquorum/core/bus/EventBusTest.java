package com.skyquorum.core.bus;

import com.skyquorum.core.events.CircuitStateChanged;
import com.skyquorum.core.events.Event;
import com.skyquorum.core.events.RefreshCycleStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(RefreshCycleStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(RefreshCycleStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new RefreshCycleStarted(NOW, "scheduled", List.of("Prague")));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger cycleHits = new AtomicInteger();
        AtomicInteger circuitHits = new AtomicInteger();

        bus.subscribe(RefreshCycleStarted.class, event -> cycleHits.incrementAndGet());
        bus.subscribe(CircuitStateChanged.class, event -> circuitHits.incrementAndGet());

        bus.publish(new RefreshCycleStarted(NOW, "manual", List.of("London")));
        bus.publish(new CircuitStateChanged(NOW, "open-meteo", "CLOSED", "OPEN"));
        bus.publish(new CircuitStateChanged(NOW, "open-meteo", "OPEN", "HALF_OPEN"));

        assertEquals(1, cycleHits.get());
        assertEquals(2, circuitHits.get());
    }

    @Test
    void subscribeAllSeesEveryEventType() {
        EventBus bus = new EventBus();
        List<Event> seen = new CopyOnWriteArrayList<>();
        bus.subscribeAll(seen::add);

        bus.publish(new RefreshCycleStarted(NOW, "manual", List.of()));
        bus.publish(new CircuitStateChanged(NOW, "mock", "CLOSED", "OPEN"));

        assertEquals(2, seen.size());
        assertEquals("CircuitStateChanged", seen.get(1).type());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(RefreshCycleStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(RefreshCycleStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new RefreshCycleStarted(NOW, "scheduled", List.of("Tokyo")));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }
}
