package com.skyquorum.service.api;

import com.skyquorum.core.bus.EventBus;
import com.skyquorum.core.events.AlertRaised;
import com.skyquorum.core.events.CircuitStateChanged;
import com.skyquorum.core.events.Event;
import com.skyquorum.core.events.RefreshCycleCompleted;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, SourceStatus> sourceStatuses = new ConcurrentHashMap<>();
    private final AtomicReference<RefreshCycleCompleted> lastCycle = new AtomicReference<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this(clock);
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(CircuitStateChanged.class, this::onCircuitStateChanged);
        eventBus.subscribe(RefreshCycleCompleted.class, lastCycle::set);
    }

    private DiagnosticsTracker(Clock clock) {
        this.clock = clock;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC());
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("sources", sourcesSnapshot());
        metrics.put("lastCycle", lastCycleSnapshot());
        return metrics;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, Object> sources = new TreeMap<>();
        for (Map.Entry<String, SourceStatus> entry : sourceStatuses.entrySet()) {
            sources.put(entry.getKey(), entry.getValue().toMap());
        }
        return sources;
    }

    private Map<String, Object> lastCycleSnapshot() {
        RefreshCycleCompleted cycle = lastCycle.get();
        Map<String, Object> map = new HashMap<>();
        if (cycle == null) {
            return map;
        }
        map.put("completedAt", cycle.timestamp().toString());
        map.put("trigger", cycle.trigger());
        map.put("durationMillis", cycle.durationMillis());
        map.put("succeededCities", cycle.succeededCities());
        map.put("failedCities", cycle.failedCities());
        map.put("success", cycle.success());
        return map;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty()) {
            Instant first = recentEventTimestamps.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentEventTimestamps.removeFirst();
            } else {
                break;
            }
        }
    }

    private void onAlertRaised(AlertRaised event) {
        if (!AlertRaised.CATEGORY_SOURCE.equals(event.category()) || event.details() == null) {
            return;
        }
        Object source = event.details().get("source");
        if (!(source instanceof String sourceId) || sourceId.isBlank()) {
            return;
        }
        sourceStatuses.compute(sourceId, (id, current) -> {
            SourceStatus status = current == null ? SourceStatus.empty() : current;
            return status.withFailure(event.timestamp(), event.message());
        });
    }

    private void onCircuitStateChanged(CircuitStateChanged event) {
        sourceStatuses.compute(event.source(), (id, current) -> {
            SourceStatus status = current == null ? SourceStatus.empty() : current;
            return status.withCircuitState(event.toState(), event.timestamp());
        });
    }

    private record SourceStatus(
            long failures,
            Instant lastFailureAt,
            String lastErrorMessage,
            String circuitState,
            Instant circuitChangedAt
    ) {
        private static SourceStatus empty() {
            return new SourceStatus(0, null, null, "CLOSED", null);
        }

        private SourceStatus withFailure(Instant at, String message) {
            return new SourceStatus(failures + 1, at, message, circuitState, circuitChangedAt);
        }

        private SourceStatus withCircuitState(String state, Instant at) {
            return new SourceStatus(failures, lastFailureAt, lastErrorMessage, state, at);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("failures", failures);
            map.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("circuitState", circuitState);
            map.put("circuitChangedAt", circuitChangedAt == null ? null : circuitChangedAt.toString());
            return map;
        }
    }
}
