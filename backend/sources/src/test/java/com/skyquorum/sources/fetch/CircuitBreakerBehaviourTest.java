package com.skyquorum.sources.fetch;

import com.skyquorum.core.bus.EventBus;
import com.skyquorum.core.events.CircuitStateChanged;
import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import com.skyquorum.sources.support.EventCapture;
import com.skyquorum.sources.support.ScriptedTransport;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CircuitBreakerBehaviourTest {
    private static final HttpRequest REQUEST = HttpRequest.newBuilder(URI.create("http://weather.test/v1/current")).GET().build();
    private static final Duration OPEN_TIMEOUT = Duration.ofMillis(200);

    private final EventBus bus = new EventBus((event, error) -> {
        throw new AssertionError("Unexpected handler error", error);
    });
    private final EventCapture capture = new EventCapture(bus);

    @Test
    void opensAfterMinimumFailedCallsAndStopsReachingTheProvider() {
        ScriptedTransport transport = new ScriptedTransport().respond(503);
        ResilientFetcher fetcher = fetchers(transport).forSource("flaky");

        for (int i = 0; i < 3; i++) {
            SourceException error = assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));
            assertEquals(FailureKind.SERVER_ERROR, error.kind());
        }
        SourceException rejected = assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));

        assertEquals(FailureKind.BREAKER_OPEN, rejected.kind());
        assertEquals(3, transport.calls());
        assertEquals(CircuitBreaker.State.OPEN, fetcher.circuitState());

        List<CircuitStateChanged> transitions = capture.byType(CircuitStateChanged.class);
        assertEquals(1, transitions.size());
        assertEquals("flaky", transitions.get(0).source());
        assertEquals("CLOSED", transitions.get(0).fromState());
        assertEquals("OPEN", transitions.get(0).toState());
    }

    @Test
    void stayClosedWhileFailureRatioIsBelowThreshold() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(200, "a")
                .respond(503)
                .respond(200, "b")
                .respond(200, "c");
        ResilientFetcher fetcher = fetchers(transport).forSource("mostly-fine");

        fetcher.fetch(REQUEST);
        assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));
        fetcher.fetch(REQUEST);
        fetcher.fetch(REQUEST);

        assertEquals(CircuitBreaker.State.CLOSED, fetcher.circuitState());
    }

    @Test
    void successfulProbeAfterTimeoutClosesTheCircuit() throws Exception {
        ScriptedTransport transport = new ScriptedTransport().respond(500).respond(500).respond(500).respond(200, "ok");
        ResilientFetcher fetcher = fetchers(transport).forSource("recovering");
        tripOpen(fetcher);

        Thread.sleep(OPEN_TIMEOUT.toMillis() + 100);
        fetcher.fetch(REQUEST);

        assertEquals(CircuitBreaker.State.CLOSED, fetcher.circuitState());
        assertEquals(4, transport.calls());
        List<String> states = capture.byType(CircuitStateChanged.class).stream()
                .map(CircuitStateChanged::toState)
                .toList();
        assertEquals(List.of("OPEN", "HALF_OPEN", "CLOSED"), states);
    }

    @Test
    void failedProbeReopensTheCircuit() throws Exception {
        ScriptedTransport transport = new ScriptedTransport().respond(500);
        ResilientFetcher fetcher = fetchers(transport).forSource("down");
        tripOpen(fetcher);

        Thread.sleep(OPEN_TIMEOUT.toMillis() + 100);
        SourceException probe = assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));
        SourceException rejected = assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));

        assertEquals(FailureKind.SERVER_ERROR, probe.kind());
        assertEquals(FailureKind.BREAKER_OPEN, rejected.kind());
        assertEquals(4, transport.calls());
        assertEquals(CircuitBreaker.State.OPEN, fetcher.circuitState());
    }

    @Test
    void cancelledCallsDoNotCountAgainstTheSource() {
        ScriptedTransport transport = new ScriptedTransport().fail(new InterruptedException("caller gave up"));
        ResilientFetcher fetcher = fetchers(transport).forSource("cancelled");

        for (int i = 0; i < 5; i++) {
            try {
                SourceException error = assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));
                assertEquals(FailureKind.CANCELLED, error.kind());
            } finally {
                Thread.interrupted();
            }
        }

        assertEquals(CircuitBreaker.State.CLOSED, fetcher.circuitState());
        assertEquals(5, transport.calls());
    }

    @Test
    void registryKeepsOneBreakerPerSource() {
        ResilientFetchers fetchers = fetchers(new ScriptedTransport().respond(503));
        ResilientFetcher first = fetchers.forSource("a");
        fetchers.forSource("b");
        tripOpen(first);

        assertSame(first, fetchers.forSource("a"));
        assertEquals(Map.of("a", "OPEN", "b", "CLOSED"), fetchers.circuitStates());
    }

    private void tripOpen(ResilientFetcher fetcher) {
        for (int i = 0; i < 3; i++) {
            assertThrows(SourceException.class, () -> fetcher.fetch(REQUEST));
        }
        assertEquals(CircuitBreaker.State.OPEN, fetcher.circuitState());
    }

    private ResilientFetchers fetchers(ScriptedTransport transport) {
        return new ResilientFetchers(
                transport,
                RetryPolicy.none(),
                new BreakerSettings(3, 0.6, 10, OPEN_TIMEOUT),
                duration -> {
                },
                bus,
                Clock.systemUTC()
        );
    }
}
