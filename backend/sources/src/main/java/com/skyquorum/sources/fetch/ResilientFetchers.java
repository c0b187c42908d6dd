package com.skyquorum.sources.fetch;

import com.skyquorum.core.bus.EventBus;
import com.skyquorum.core.events.CircuitStateChanged;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Hands out one {@link ResilientFetcher} per source id, all sharing a transport and retry policy but
 * each with its own breaker. Breaker transitions are logged and published on the event bus.
 */
public final class ResilientFetchers {
    private static final Logger LOGGER = Logger.getLogger(ResilientFetchers.class.getName());

    private final HttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final CircuitBreakerRegistry registry;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<String, ResilientFetcher> fetchers = new ConcurrentHashMap<>();

    public ResilientFetchers(
            HttpTransport transport,
            RetryPolicy retryPolicy,
            BreakerSettings breakerSettings,
            Sleeper sleeper,
            EventBus eventBus,
            Clock clock
    ) {
        this.transport = Objects.requireNonNull(transport, "transport is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.registry = CircuitBreakerRegistry.of(breakerSettings.toConfig());
    }

    public ResilientFetcher forSource(String sourceId) {
        return fetchers.computeIfAbsent(sourceId, this::create);
    }

    /**
     * Breaker state per source id, sorted by id.
     */
    public Map<String, String> circuitStates() {
        Map<String, String> states = new TreeMap<>();
        fetchers.forEach((id, fetcher) -> states.put(id, fetcher.circuitState().name()));
        return states;
    }

    private ResilientFetcher create(String sourceId) {
        CircuitBreaker breaker = registry.circuitBreaker(sourceId);
        breaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State from = event.getStateTransition().getFromState();
            CircuitBreaker.State to = event.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                LOGGER.warning("Circuit for " + sourceId + " opened; calls are rejected for the next wait period");
            } else {
                LOGGER.info("Circuit for " + sourceId + " moved " + from + " -> " + to);
            }
            eventBus.publish(new CircuitStateChanged(clock.instant(), sourceId, from.name(), to.name()));
        });
        return new ResilientFetcher(sourceId, transport, retryPolicy, breaker, sleeper);
    }
}
