package com.skyquorum.sources.fetch;

import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Breaker trips once the rolling window holds at least {@code minimumRequests} calls and the failed
 * share reaches {@code failureRatio}. While open it rejects everything for {@code openTimeout}, then
 * admits a single probe.
 */
public record BreakerSettings(int minimumRequests, double failureRatio, int windowSize, Duration openTimeout) {
    public BreakerSettings {
        Objects.requireNonNull(openTimeout, "openTimeout is required");
        if (minimumRequests < 1) {
            throw new IllegalArgumentException("minimumRequests must be at least 1");
        }
        if (failureRatio <= 0 || failureRatio > 1) {
            throw new IllegalArgumentException("failureRatio must be in (0, 1]");
        }
        if (windowSize < minimumRequests) {
            throw new IllegalArgumentException("windowSize must be at least minimumRequests");
        }
    }

    public static BreakerSettings defaults() {
        return new BreakerSettings(3, 0.6, 10, Duration.ofSeconds(30));
    }

    CircuitBreakerConfig toConfig() {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(windowSize)
                .minimumNumberOfCalls(minimumRequests)
                .failureRateThreshold((float) (failureRatio * 100.0))
                .waitDurationInOpenState(openTimeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .ignoreException(BreakerSettings::isCancellation)
                .writableStackTraceEnabled(false)
                .build();
    }

    // A call abandoned by its caller says nothing about the provider's health.
    private static boolean isCancellation(Throwable error) {
        return error instanceof SourceException && ((SourceException) error).kind() == FailureKind.CANCELLED;
    }
}
