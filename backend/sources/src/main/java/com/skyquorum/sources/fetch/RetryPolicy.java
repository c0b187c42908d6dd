package com.skyquorum.sources.fetch;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int maxRetries, Duration initialDelay, double multiplier) {
    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, 1.0);
    }

    /**
     * Wait before retry number {@code attempt} (1-based): {@code initialDelay * multiplier^(attempt-1)}.
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        double nanos = initialDelay.toNanos() * Math.pow(multiplier, attempt - 1);
        return Duration.ofNanos((long) Math.min(nanos, (double) Long.MAX_VALUE));
    }
}
