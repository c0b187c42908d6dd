package com.skyquorum.core.cache;

import java.time.Instant;
import java.util.Objects;

public record CacheEntry<T>(T payload, Instant expiresAt) {
    public CacheEntry {
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    /**
     * An entry stops being servable at its expiry instant.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
