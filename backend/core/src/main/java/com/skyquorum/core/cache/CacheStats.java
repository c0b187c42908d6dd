package com.skyquorum.core.cache;

import java.time.Duration;

public record CacheStats(int currentEntries, int forecastEntries, int maxSize, Duration ttl, long evictions) {
    public int occupancy() {
        return currentEntries + forecastEntries;
    }
}
