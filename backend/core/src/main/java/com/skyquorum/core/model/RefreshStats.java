package com.skyquorum.core.model;

import java.time.Instant;

public record RefreshStats(
        Instant lastFetchTime,
        long successCount,
        long failureCount,
        int citiesTracked,
        int cacheOccupancy
) {
}
