package com.skyquorum.core.events;

import java.time.Instant;

public record RefreshCycleCompleted(
        Instant timestamp,
        String trigger,
        int succeededCities,
        int failedCities,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RefreshCycleCompleted";
    }

    public boolean success() {
        return failedCities == 0;
    }
}
