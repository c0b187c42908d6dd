package com.skyquorum.service.runtime;

import java.time.Duration;
import java.time.Instant;

public record SchedulerStatus(
        RefreshScheduler.State state,
        Duration interval,
        Instant lastRunAt,
        Instant nextRunAt,
        long completedCycles,
        long skippedTicks
) {
    public boolean running() {
        return state == RefreshScheduler.State.RUNNING;
    }
}
