package com.skyquorum.core.events;

import java.time.Instant;
import java.util.List;

public record RefreshCycleStarted(Instant timestamp, String trigger, List<String> cities) implements Event {
    @Override
    public String type() {
        return "RefreshCycleStarted";
    }
}
