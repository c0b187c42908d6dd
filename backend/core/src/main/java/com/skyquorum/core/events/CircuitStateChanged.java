package com.skyquorum.core.events;

import java.time.Instant;

public record CircuitStateChanged(
        Instant timestamp,
        String source,
        String fromState,
        String toState
) implements Event {
    @Override
    public String type() {
        return "CircuitStateChanged";
    }
}
