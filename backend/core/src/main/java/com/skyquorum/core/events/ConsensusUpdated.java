package com.skyquorum.core.events;

import java.time.Instant;
import java.util.List;

public record ConsensusUpdated(
        Instant timestamp,
        String city,
        double temperature,
        double confidence,
        List<String> sources,
        int forecastVariants
) implements Event {
    @Override
    public String type() {
        return "ConsensusUpdated";
    }
}
