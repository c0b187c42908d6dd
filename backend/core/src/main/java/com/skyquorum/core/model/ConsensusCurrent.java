package com.skyquorum.core.model;

import java.time.Instant;
import java.util.List;

public record ConsensusCurrent(
        String city,
        double temperature,
        double feelsLike,
        double humidity,
        double pressure,
        double windSpeed,
        String description,
        String icon,
        double confidence,
        List<String> sources,
        Instant lastUpdated
) {
    public ConsensusCurrent {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("consensus requires at least one contributing source");
        }
        sources = List.copyOf(sources);
    }
}
