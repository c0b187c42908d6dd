package com.skyquorum.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-city readings and forecasts collected from every source that answered during one refresh cycle.
 * Maps keep the order in which sources were configured.
 */
public record Snapshot(
        String city,
        Map<String, Reading> current,
        Map<String, List<ForecastDay>> forecasts,
        Instant capturedAt
) {
    public Snapshot {
        Objects.requireNonNull(city, "city is required");
        Objects.requireNonNull(capturedAt, "capturedAt is required");
        current = Collections.unmodifiableMap(new LinkedHashMap<>(current));
        Map<String, List<ForecastDay>> copied = new LinkedHashMap<>();
        forecasts.forEach((source, days) -> copied.put(source, List.copyOf(days)));
        forecasts = Collections.unmodifiableMap(copied);
    }

    public boolean hasCurrent() {
        return !current.isEmpty();
    }
}
