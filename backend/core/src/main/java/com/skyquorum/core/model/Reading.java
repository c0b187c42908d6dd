package com.skyquorum.core.model;

import java.time.Instant;
import java.util.Objects;

public record Reading(
        String source,
        String city,
        double temperature,
        double feelsLike,
        double humidity,
        double pressure,
        double windSpeed,
        double windDirection,
        String description,
        String icon,
        Instant observedAt
) {
    public Reading {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(city, "city is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        description = description == null ? "" : description;
        icon = icon == null ? "" : icon;
    }
}
