package com.skyquorum.core.model;

import java.time.LocalDate;
import java.util.Objects;

public record ForecastDay(
        LocalDate date,
        double maxTemp,
        double minTemp,
        double avgTemp,
        double humidity,
        double precipitation,
        String description,
        String icon
) {
    public ForecastDay {
        Objects.requireNonNull(date, "date is required");
        description = description == null ? "" : description;
        icon = icon == null ? "" : icon;
    }
}
