package com.skyquorum.core.model;

import java.time.Instant;
import java.util.List;

public record ConsensusForecast(
        String city,
        int dayCount,
        List<ForecastDay> days,
        List<String> sources,
        Instant lastUpdated
) {
    public static final int MIN_DAYS = 1;
    public static final int MAX_DAYS = 7;

    public ConsensusForecast {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("consensus requires at least one contributing source");
        }
        if (days.size() != dayCount) {
            throw new IllegalArgumentException("expected " + dayCount + " days but got " + days.size());
        }
        sources = List.copyOf(sources);
        days = List.copyOf(days);
    }

    public static boolean isValidDayCount(int days) {
        return days >= MIN_DAYS && days <= MAX_DAYS;
    }
}
