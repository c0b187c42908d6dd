package com.skyquorum.service.coordinator;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record RefreshResult(String trigger, Instant startedAt, Instant completedAt, Map<String, CityOutcome> outcomes) {
    public RefreshResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public boolean success() {
        return outcomes.values().stream().allMatch(CityOutcome::success);
    }

    public List<String> succeededCities() {
        return outcomes.values().stream().filter(CityOutcome::success).map(CityOutcome::city).toList();
    }

    public List<String> failedCities() {
        return outcomes.values().stream().filter(outcome -> !outcome.success()).map(CityOutcome::city).toList();
    }

    public Optional<CityOutcome> outcome(String city) {
        return Optional.ofNullable(outcomes.get(city));
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }
}
