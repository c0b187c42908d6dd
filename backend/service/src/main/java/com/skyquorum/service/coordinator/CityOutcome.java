package com.skyquorum.service.coordinator;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one city within a refresh cycle. {@code sources} lists the sources whose current reading
 * made it into the consensus; {@code failures} maps source id to a short failure description.
 */
public record CityOutcome(String city, boolean success, List<String> sources, Map<String, String> failures) {
    public CityOutcome {
        Objects.requireNonNull(city, "city is required");
        sources = List.copyOf(sources);
        failures = Map.copyOf(failures);
    }

    static CityOutcome succeeded(String city, List<String> sources, Map<String, String> failures) {
        return new CityOutcome(city, true, sources, failures);
    }

    static CityOutcome failed(String city, Map<String, String> failures) {
        return new CityOutcome(city, false, List.of(), failures);
    }
}
