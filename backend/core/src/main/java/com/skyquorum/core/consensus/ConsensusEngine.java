package com.skyquorum.core.consensus;

import com.skyquorum.core.model.ConsensusCurrent;
import com.skyquorum.core.model.ConsensusForecast;
import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges per-source readings into one consensus record.
 *
 * <p>Numeric fields are plain means over the contributing sources. Descriptions are chosen by
 * majority; a tie goes to the description seen first while iterating the input map, so callers that
 * pass a {@link LinkedHashMap} get source-order tie breaking and everyone else gets whatever order
 * their map yields. Icons are copied from the first contributing source and are not re-derived from
 * the chosen description, so the two can disagree.
 */
public final class ConsensusEngine {
    static final double SINGLE_SOURCE_CONFIDENCE = 0.5;
    static final double VARIANCE_SCALE = 25.0;
    static final double PER_SOURCE_BONUS = 0.1;

    private final Clock clock;

    public ConsensusEngine(Clock clock) {
        this.clock = clock;
    }

    public Optional<ConsensusCurrent> mergeCurrent(String city, Map<String, Reading> readings) {
        if (readings.isEmpty()) {
            return Optional.empty();
        }

        double totalTemp = 0;
        double totalFeelsLike = 0;
        double totalHumidity = 0;
        double totalPressure = 0;
        double totalWindSpeed = 0;
        List<String> descriptions = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        List<Double> temperatures = new ArrayList<>();
        Instant latest = null;
        String icon = null;

        for (Map.Entry<String, Reading> entry : readings.entrySet()) {
            Reading reading = entry.getValue();
            totalTemp += reading.temperature();
            totalFeelsLike += reading.feelsLike();
            totalHumidity += reading.humidity();
            totalPressure += reading.pressure();
            totalWindSpeed += reading.windSpeed();
            descriptions.add(reading.description());
            sources.add(entry.getKey());
            temperatures.add(reading.temperature());
            if (latest == null || reading.observedAt().isAfter(latest)) {
                latest = reading.observedAt();
            }
            if (icon == null) {
                icon = reading.icon();
            }
        }

        double count = readings.size();
        return Optional.of(new ConsensusCurrent(
                city,
                totalTemp / count,
                totalFeelsLike / count,
                totalHumidity / count,
                totalPressure / count,
                totalWindSpeed / count,
                mostCommon(descriptions),
                icon,
                confidence(temperatures),
                sources,
                latest
        ));
    }

    /**
     * Merges the first {@code days} entries of every source that supplied at least that many.
     * Empty when no source covers the requested horizon.
     */
    public Optional<ConsensusForecast> mergeForecast(String city, Map<String, List<ForecastDay>> forecasts, int days) {
        if (!ConsensusForecast.isValidDayCount(days)) {
            throw new IllegalArgumentException("days must be between "
                    + ConsensusForecast.MIN_DAYS + " and " + ConsensusForecast.MAX_DAYS + ": " + days);
        }

        List<String> sources = new ArrayList<>();
        List<List<ForecastDay>> usable = new ArrayList<>();
        for (Map.Entry<String, List<ForecastDay>> entry : forecasts.entrySet()) {
            if (entry.getValue().size() >= days) {
                sources.add(entry.getKey());
                usable.add(entry.getValue().subList(0, days));
            }
        }
        if (usable.isEmpty()) {
            return Optional.empty();
        }

        List<ForecastDay> merged = new ArrayList<>(days);
        for (int day = 0; day < days; day++) {
            merged.add(mergeDay(usable, day));
        }
        return Optional.of(new ConsensusForecast(city, days, merged, sources, clock.instant()));
    }

    private static ForecastDay mergeDay(List<List<ForecastDay>> usable, int day) {
        double totalMax = 0;
        double totalMin = 0;
        double totalAvg = 0;
        double totalHumidity = 0;
        double totalPrecipitation = 0;
        List<String> descriptions = new ArrayList<>();
        LocalDate date = null;

        for (List<ForecastDay> forecast : usable) {
            ForecastDay entry = forecast.get(day);
            totalMax += entry.maxTemp();
            totalMin += entry.minTemp();
            totalAvg += entry.avgTemp();
            totalHumidity += entry.humidity();
            totalPrecipitation += entry.precipitation();
            descriptions.add(entry.description());
            if (date == null) {
                date = entry.date();
            }
        }

        double count = usable.size();
        return new ForecastDay(
                date,
                totalMax / count,
                totalMin / count,
                totalAvg / count,
                totalHumidity / count,
                totalPrecipitation / count,
                mostCommon(descriptions),
                usable.get(0).get(day).icon()
        );
    }

    /**
     * 0.5 for a lone source. Otherwise one minus the population variance of the temperatures
     * (scaled by 25 and capped at 1), plus 0.1 for every source beyond the first, clamped to [0, 1].
     */
    static double confidence(List<Double> temperatures) {
        int n = temperatures.size();
        if (n <= 1) {
            return SINGLE_SOURCE_CONFIDENCE;
        }

        double mean = 0;
        for (double temperature : temperatures) {
            mean += temperature;
        }
        mean /= n;

        double variance = 0;
        for (double temperature : temperatures) {
            double diff = temperature - mean;
            variance += diff * diff;
        }
        variance /= n;

        double normalizedVariance = Math.min(1.0, variance / VARIANCE_SCALE);
        double confidence = 1.0 - normalizedVariance + PER_SOURCE_BONUS * (n - 1);
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    static String mostCommon(List<String> values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        String winner = "";
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return winner;
    }
}
