package com.skyquorum.sources.mock;

import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;
import com.skyquorum.core.util.JsonUtils;
import com.skyquorum.sources.api.SourceException;
import com.skyquorum.sources.api.WeatherSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves fixed weather from a JSON fixture. Readings are stamped with the clock's current instant and
 * forecast days start at the clock's current date.
 */
public class MockWeatherSource implements WeatherSource {
    public static final String ID = "mock";

    private final String id;
    private final Clock clock;
    private final Map<String, CityEntry> cities = new ConcurrentHashMap<>();

    public MockWeatherSource(Path jsonFile, Clock clock) {
        this(ID, jsonFile, clock);
    }

    public MockWeatherSource(String id, Path jsonFile, Clock clock) {
        this.id = id;
        this.clock = clock;
        try (InputStream in = Files.newInputStream(jsonFile)) {
            WeatherFixture fixture = JsonUtils.objectMapper().readValue(in, WeatherFixture.class);
            fixture.cities().forEach(entry -> cities.put(entry.city(), entry));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading weather fixture: " + jsonFile, e);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Reading fetchCurrent(String city) {
        CityEntry entry = lookup(city);
        return new Reading(
                id,
                city,
                entry.temperature(),
                entry.feelsLike(),
                entry.humidity(),
                entry.pressure(),
                entry.windSpeed(),
                entry.windDirection(),
                entry.description(),
                entry.icon(),
                clock.instant()
        );
    }

    @Override
    public List<ForecastDay> fetchForecast(String city, int days) {
        CityEntry entry = lookup(city);
        List<DayEntry> fixtureDays = entry.forecast() == null ? List.of() : entry.forecast();
        LocalDate today = LocalDate.now(clock);
        List<ForecastDay> forecast = new ArrayList<>();
        for (int i = 0; i < Math.min(days, fixtureDays.size()); i++) {
            DayEntry day = fixtureDays.get(i);
            forecast.add(new ForecastDay(
                    today.plusDays(i),
                    day.maxTemp(),
                    day.minTemp(),
                    (day.maxTemp() + day.minTemp()) / 2,
                    day.humidity(),
                    day.precipitation(),
                    day.description(),
                    day.icon()
            ));
        }
        return forecast;
    }

    public List<String> cities() {
        return cities.keySet().stream().sorted().toList();
    }

    private CityEntry lookup(String city) {
        CityEntry entry = cities.get(city);
        if (entry == null) {
            throw SourceException.notFound(id, city);
        }
        return entry;
    }

    private record WeatherFixture(List<CityEntry> cities) {
    }

    private record CityEntry(
            String city,
            double temperature,
            double feelsLike,
            double humidity,
            double pressure,
            double windSpeed,
            double windDirection,
            String description,
            String icon,
            List<DayEntry> forecast
    ) {
    }

    private record DayEntry(
            double maxTemp,
            double minTemp,
            double humidity,
            double precipitation,
            String description,
            String icon
    ) {
    }
}
