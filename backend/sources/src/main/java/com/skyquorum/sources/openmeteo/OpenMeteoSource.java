package com.skyquorum.sources.openmeteo;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;
import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import com.skyquorum.sources.api.SourcePayloads;
import com.skyquorum.sources.api.WeatherSource;
import com.skyquorum.sources.fetch.ResilientFetcher;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Open-Meteo needs coordinates rather than names, so only cities in the coordinate table are served.
 * It has no feels-like temperature and no daily humidity; the reading reuses the air temperature and
 * forecast humidity is reported as zero.
 */
public final class OpenMeteoSource implements WeatherSource {
    public static final String ID = "open-meteo";
    public static final String DEFAULT_BASE_URL = "https://api.open-meteo.com/v1";
    public static final Map<String, Coordinates> DEFAULT_COORDINATES = Map.of(
            "Prague", new Coordinates(50.0755, 14.4378),
            "London", new Coordinates(51.5074, -0.1278),
            "NewYork", new Coordinates(40.7128, -74.0060),
            "Tokyo", new Coordinates(35.6762, 139.6503),
            "Sydney", new Coordinates(-33.8688, 151.2093)
    );

    private static final String CURRENT_FIELDS =
            "temperature_2m,relative_humidity_2m,pressure_msl,wind_speed_10m,wind_direction_10m,weather_code";
    private static final String DAILY_FIELDS =
            "temperature_2m_max,temperature_2m_min,precipitation_sum,weather_code";

    private final ResilientFetcher fetcher;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final Map<String, Coordinates> coordinates;
    private final Clock clock;

    public OpenMeteoSource(ResilientFetcher fetcher, String baseUrl, Duration requestTimeout, Clock clock) {
        this(fetcher, baseUrl, requestTimeout, DEFAULT_COORDINATES, clock);
    }

    public OpenMeteoSource(
            ResilientFetcher fetcher,
            String baseUrl,
            Duration requestTimeout,
            Map<String, Coordinates> coordinates,
            Clock clock
    ) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl is required"));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        this.coordinates = Map.copyOf(coordinates);
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Reading fetchCurrent(String city) {
        Coordinates location = locate(city);
        JsonNode root = SourcePayloads.parse(ID, fetcher.fetch(request(location, "&current=" + CURRENT_FIELDS)));
        JsonNode current = root.path("current");
        if (!current.isObject()) {
            throw new SourceException(ID, FailureKind.PARSE, "Open-Meteo response has no current block");
        }

        double temperature = SourcePayloads.requireNumber(ID, current, "temperature_2m");
        int code = current.path("weather_code").asInt(-1);
        return new Reading(
                ID,
                city,
                temperature,
                temperature,
                current.path("relative_humidity_2m").asDouble(),
                current.path("pressure_msl").asDouble(),
                current.path("wind_speed_10m").asDouble(),
                current.path("wind_direction_10m").asDouble(),
                WeatherCodes.description(code),
                WeatherCodes.icon(code),
                observedAt(current.path("time").asText(""))
        );
    }

    @Override
    public List<ForecastDay> fetchForecast(String city, int days) {
        Coordinates location = locate(city);
        JsonNode root = SourcePayloads.parse(
                ID,
                fetcher.fetch(request(location, "&daily=" + DAILY_FIELDS + "&forecast_days=" + days))
        );
        JsonNode daily = root.path("daily");
        JsonNode dates = SourcePayloads.requireArray(ID, daily, "time");
        JsonNode maxTemps = SourcePayloads.requireArray(ID, daily, "temperature_2m_max");
        JsonNode minTemps = SourcePayloads.requireArray(ID, daily, "temperature_2m_min");
        JsonNode precipitation = daily.path("precipitation_sum");
        JsonNode codes = daily.path("weather_code");

        int count = Math.min(days, dates.size());
        List<ForecastDay> forecast = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (!maxTemps.path(i).isNumber() || !minTemps.path(i).isNumber()) {
                throw new SourceException(ID, FailureKind.PARSE, "Open-Meteo daily temperatures incomplete at day " + i);
            }
            double max = maxTemps.get(i).asDouble();
            double min = minTemps.get(i).asDouble();
            int code = codes.path(i).asInt(-1);
            forecast.add(new ForecastDay(
                    parseDate(dates.get(i).asText("")),
                    max,
                    min,
                    (max + min) / 2,
                    0,
                    precipitation.path(i).asDouble(0),
                    WeatherCodes.description(code),
                    WeatherCodes.icon(code)
            ));
        }
        return forecast;
    }

    private Coordinates locate(String city) {
        Coordinates location = coordinates.get(city);
        if (location == null) {
            throw SourceException.notFound(ID, city);
        }
        return location;
    }

    private HttpRequest request(Coordinates location, String query) {
        URI uri = URI.create(baseUrl + "/forecast?latitude=" + location.latitude()
                + "&longitude=" + location.longitude() + query);
        return HttpRequest.newBuilder(uri)
                .GET()
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .build();
    }

    // Open-Meteo reports local ISO times without an offset; timezone defaults to GMT.
    private Instant observedAt(String time) {
        if (time.isBlank()) {
            return clock.instant();
        }
        try {
            return LocalDateTime.parse(time).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException local) {
            try {
                return Instant.parse(time);
            } catch (DateTimeParseException e) {
                e.addSuppressed(local);
                throw new SourceException(ID, FailureKind.PARSE, "Bad observation time from Open-Meteo: " + time, e);
            }
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new SourceException(ID, FailureKind.PARSE, "Bad forecast date from Open-Meteo: " + value, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
