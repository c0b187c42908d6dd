package com.skyquorum.sources.openweather;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;
import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import com.skyquorum.sources.api.SourcePayloads;
import com.skyquorum.sources.api.WeatherSource;
import com.skyquorum.sources.fetch.ResilientFetcher;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * OpenWeatherMap current conditions and the 5 day / 3 hour forecast. Forecast slots are grouped by
 * UTC date in the order the provider lists them, then folded into one entry per day.
 */
public final class OpenWeatherSource implements WeatherSource {
    public static final String ID = "openweather";
    public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org/data/2.5";
    static final int SLOTS_PER_DAY = 8;

    private final ResilientFetcher fetcher;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public OpenWeatherSource(ResilientFetcher fetcher, String baseUrl, String apiKey, Duration requestTimeout) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("OpenWeather requires an API key");
        }
        this.apiKey = apiKey;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Reading fetchCurrent(String city) {
        JsonNode root = SourcePayloads.parse(ID, fetch(city, "/weather?q=" + encode(city)));
        checkCode(root);
        JsonNode main = root.path("main");
        JsonNode wind = root.path("wind");
        JsonNode weather = root.path("weather").path(0);
        long dt = (long) SourcePayloads.requireNumber(ID, root, "dt");
        return new Reading(
                ID,
                city,
                SourcePayloads.requireNumber(ID, main, "temp"),
                main.path("feels_like").asDouble(),
                main.path("humidity").asDouble(),
                main.path("pressure").asDouble(),
                wind.path("speed").asDouble(),
                wind.path("deg").asDouble(),
                weather.path("description").asText(""),
                weather.path("icon").asText(""),
                Instant.ofEpochSecond(dt)
        );
    }

    @Override
    public List<ForecastDay> fetchForecast(String city, int days) {
        JsonNode root = SourcePayloads.parse(
                ID,
                fetch(city, "/forecast?q=" + encode(city) + "&cnt=" + days * SLOTS_PER_DAY)
        );
        checkCode(root);

        Map<LocalDate, List<JsonNode>> slotsByDay = new LinkedHashMap<>();
        for (JsonNode slot : SourcePayloads.requireArray(ID, root, "list")) {
            LocalDate date = Instant.ofEpochSecond(slot.path("dt").asLong()).atOffset(ZoneOffset.UTC).toLocalDate();
            slotsByDay.computeIfAbsent(date, ignored -> new ArrayList<>()).add(slot);
        }

        List<ForecastDay> forecast = new ArrayList<>(days);
        for (Map.Entry<LocalDate, List<JsonNode>> day : slotsByDay.entrySet()) {
            if (forecast.size() >= days) {
                break;
            }
            forecast.add(summarize(day.getKey(), day.getValue()));
        }
        return forecast;
    }

    private static ForecastDay summarize(LocalDate date, List<JsonNode> slots) {
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        double totalTemp = 0;
        double totalHumidity = 0;
        double rain = 0;
        for (JsonNode slot : slots) {
            double temp = SourcePayloads.requireNumber(ID, slot.path("main"), "temp");
            max = Math.max(max, temp);
            min = Math.min(min, temp);
            totalTemp += temp;
            totalHumidity += slot.path("main").path("humidity").asDouble();
            rain += slot.path("rain").path("3h").asDouble(0);
        }
        JsonNode weather = slots.get(0).path("weather").path(0);
        return new ForecastDay(
                date,
                max,
                min,
                totalTemp / slots.size(),
                totalHumidity / slots.size(),
                rain,
                weather.path("description").asText(""),
                weather.path("icon").asText("")
        );
    }

    private byte[] fetch(String city, String pathAndQuery) {
        URI uri = URI.create(baseUrl + pathAndQuery + "&units=metric&appid=" + encode(apiKey));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .build();
        try {
            return fetcher.fetch(request);
        } catch (SourceException e) {
            if (e.statusCode() == 404) {
                throw new SourceException(ID, FailureKind.NOT_FOUND, "OpenWeather does not know city " + city, 404, e);
            }
            throw e;
        }
    }

    // The provider echoes its status in the body: an int on /weather, a string on /forecast.
    private static void checkCode(JsonNode root) {
        JsonNode cod = root.path("cod");
        if (!cod.isMissingNode() && !"200".equals(cod.asText())) {
            throw new SourceException(ID, FailureKind.PARSE, "OpenWeather reported status " + cod.asText());
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
