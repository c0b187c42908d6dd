package com.skyquorum.service.config;

import java.time.Duration;
import java.util.List;

/**
 * Service configuration as read from {@code config/skyquorum.json}. Every key is optional; absent
 * values fall back to the defaults below.
 */
public record AggregatorConfig(
        List<String> sources,
        Duration fetchInterval,
        List<String> defaultCities,
        CacheSettings cache,
        RetrySettings retry,
        CircuitBreakerSettings circuitBreaker,
        Duration requestTimeout,
        Duration refreshDeadline,
        Duration onDemandDeadline,
        Integer forecastDays,
        ServerSettings server,
        EndpointSettings openMeteo,
        OpenWeatherSettings openWeather,
        MockSettings mock
) {
    /**
     * Live providers only. {@code mock} serves fixture data and must be listed explicitly.
     */
    public static final List<String> DEFAULT_SOURCES = List.of("open-meteo", "openweather");
    public static final List<String> DEFAULT_CITIES = List.of("Prague", "London", "NewYork");

    public AggregatorConfig {
        sources = sources == null || sources.isEmpty() ? DEFAULT_SOURCES : List.copyOf(sources);
        fetchInterval = positiveOr(fetchInterval, Duration.ofMinutes(15), "fetchInterval");
        defaultCities = defaultCities == null || defaultCities.isEmpty() ? DEFAULT_CITIES : List.copyOf(defaultCities);
        cache = cache == null ? new CacheSettings(null, null, null) : cache;
        retry = retry == null ? new RetrySettings(null, null, null) : retry;
        circuitBreaker = circuitBreaker == null ? new CircuitBreakerSettings(null, null, null, null) : circuitBreaker;
        requestTimeout = positiveOr(requestTimeout, Duration.ofSeconds(10), "requestTimeout");
        refreshDeadline = positiveOr(refreshDeadline, Duration.ofSeconds(60), "refreshDeadline");
        onDemandDeadline = positiveOr(onDemandDeadline, Duration.ofSeconds(30), "onDemandDeadline");
        forecastDays = forecastDays == null ? 3 : forecastDays;
        if (forecastDays < 1 || forecastDays > 7) {
            throw new IllegalArgumentException("forecastDays must be between 1 and 7");
        }
        server = server == null ? new ServerSettings(null) : server;
        openMeteo = openMeteo == null ? new EndpointSettings(null) : openMeteo;
        openWeather = openWeather == null ? new OpenWeatherSettings(null, null) : openWeather;
        mock = mock == null ? new MockSettings(null) : mock;
    }

    public static AggregatorConfig defaults() {
        return new AggregatorConfig(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public AggregatorConfig withFetchInterval(Duration interval) {
        return new AggregatorConfig(sources, interval, defaultCities, cache, retry, circuitBreaker, requestTimeout,
                refreshDeadline, onDemandDeadline, forecastDays, server, openMeteo, openWeather, mock);
    }

    public AggregatorConfig withDefaultCities(List<String> cities) {
        return new AggregatorConfig(sources, fetchInterval, cities, cache, retry, circuitBreaker, requestTimeout,
                refreshDeadline, onDemandDeadline, forecastDays, server, openMeteo, openWeather, mock);
    }

    public AggregatorConfig withPort(int port) {
        return new AggregatorConfig(sources, fetchInterval, defaultCities, cache, retry, circuitBreaker, requestTimeout,
                refreshDeadline, onDemandDeadline, forecastDays, new ServerSettings(port), openMeteo, openWeather, mock);
    }

    public AggregatorConfig withOpenWeatherApiKey(String apiKey) {
        return new AggregatorConfig(sources, fetchInterval, defaultCities, cache, retry, circuitBreaker, requestTimeout,
                refreshDeadline, onDemandDeadline, forecastDays, server, openMeteo,
                new OpenWeatherSettings(openWeather.baseUrl(), apiKey), mock);
    }

    private static Duration positiveOr(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public record CacheSettings(Duration ttl, Integer maxSize, Duration sweepInterval) {
        public CacheSettings {
            ttl = positiveOr(ttl, Duration.ofMinutes(10), "cache.ttl");
            maxSize = maxSize == null ? 1000 : maxSize;
            sweepInterval = positiveOr(sweepInterval, Duration.ofMinutes(1), "cache.sweepInterval");
        }
    }

    public record RetrySettings(Integer maxRetries, Duration delay, Double multiplier) {
        public RetrySettings {
            maxRetries = maxRetries == null ? 3 : maxRetries;
            delay = delay == null ? Duration.ofSeconds(1) : delay;
            multiplier = multiplier == null ? 2.0 : multiplier;
        }
    }

    /**
     * {@code threshold} is the number of calls the window must hold before the failure ratio is judged.
     */
    public record CircuitBreakerSettings(Integer threshold, Double failureRatio, Integer windowSize, Duration timeout) {
        public CircuitBreakerSettings {
            threshold = threshold == null ? 3 : threshold;
            failureRatio = failureRatio == null ? 0.6 : failureRatio;
            windowSize = windowSize == null ? 10 : windowSize;
            timeout = positiveOr(timeout, Duration.ofSeconds(30), "circuitBreaker.timeout");
        }
    }

    public record ServerSettings(Integer port) {
        public ServerSettings {
            port = port == null ? 8080 : port;
        }
    }

    public record EndpointSettings(String baseUrl) {
    }

    public record OpenWeatherSettings(String baseUrl, String apiKey) {
        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record MockSettings(String fixture) {
        public MockSettings {
            fixture = fixture == null || fixture.isBlank() ? "config/mock-weather.json" : fixture;
        }
    }
}
