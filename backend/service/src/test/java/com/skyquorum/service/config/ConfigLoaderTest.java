package com.skyquorum.service.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-empty-");

        AggregatorConfig config = ConfigLoader.load(dir, Map.of());

        assertEquals(AggregatorConfig.DEFAULT_SOURCES, config.sources());
        assertFalse(config.sources().contains("mock"));
        assertEquals(Duration.ofMinutes(15), config.fetchInterval());
        assertEquals(AggregatorConfig.DEFAULT_CITIES, config.defaultCities());
        assertEquals(Duration.ofMinutes(10), config.cache().ttl());
        assertEquals(1000, config.cache().maxSize());
        assertEquals(3, config.retry().maxRetries());
        assertEquals(Duration.ofSeconds(1), config.retry().delay());
        assertEquals(2.0, config.retry().multiplier());
        assertEquals(3, config.circuitBreaker().threshold());
        assertEquals(Duration.ofSeconds(30), config.circuitBreaker().timeout());
        assertEquals(8080, config.server().port());
        assertEquals(3, config.forecastDays());
        assertFalse(config.openWeather().hasApiKey());
        assertEquals("config/mock-weather.json", config.mock().fixture());
    }

    @Test
    void shippedConfigUsesLiveProvidersOnly() {
        AggregatorConfig config = ConfigLoader.load(Path.of("../../config"), Map.of());

        assertEquals(List.of("open-meteo", "openweather"), config.sources());
        assertFalse(config.sources().contains("mock"));
    }

    @Test
    void fileValuesOverrideDefaultsAndAbsentKeysKeepThem() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE), """
                {
                  "sources": ["mock"],
                  "fetchInterval": "PT5M",
                  "defaultCities": ["Tokyo"],
                  "cache": {"ttl": "PT2M"},
                  "retry": {"maxRetries": 1, "delay": "PT0.5S", "multiplier": 3.0},
                  "circuitBreaker": {"threshold": 5, "timeout": "PT10S"},
                  "forecastDays": 7,
                  "server": {"port": 9090},
                  "mock": {"fixture": "fixtures/mock-weather.json"},
                  "unknownKey": true
                }
                """);

        AggregatorConfig config = ConfigLoader.load(dir, Map.of());

        assertEquals(List.of("mock"), config.sources());
        assertEquals(Duration.ofMinutes(5), config.fetchInterval());
        assertEquals(List.of("Tokyo"), config.defaultCities());
        assertEquals(Duration.ofMinutes(2), config.cache().ttl());
        assertEquals(1000, config.cache().maxSize());
        assertEquals(1, config.retry().maxRetries());
        assertEquals(Duration.ofMillis(500), config.retry().delay());
        assertEquals(5, config.circuitBreaker().threshold());
        assertEquals(0.6, config.circuitBreaker().failureRatio());
        assertEquals(Duration.ofSeconds(10), config.circuitBreaker().timeout());
        assertEquals(7, config.forecastDays());
        assertEquals(9090, config.server().port());
        assertEquals("fixtures/mock-weather.json", config.mock().fixture());
    }

    @Test
    void environmentOverridesFileValues() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-env-");
        Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE), """
                {"defaultCities": ["Tokyo"], "server": {"port": 9090}}
                """);

        AggregatorConfig config = ConfigLoader.load(dir, Map.of(
                "OPENWEATHER_API_KEY", " secret ",
                "SKYQUORUM_PORT", "7070",
                "DEFAULT_CITIES", "Prague, London,,Sydney",
                "FETCH_INTERVAL", "PT30S"
        ));

        assertTrue(config.openWeather().hasApiKey());
        assertEquals("secret", config.openWeather().apiKey());
        assertEquals(7070, config.server().port());
        assertEquals(List.of("Prague", "London", "Sydney"), config.defaultCities());
        assertEquals(Duration.ofSeconds(30), config.fetchInterval());
    }

    @Test
    void invalidEnvironmentValuesFailFast() {
        AggregatorConfig defaults = AggregatorConfig.defaults();

        IllegalStateException badPort = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.applyEnvironment(defaults, Map.of("SKYQUORUM_PORT", "http")));
        assertTrue(badPort.getMessage().contains("SKYQUORUM_PORT"));

        IllegalStateException badInterval = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.applyEnvironment(defaults, Map.of("FETCH_INTERVAL", "15m")));
        assertTrue(badInterval.getMessage().contains("FETCH_INTERVAL"));
    }

    @Test
    void invalidFileFailsFastWithPathInMessage() throws Exception {
        Path malformed = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(malformed.resolve(ConfigLoader.CONFIG_FILE), "{not-json");

        IllegalStateException invalid = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.load(malformed, Map.of()));
        assertTrue(invalid.getMessage().contains(ConfigLoader.CONFIG_FILE));

        Path outOfRange = Files.createTempDirectory("config-loader-range-");
        Files.writeString(outOfRange.resolve(ConfigLoader.CONFIG_FILE), """
                {"forecastDays": 9}
                """);

        IllegalStateException range = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.load(outOfRange, Map.of()));
        assertTrue(range.getMessage().contains(ConfigLoader.CONFIG_FILE));
    }
}
