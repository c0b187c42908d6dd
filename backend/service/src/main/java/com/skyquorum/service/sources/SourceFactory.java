package com.skyquorum.service.sources;

import com.skyquorum.service.config.AggregatorConfig;
import com.skyquorum.sources.api.WeatherSource;
import com.skyquorum.sources.fetch.ResilientFetchers;
import com.skyquorum.sources.mock.MockWeatherSource;
import com.skyquorum.sources.openmeteo.OpenMeteoSource;
import com.skyquorum.sources.openweather.OpenWeatherSource;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the configured sources in configuration order. HTTP sources share the fetchers' transport and
 * retry policy and each gets its own breaker.
 */
public final class SourceFactory {
    private static final Logger LOGGER = Logger.getLogger(SourceFactory.class.getName());

    private SourceFactory() {
    }

    public static List<WeatherSource> create(AggregatorConfig config, ResilientFetchers fetchers, Clock clock) {
        List<WeatherSource> sources = new ArrayList<>();
        for (String name : config.sources()) {
            if (OpenMeteoSource.ID.equals(name)) {
                sources.add(new OpenMeteoSource(
                        fetchers.forSource(OpenMeteoSource.ID),
                        orDefault(config.openMeteo().baseUrl(), OpenMeteoSource.DEFAULT_BASE_URL),
                        config.requestTimeout(),
                        clock
                ));
            } else if (OpenWeatherSource.ID.equals(name)) {
                if (!config.openWeather().hasApiKey()) {
                    LOGGER.warning("Skipping openweather source: OPENWEATHER_API_KEY is not set");
                    continue;
                }
                sources.add(new OpenWeatherSource(
                        fetchers.forSource(OpenWeatherSource.ID),
                        orDefault(config.openWeather().baseUrl(), OpenWeatherSource.DEFAULT_BASE_URL),
                        config.openWeather().apiKey(),
                        config.requestTimeout()
                ));
            } else if (MockWeatherSource.ID.equals(name)) {
                sources.add(new MockWeatherSource(Path.of(config.mock().fixture()), clock));
            } else {
                throw new IllegalStateException("Unknown weather source in configuration: " + name);
            }
        }
        if (sources.isEmpty()) {
            throw new IllegalStateException("No weather source could be activated from " + config.sources());
        }
        LOGGER.info("Active weather sources: " + sources.stream().map(WeatherSource::id).toList());
        return sources;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
