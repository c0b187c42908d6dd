package com.skyquorum.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.skyquorum.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    public static final String CONFIG_FILE = "skyquorum.json";

    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    /**
     * Reads {@code skyquorum.json} from the directory, or starts from defaults when the file is absent,
     * then applies environment overrides.
     */
    public static AggregatorConfig load(Path configDir, Map<String, String> env) {
        Path file = configDir.resolve(CONFIG_FILE);
        AggregatorConfig config;
        if (Files.exists(file)) {
            config = read(file, new TypeReference<>() {
            });
        } else {
            LOGGER.info("No " + file + " found; using default configuration");
            config = AggregatorConfig.defaults();
        }
        return applyEnvironment(config, env);
    }

    static AggregatorConfig applyEnvironment(AggregatorConfig config, Map<String, String> env) {
        AggregatorConfig result = config;
        String apiKey = env.get("OPENWEATHER_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            result = result.withOpenWeatherApiKey(apiKey.trim());
        }
        String port = env.get("SKYQUORUM_PORT");
        if (port != null && !port.isBlank()) {
            try {
                result = result.withPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("SKYQUORUM_PORT is not a number: " + port, e);
            }
        }
        String cities = env.get("DEFAULT_CITIES");
        if (cities != null && !cities.isBlank()) {
            List<String> parsed = Arrays.stream(cities.split(","))
                    .map(String::trim)
                    .filter(city -> !city.isEmpty())
                    .toList();
            result = result.withDefaultCities(parsed);
        }
        String interval = env.get("FETCH_INTERVAL");
        if (interval != null && !interval.isBlank()) {
            try {
                result = result.withFetchInterval(Duration.parse(interval.trim()));
            } catch (DateTimeParseException e) {
                throw new IllegalStateException("FETCH_INTERVAL must be an ISO-8601 duration: " + interval, e);
            }
        }
        return result;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
