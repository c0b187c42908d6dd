package com.skyquorum.service.api;

import com.skyquorum.core.cache.CacheStats;
import com.skyquorum.core.model.ConsensusForecast;
import com.skyquorum.core.model.RefreshStats;
import com.skyquorum.core.util.JsonUtils;
import com.skyquorum.service.coordinator.CityOutcome;
import com.skyquorum.service.coordinator.RefreshResult;
import com.skyquorum.service.coordinator.WeatherCoordinator;
import com.skyquorum.service.coordinator.WeatherUnavailableException;
import com.skyquorum.service.runtime.RefreshScheduler;
import com.skyquorum.service.runtime.SchedulerStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String BASE = "/api/v1";
    private static final int DEFAULT_FORECAST_DAYS = 3;

    private final int port;
    private final WeatherCoordinator coordinator;
    private final RefreshScheduler scheduler;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Supplier<Map<String, String>> circuitStates;
    private final Clock clock;
    private final Instant startedAt;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            WeatherCoordinator coordinator,
            RefreshScheduler scheduler,
            DiagnosticsTracker diagnosticsTracker,
            Supplier<Map<String, String>> circuitStates,
            Clock clock
    ) {
        this.port = port;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.diagnosticsTracker = diagnosticsTracker;
        this.circuitStates = circuitStates;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(8);
            server.setExecutor(executor);
            server.createContext("/", this::handleNotFound);
            server.createContext(BASE + "/health", this::handleHealth);
            server.createContext(BASE + "/metrics", this::handleMetrics);
            server.createContext(BASE + "/cities", this::handleCities);
            server.createContext(BASE + "/weather/current", this::handleCurrent);
            server.createContext(BASE + "/weather/forecast", this::handleForecast);
            server.createContext(BASE + "/refresh", this::handleRefresh);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleNotFound(HttpExchange exchange) throws IOException {
        writeJson(exchange, 404, Map.of("error", "Endpoint not found", "path", exchange.getRequestURI().getPath()));
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "GET")) {
            return;
        }
        RefreshStats stats = coordinator.getStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant());
        body.put("lastFetch", stats.lastFetchTime());
        body.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).toSeconds());
        body.put("stats", statsView(stats));
        writeJson(exchange, 200, body);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metrics", statsView(coordinator.getStats()));
        body.put("diagnostics", diagnosticsTracker.metricsSnapshot());
        body.put("timestamp", clock.instant());
        writeJson(exchange, 200, body);
    }

    private void handleCities(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("cities", scheduler.cities()));
    }

    private void handleCurrent(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "GET")) {
            return;
        }
        String city = queryParams(exchange.getRequestURI()).get("city");
        if (city == null || city.isBlank()) {
            writeJson(exchange, 400, Map.of("error", "City parameter is required"));
            return;
        }
        try {
            writeJson(exchange, 200, coordinator.getCurrent(city));
        } catch (WeatherUnavailableException e) {
            writeUnavailable(exchange, e);
        }
    }

    private void handleForecast(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "GET")) {
            return;
        }
        Map<String, String> query = queryParams(exchange.getRequestURI());
        String city = query.get("city");
        if (city == null || city.isBlank()) {
            writeJson(exchange, 400, Map.of("error", "City parameter is required"));
            return;
        }
        int days;
        try {
            days = query.containsKey("days") ? Integer.parseInt(query.get("days")) : DEFAULT_FORECAST_DAYS;
        } catch (NumberFormatException invalidDays) {
            days = -1;
        }
        if (!ConsensusForecast.isValidDayCount(days)) {
            writeJson(exchange, 400, Map.of("error", "Days parameter must be between 1 and 7"));
            return;
        }
        try {
            writeJson(exchange, 200, coordinator.getForecast(city, days));
        } catch (WeatherUnavailableException e) {
            writeUnavailable(exchange, e);
        }
    }

    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "POST")) {
            return;
        }
        String requested = queryParams(exchange.getRequestURI()).get("cities");
        List<String> targets = requested == null || requested.isBlank()
                ? List.of()
                : Arrays.stream(requested.split(",")).map(String::trim).filter(city -> !city.isEmpty()).toList();
        RefreshResult result;
        try {
            result = scheduler.triggerNow(targets).join();
        } catch (CompletionException e) {
            LOGGER.log(Level.WARNING, "Manual refresh failed", e.getCause());
            writeJson(exchange, 500, Map.of("error", "Refresh failed"));
            return;
        }
        List<Map<String, Object>> outcomes = new ArrayList<>();
        for (CityOutcome outcome : result.outcomes().values()) {
            Map<String, Object> dto = new LinkedHashMap<>();
            dto.put("city", outcome.city());
            dto.put("success", outcome.success());
            dto.put("sources", outcome.sources());
            dto.put("failures", outcome.failures());
            outcomes.add(dto);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("trigger", result.trigger());
        body.put("success", result.success());
        body.put("durationMillis", result.duration().toMillis());
        body.put("cities", outcomes);
        writeJson(exchange, 200, body);
    }

    private Map<String, Object> statsView(RefreshStats stats) {
        CacheStats cacheStats = coordinator.cache().stats();
        SchedulerStatus schedulerStatus = scheduler.status();

        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("currentEntries", cacheStats.currentEntries());
        cache.put("forecastEntries", cacheStats.forecastEntries());
        cache.put("maxSize", cacheStats.maxSize());
        cache.put("ttlSeconds", cacheStats.ttl().toSeconds());
        cache.put("evictions", cacheStats.evictions());

        Map<String, Object> schedulerView = new LinkedHashMap<>();
        schedulerView.put("running", schedulerStatus.running());
        schedulerView.put("intervalSeconds", schedulerStatus.interval().toSeconds());
        schedulerView.put("lastRunAt", schedulerStatus.lastRunAt());
        schedulerView.put("nextRunAt", schedulerStatus.nextRunAt());
        schedulerView.put("completedCycles", schedulerStatus.completedCycles());
        schedulerView.put("skippedTicks", schedulerStatus.skippedTicks());

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("lastFetchTime", stats.lastFetchTime());
        view.put("successCount", stats.successCount());
        view.put("failureCount", stats.failureCount());
        view.put("citiesTracked", stats.citiesTracked());
        view.put("cacheOccupancy", stats.cacheOccupancy());
        view.put("sources", coordinator.sourceIds());
        view.put("circuitStates", circuitStates.get());
        view.put("cache", cache);
        view.put("scheduler", schedulerView);
        return view;
    }

    private boolean ensureRoute(HttpExchange exchange, String method) throws IOException {
        String context = exchange.getHttpContext().getPath();
        if (!context.equals(exchange.getRequestURI().getPath())) {
            handleNotFound(exchange);
            return false;
        }
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            writeJson(exchange, 405, Map.of("error", "Method not allowed"));
            return false;
        }
        return true;
    }

    private void writeUnavailable(HttpExchange exchange, WeatherUnavailableException e) throws IOException {
        LOGGER.warning("Weather unavailable for " + e.city() + ": " + e.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Weather data unavailable");
        body.put("reason", e.reason().name());
        body.put("city", e.city());
        body.put("details", e.getMessage());
        writeJson(exchange, 503, body);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
