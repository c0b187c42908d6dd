package com.skyquorum.service.coordinator;

import com.skyquorum.core.bus.EventBus;
import com.skyquorum.core.cache.WeatherCache;
import com.skyquorum.core.consensus.ConsensusEngine;
import com.skyquorum.core.events.AlertRaised;
import com.skyquorum.core.events.ConsensusUpdated;
import com.skyquorum.core.events.RefreshCycleCompleted;
import com.skyquorum.core.events.RefreshCycleStarted;
import com.skyquorum.core.model.ConsensusCurrent;
import com.skyquorum.core.model.ConsensusForecast;
import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;
import com.skyquorum.core.model.RefreshStats;
import com.skyquorum.core.model.Snapshot;
import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import com.skyquorum.sources.api.WeatherSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Runs refresh cycles and serves consensus weather cache-first.
 *
 * <p>A cycle submits one task per (city, source) pair to the fetch pool. Each task asks its source for
 * current weather and then for a forecast; the two calls fail independently. The calling thread joins
 * the tasks city by city against one deadline. Once the deadline has passed, tasks that already
 * finished are still used and the rest are cancelled with interruption. A city is aggregated as soon as
 * all of its tasks are settled, so cities finished before the deadline keep their cached results.
 */
public final class WeatherCoordinator {
    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_MANUAL = "manual";
    public static final String TRIGGER_ON_DEMAND = "on-demand";

    private static final Logger LOGGER = Logger.getLogger(WeatherCoordinator.class.getName());

    private final List<WeatherSource> sources;
    private final ConsensusEngine consensusEngine;
    private final WeatherCache cache;
    private final EventBus eventBus;
    private final Clock clock;
    private final ExecutorService fetchPool;
    private final Settings settings;

    private final ReentrantReadWriteLock snapshotLock = new ReentrantReadWriteLock();
    private final Map<String, Snapshot> snapshots = new HashMap<>();
    private final LongAdder successCount = new LongAdder();
    private final LongAdder failureCount = new LongAdder();
    private final AtomicReference<Instant> lastFetchTime = new AtomicReference<>();

    public WeatherCoordinator(
            List<WeatherSource> sources,
            ConsensusEngine consensusEngine,
            WeatherCache cache,
            EventBus eventBus,
            Clock clock,
            ExecutorService fetchPool,
            Settings settings
    ) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one weather source is required");
        }
        this.sources = List.copyOf(sources);
        this.consensusEngine = Objects.requireNonNull(consensusEngine, "consensusEngine is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.fetchPool = Objects.requireNonNull(fetchPool, "fetchPool is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public RefreshResult refreshNow(Collection<String> cities) {
        return refresh(cities, settings.refreshDeadline(), TRIGGER_MANUAL);
    }

    public RefreshResult refresh(Collection<String> cities, String trigger) {
        return refresh(cities, settings.refreshDeadline(), trigger);
    }

    public RefreshResult refresh(Collection<String> cities, Duration deadline, String trigger) {
        List<String> targets = normalize(cities);
        Instant startedAt = clock.instant();
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        eventBus.publish(new RefreshCycleStarted(startedAt, trigger, targets));
        LOGGER.info("Refresh (" + trigger + ") started for " + targets.size() + " cities");

        Map<String, List<Future<SourceResult>>> pending = new LinkedHashMap<>();
        for (String city : targets) {
            List<Future<SourceResult>> tasks = new ArrayList<>(sources.size());
            for (WeatherSource source : sources) {
                tasks.add(fetchPool.submit(() -> fetchFromSource(source, city)));
            }
            pending.put(city, tasks);
        }

        Map<String, CityOutcome> outcomes = new LinkedHashMap<>();
        boolean interrupted = false;
        for (Map.Entry<String, List<Future<SourceResult>>> entry : pending.entrySet()) {
            String city = entry.getKey();
            List<SourceResult> results = new ArrayList<>();
            Map<String, String> failures = new LinkedHashMap<>();
            List<Future<SourceResult>> tasks = entry.getValue();
            for (int i = 0; i < tasks.size(); i++) {
                Future<SourceResult> task = tasks.get(i);
                String sourceId = sources.get(i).id();
                if (interrupted) {
                    task.cancel(true);
                    failures.put(sourceId, "refresh interrupted");
                    continue;
                }
                try {
                    long remaining = Math.max(0, deadlineNanos - System.nanoTime());
                    results.add(task.get(remaining, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    task.cancel(true);
                    failures.put(sourceId, "deadline exceeded");
                } catch (CancellationException e) {
                    failures.put(sourceId, "cancelled");
                } catch (ExecutionException e) {
                    failures.put(sourceId, describe(e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    task.cancel(true);
                    failures.put(sourceId, "refresh interrupted");
                }
            }
            outcomes.put(city, completeCity(city, results, failures));
        }

        Instant completedAt = clock.instant();
        lastFetchTime.set(completedAt);
        RefreshResult result = new RefreshResult(trigger, startedAt, completedAt, outcomes);
        eventBus.publish(new RefreshCycleCompleted(
                completedAt,
                trigger,
                result.succeededCities().size(),
                result.failedCities().size(),
                result.duration().toMillis()
        ));
        LOGGER.info("Refresh (" + trigger + ") finished: " + result.succeededCities().size() + " ok, "
                + result.failedCities().size() + " failed in " + result.duration().toMillis() + " ms");
        return result;
    }

    public ConsensusCurrent getCurrent(String city) {
        String key = requireCity(city);
        Optional<ConsensusCurrent> cached = cache.getCurrent(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        LOGGER.fine(() -> "Cache miss for current weather in " + key);
        RefreshResult result = refresh(List.of(key), settings.onDemandDeadline(), TRIGGER_ON_DEMAND);
        return cache.getCurrent(key).orElseThrow(() -> unavailable(key, result, "current weather"));
    }

    public ConsensusForecast getForecast(String city, int days) {
        String key = requireCity(city);
        if (!ConsensusForecast.isValidDayCount(days)) {
            throw new IllegalArgumentException("days must be between "
                    + ConsensusForecast.MIN_DAYS + " and " + ConsensusForecast.MAX_DAYS);
        }
        Optional<ConsensusForecast> cached = cache.getForecast(key, days);
        if (cached.isPresent()) {
            return cached.get();
        }

        LOGGER.fine(() -> "Cache miss for " + days + "-day forecast in " + key);
        RefreshResult result = refresh(List.of(key), settings.onDemandDeadline(), TRIGGER_ON_DEMAND);
        return cache.getForecast(key, days).orElseThrow(() -> unavailable(key, result, days + "-day forecast"));
    }

    public RefreshStats getStats() {
        return new RefreshStats(
                lastFetchTime.get(),
                successCount.sum(),
                failureCount.sum(),
                trackedCities().size(),
                cache.occupancy()
        );
    }

    public Optional<Snapshot> snapshot(String city) {
        snapshotLock.readLock().lock();
        try {
            return Optional.ofNullable(snapshots.get(city));
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    public List<String> trackedCities() {
        snapshotLock.readLock().lock();
        try {
            return List.copyOf(new TreeSet<>(snapshots.keySet()));
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    public List<String> sourceIds() {
        return sources.stream().map(WeatherSource::id).toList();
    }

    public WeatherCache cache() {
        return cache;
    }

    private SourceResult fetchFromSource(WeatherSource source, String city) {
        Reading reading = null;
        String currentError = null;
        try {
            reading = source.fetchCurrent(city);
        } catch (RuntimeException e) {
            currentError = describe(e);
            reportSourceFailure(source.id(), city, "current weather", e);
        }

        List<ForecastDay> forecast = null;
        try {
            forecast = source.fetchForecast(city, settings.forecastDays());
        } catch (RuntimeException e) {
            reportSourceFailure(source.id(), city, "forecast", e);
        }
        return new SourceResult(source.id(), reading, forecast, currentError);
    }

    private CityOutcome completeCity(String city, List<SourceResult> results, Map<String, String> failures) {
        Map<String, Reading> current = new LinkedHashMap<>();
        Map<String, List<ForecastDay>> forecasts = new LinkedHashMap<>();
        for (SourceResult result : results) {
            if (result.reading() != null) {
                current.put(result.sourceId(), result.reading());
            } else {
                failures.put(result.sourceId(), result.currentError());
            }
            if (result.forecast() != null && !result.forecast().isEmpty()) {
                forecasts.put(result.sourceId(), result.forecast());
            }
        }

        if (current.isEmpty()) {
            failureCount.increment();
            LOGGER.warning("All sources failed for " + city + ": " + failures);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    AlertRaised.CATEGORY_CITY,
                    "All sources failed for city " + city,
                    Map.of("city", city, "failures", Map.copyOf(failures))
            ));
            return CityOutcome.failed(city, failures);
        }

        Snapshot snapshot = new Snapshot(city, current, forecasts, clock.instant());
        snapshotLock.writeLock().lock();
        try {
            snapshots.put(city, snapshot);
        } finally {
            snapshotLock.writeLock().unlock();
        }
        aggregate(snapshot);
        successCount.increment();
        return CityOutcome.succeeded(city, new ArrayList<>(current.keySet()), failures);
    }

    private void aggregate(Snapshot snapshot) {
        String city = snapshot.city();
        ConsensusCurrent consensus = consensusEngine.mergeCurrent(city, snapshot.current()).orElseThrow();
        cache.putCurrent(city, consensus);

        int variants = 0;
        for (int days = ConsensusForecast.MIN_DAYS; days <= ConsensusForecast.MAX_DAYS; days++) {
            Optional<ConsensusForecast> forecast = consensusEngine.mergeForecast(city, snapshot.forecasts(), days);
            if (forecast.isPresent()) {
                cache.putForecast(city, days, forecast.get());
                variants++;
            }
        }

        eventBus.publish(new ConsensusUpdated(
                clock.instant(),
                city,
                consensus.temperature(),
                consensus.confidence(),
                consensus.sources(),
                variants
        ));
        LOGGER.fine(() -> "Consensus for " + city + " from " + consensus.sources()
                + " confidence " + consensus.confidence());
    }

    private void reportSourceFailure(String sourceId, String city, String what, RuntimeException error) {
        if (error instanceof SourceException && ((SourceException) error).kind() == FailureKind.CANCELLED) {
            LOGGER.fine(() -> sourceId + " " + what + " for " + city + " cancelled");
            return;
        }
        LOGGER.warning(sourceId + " failed to fetch " + what + " for " + city + ": " + error.getMessage());
        Map<String, Object> details = new HashMap<>();
        details.put("source", sourceId);
        details.put("city", city);
        if (error instanceof SourceException) {
            details.put("kind", ((SourceException) error).kind().name());
        }
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.CATEGORY_SOURCE,
                sourceId + " failed to fetch " + what + " for " + city + ": " + error.getMessage(),
                details
        ));
    }

    private static WeatherUnavailableException unavailable(String city, RefreshResult result, String what) {
        boolean allFailed = result.outcome(city).map(outcome -> !outcome.success()).orElse(false);
        if (allFailed) {
            return new WeatherUnavailableException(
                    city,
                    WeatherUnavailableException.Reason.ALL_SOURCES_FAILED,
                    "All sources failed for city " + city
            );
        }
        return new WeatherUnavailableException(
                city,
                WeatherUnavailableException.Reason.NOT_AVAILABLE,
                "No " + what + " available for city " + city
        );
    }

    private static String describe(Throwable error) {
        if (error instanceof SourceException) {
            SourceException sourceError = (SourceException) error;
            return sourceError.kind() + ": " + sourceError.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static String requireCity(String city) {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("city is required");
        }
        return city.trim();
    }

    private static List<String> normalize(Collection<String> cities) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String city : cities) {
            if (city != null && !city.isBlank()) {
                unique.add(city.trim());
            }
        }
        return List.copyOf(unique);
    }

    private record SourceResult(
            String sourceId,
            Reading reading,
            List<ForecastDay> forecast,
            String currentError
    ) {
    }

    /**
     * @param forecastDays      days requested from every source per cycle
     * @param refreshDeadline   bound on scheduled and manual cycles
     * @param onDemandDeadline  bound on the single-city cycle behind a cache miss
     */
    public record Settings(int forecastDays, Duration refreshDeadline, Duration onDemandDeadline) {
        public Settings {
            if (!ConsensusForecast.isValidDayCount(forecastDays)) {
                throw new IllegalArgumentException("forecastDays must be between "
                        + ConsensusForecast.MIN_DAYS + " and " + ConsensusForecast.MAX_DAYS);
            }
            Objects.requireNonNull(refreshDeadline, "refreshDeadline is required");
            Objects.requireNonNull(onDemandDeadline, "onDemandDeadline is required");
        }

        public static Settings defaults() {
            return new Settings(3, Duration.ofSeconds(60), Duration.ofSeconds(30));
        }
    }
}
