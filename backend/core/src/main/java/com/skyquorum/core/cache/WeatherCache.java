package com.skyquorum.core.cache;

import com.skyquorum.core.model.ConsensusCurrent;
import com.skyquorum.core.model.ConsensusForecast;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TTL and capacity bounded store for consensus records. Current weather is keyed by city, forecasts by
 * city and day count; both stores share one capacity limit.
 *
 * <p>Reads check expiry themselves and drop what they find stale, so the background sweep only
 * reclaims memory and is never needed for correctness.
 */
public final class WeatherCache implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(WeatherCache.class.getName());

    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxSize;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry<ConsensusCurrent>> current = new HashMap<>();
    private final Map<ForecastKey, CacheEntry<ConsensusForecast>> forecasts = new HashMap<>();
    private final AtomicLong evictions = new AtomicLong();

    private ScheduledExecutorService sweeper;

    public WeatherCache(Clock clock, Duration defaultTtl, int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
    }

    public void putCurrent(String city, ConsensusCurrent weather) {
        putCurrent(city, weather, defaultTtl);
    }

    public void putCurrent(String city, ConsensusCurrent weather, Duration ttl) {
        CacheEntry<ConsensusCurrent> entry = new CacheEntry<>(weather, clock.instant().plus(ttl));
        lock.writeLock().lock();
        try {
            if (!current.containsKey(city)) {
                makeRoom();
            }
            current.put(city, entry);
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.fine(() -> "Cached current weather for " + city + " until " + entry.expiresAt());
    }

    public Optional<ConsensusCurrent> getCurrent(String city) {
        return read(current, city);
    }

    public void putForecast(String city, int days, ConsensusForecast forecast) {
        putForecast(city, days, forecast, defaultTtl);
    }

    public void putForecast(String city, int days, ConsensusForecast forecast, Duration ttl) {
        ForecastKey key = new ForecastKey(city, days);
        CacheEntry<ConsensusForecast> entry = new CacheEntry<>(forecast, clock.instant().plus(ttl));
        lock.writeLock().lock();
        try {
            if (!forecasts.containsKey(key)) {
                makeRoom();
            }
            forecasts.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.fine(() -> "Cached " + days + "-day forecast for " + city + " until " + entry.expiresAt());
    }

    public Optional<ConsensusForecast> getForecast(String city, int days) {
        return read(forecasts, new ForecastKey(city, days));
    }

    /**
     * Removes every expired entry from both stores and returns how many were dropped.
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed;
        lock.writeLock().lock();
        try {
            removed = removeExpired(current, now) + removeExpired(forecasts, now);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            LOGGER.fine("Swept " + removed + " expired cache entries");
        }
        return removed;
    }

    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "weather-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = Math.max(1, interval.toMillis());
        sweeper.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdownNow();
        sweeper = null;
    }

    public int occupancy() {
        lock.readLock().lock();
        try {
            return current.size() + forecasts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        lock.readLock().lock();
        try {
            return new CacheStats(current.size(), forecasts.size(), maxSize, defaultTtl, evictions.get());
        } finally {
            lock.readLock().unlock();
        }
    }

    private <K, V> Optional<V> read(Map<K, CacheEntry<V>> store, K key) {
        CacheEntry<V> entry;
        lock.readLock().lock();
        try {
            entry = store.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isExpired(clock.instant())) {
            return Optional.of(entry.payload());
        }

        lock.writeLock().lock();
        try {
            // A writer may have replaced the entry since the read lock was released.
            store.remove(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.fine(() -> "Dropped expired cache entry " + key);
        return Optional.empty();
    }

    // Caller holds the write lock.
    private void makeRoom() {
        while (current.size() + forecasts.size() >= maxSize) {
            if (!evictEarliestExpiring()) {
                return;
            }
        }
    }

    private boolean evictEarliestExpiring() {
        String oldestCity = null;
        Instant oldestCurrent = null;
        for (Map.Entry<String, CacheEntry<ConsensusCurrent>> entry : current.entrySet()) {
            if (oldestCurrent == null || entry.getValue().expiresAt().isBefore(oldestCurrent)) {
                oldestCity = entry.getKey();
                oldestCurrent = entry.getValue().expiresAt();
            }
        }

        ForecastKey oldestKey = null;
        Instant oldestForecast = null;
        for (Map.Entry<ForecastKey, CacheEntry<ConsensusForecast>> entry : forecasts.entrySet()) {
            if (oldestForecast == null || entry.getValue().expiresAt().isBefore(oldestForecast)) {
                oldestKey = entry.getKey();
                oldestForecast = entry.getValue().expiresAt();
            }
        }

        if (oldestCity == null && oldestKey == null) {
            return false;
        }
        evictions.incrementAndGet();
        if (oldestKey == null || (oldestCity != null && !oldestForecast.isBefore(oldestCurrent))) {
            current.remove(oldestCity);
            LOGGER.fine("Evicted current weather for " + oldestCity);
        } else {
            forecasts.remove(oldestKey);
            LOGGER.fine("Evicted forecast " + oldestKey);
        }
        return true;
    }

    private static <K, V> int removeExpired(Map<K, CacheEntry<V>> store, Instant now) {
        int removed = 0;
        Iterator<CacheEntry<V>> entries = store.values().iterator();
        while (entries.hasNext()) {
            if (entries.next().isExpired(now)) {
                entries.remove();
                removed++;
            }
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cache sweep failed", e);
        }
    }

    record ForecastKey(String city, int days) {
        @Override
        public String toString() {
            return city + "/" + days + "d";
        }
    }
}
