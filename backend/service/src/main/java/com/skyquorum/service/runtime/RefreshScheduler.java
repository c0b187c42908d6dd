package com.skyquorum.service.runtime;

import com.skyquorum.service.coordinator.RefreshResult;
import com.skyquorum.service.coordinator.WeatherCoordinator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires a refresh immediately on start and then at a fixed rate. The timer only hands cycles to a
 * worker pool; a tick that arrives while the previous scheduled cycle is still running is dropped, not
 * queued. Manual triggers bypass that check and may overlap a scheduled cycle.
 */
public class RefreshScheduler {
    public enum State {
        STOPPED,
        RUNNING
    }

    private static final Logger LOGGER = Logger.getLogger(RefreshScheduler.class.getName());

    private final RefreshAction action;
    private final Supplier<List<String>> cities;
    private final Duration interval;
    private final Clock clock;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(
            daemonThreads("refresh-timer"));
    private final ExecutorService cycleExecutor = Executors.newCachedThreadPool(daemonThreads("refresh-cycle"));
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicReference<Instant> lastRunAt = new AtomicReference<>();
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicReference<List<String>> updatedCities = new AtomicReference<>();

    private State state = State.STOPPED;
    private ScheduledFuture<?> tick;

    public RefreshScheduler(RefreshAction action, Supplier<List<String>> cities, Duration interval, Clock clock) {
        this.action = Objects.requireNonNull(action, "action is required");
        this.cities = Objects.requireNonNull(cities, "cities is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public static RefreshScheduler forCoordinator(
            WeatherCoordinator coordinator,
            Supplier<List<String>> cities,
            Duration interval,
            Clock clock
    ) {
        return new RefreshScheduler(coordinator::refresh, cities, interval, clock);
    }

    public synchronized boolean start() {
        if (state == State.RUNNING) {
            return false;
        }
        if (timerExecutor.isShutdown()) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
        tick = timerExecutor.scheduleAtFixedRate(this::onTick, 0, Math.max(1, interval.toMillis()), TimeUnit.MILLISECONDS);
        state = State.RUNNING;
        LOGGER.info("Refresh scheduler started with interval " + interval);
        return true;
    }

    /**
     * Cancels future ticks. A cycle already running is left to finish.
     */
    public synchronized boolean stop() {
        if (state == State.STOPPED) {
            return false;
        }
        tick.cancel(false);
        tick = null;
        state = State.STOPPED;
        LOGGER.info("Refresh scheduler stopped");
        return true;
    }

    /**
     * Replaces the cities refreshed by scheduled cycles and by manual triggers without an explicit list.
     * A cycle already running keeps the list it started with.
     */
    public void updateCities(List<String> replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("cities are required");
        }
        List<String> normalized = replacement.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(city -> !city.isEmpty())
                .distinct()
                .toList();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("at least one city is required");
        }
        updatedCities.set(normalized);
        LOGGER.info("Scheduler cities updated to " + normalized);
    }

    public List<String> cities() {
        List<String> updated = updatedCities.get();
        return updated != null ? updated : List.copyOf(cities.get());
    }

    public CompletableFuture<RefreshResult> triggerNow(List<String> requested) {
        List<String> targets = requested == null || requested.isEmpty() ? cities() : List.copyOf(requested);
        LOGGER.info("Manual refresh requested for " + targets);
        return CompletableFuture.supplyAsync(() -> runCycle(targets, WeatherCoordinator.TRIGGER_MANUAL), cycleExecutor);
    }

    public synchronized State state() {
        return state;
    }

    public SchedulerStatus status() {
        State current;
        Instant next;
        synchronized (this) {
            current = state;
            next = nextRunAt();
        }
        return new SchedulerStatus(current, interval, lastRunAt.get(), next, completedCycles.get(), skippedTicks.get());
    }

    public void shutdown() {
        stop();
        timerExecutor.shutdown();
        cycleExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            cycleExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onTick() {
        if (!inFlight.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            LOGGER.info("Skipping scheduled refresh; previous cycle still running");
            return;
        }
        try {
            cycleExecutor.submit(() -> {
                try {
                    runCycle(cities(), WeatherCoordinator.TRIGGER_SCHEDULED);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Scheduled refresh failed", e);
                } finally {
                    inFlight.set(false);
                }
            });
        } catch (RuntimeException e) {
            inFlight.set(false);
            LOGGER.log(Level.WARNING, "Could not submit scheduled refresh", e);
        }
    }

    // Null while stopped. Guarded by this.
    private Instant nextRunAt() {
        if (state != State.RUNNING || tick == null) {
            return null;
        }
        long delayMillis = Math.max(0, tick.getDelay(TimeUnit.MILLISECONDS));
        return clock.instant().plusMillis(delayMillis);
    }

    private RefreshResult runCycle(List<String> targets, String trigger) {
        lastRunAt.set(clock.instant());
        RefreshResult result = action.refresh(targets, trigger);
        completedCycles.incrementAndGet();
        return result;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
