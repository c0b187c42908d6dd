package com.skyquorum.service;

import com.skyquorum.core.bus.EventBus;
import com.skyquorum.core.cache.WeatherCache;
import com.skyquorum.core.consensus.ConsensusEngine;
import com.skyquorum.service.api.ApiServer;
import com.skyquorum.service.api.DiagnosticsTracker;
import com.skyquorum.service.config.AggregatorConfig;
import com.skyquorum.service.config.ConfigLoader;
import com.skyquorum.service.coordinator.WeatherCoordinator;
import com.skyquorum.service.runtime.RefreshScheduler;
import com.skyquorum.service.sources.SourceFactory;
import com.skyquorum.sources.api.WeatherSource;
import com.skyquorum.sources.fetch.BreakerSettings;
import com.skyquorum.sources.fetch.HttpTransport;
import com.skyquorum.sources.fetch.ResilientFetchers;
import com.skyquorum.sources.fetch.RetryPolicy;
import com.skyquorum.sources.fetch.Sleeper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        AggregatorConfig config = ConfigLoader.load(configDir, System.getenv());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock);

        ResilientFetchers fetchers = new ResilientFetchers(
                HttpTransport.create(config.requestTimeout()),
                new RetryPolicy(config.retry().maxRetries(), config.retry().delay(), config.retry().multiplier()),
                new BreakerSettings(
                        config.circuitBreaker().threshold(),
                        config.circuitBreaker().failureRatio(),
                        config.circuitBreaker().windowSize(),
                        config.circuitBreaker().timeout()
                ),
                Sleeper.system(),
                eventBus,
                clock
        );
        List<WeatherSource> sources = SourceFactory.create(config, fetchers, clock);

        WeatherCache cache = new WeatherCache(clock, config.cache().ttl(), config.cache().maxSize());
        cache.startSweeper(config.cache().sweepInterval());

        int poolSize = Math.min(32, Math.max(4, sources.size() * config.defaultCities().size()));
        ExecutorService fetchPool = Executors.newFixedThreadPool(poolSize);
        WeatherCoordinator coordinator = new WeatherCoordinator(
                sources,
                new ConsensusEngine(clock),
                cache,
                eventBus,
                clock,
                fetchPool,
                new WeatherCoordinator.Settings(
                        config.forecastDays(),
                        config.refreshDeadline(),
                        config.onDemandDeadline()
                )
        );

        List<String> cities = config.defaultCities();
        RefreshScheduler scheduler = RefreshScheduler.forCoordinator(coordinator, () -> cities, config.fetchInterval(), clock);
        ApiServer apiServer = new ApiServer(
                config.server().port(),
                coordinator,
                scheduler,
                diagnosticsTracker,
                fetchers::circuitStates,
                clock
        );

        apiServer.start();
        scheduler.start();
        LOGGER.info("Weather aggregation running for " + cities + " with sources " + coordinator.sourceIds());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            scheduler.shutdown();
            apiServer.stop();
            fetchPool.shutdownNow();
            try {
                fetchPool.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cache.close();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not load logging.properties: " + e.getMessage());
        }
    }
}
