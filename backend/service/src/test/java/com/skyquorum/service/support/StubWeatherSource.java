package com.skyquorum.service.support;

import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;
import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import com.skyquorum.sources.api.WeatherSource;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable source: fixed temperature per city, optional failure kind, optional blocking delay.
 */
public class StubWeatherSource implements WeatherSource {
    private final String id;
    private final double temperature;
    private final Clock clock;
    private final AtomicInteger currentCalls = new AtomicInteger();
    private final AtomicInteger forecastCalls = new AtomicInteger();
    private final CountDownLatch interrupted = new CountDownLatch(1);

    private volatile FailureKind failure;
    private volatile Duration delay = Duration.ZERO;
    private volatile int forecastDays = 7;

    public StubWeatherSource(String id, double temperature, Clock clock) {
        this.id = id;
        this.temperature = temperature;
        this.clock = clock;
    }

    public StubWeatherSource failingWith(FailureKind kind) {
        this.failure = kind;
        return this;
    }

    public StubWeatherSource delayedBy(Duration delay) {
        this.delay = delay;
        return this;
    }

    public StubWeatherSource limitedTo(int days) {
        this.forecastDays = days;
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Reading fetchCurrent(String city) {
        currentCalls.incrementAndGet();
        pause();
        failIfScripted(city);
        return new Reading(id, city, temperature, temperature - 1, 60, 1013, 3, 180, "Clear sky", "01d", clock.instant());
    }

    @Override
    public List<ForecastDay> fetchForecast(String city, int days) {
        forecastCalls.incrementAndGet();
        failIfScripted(city);
        List<ForecastDay> forecast = new ArrayList<>();
        LocalDate today = LocalDate.now(clock);
        for (int i = 0; i < Math.min(days, forecastDays); i++) {
            forecast.add(new ForecastDay(today.plusDays(i), temperature + 4, temperature - 4, temperature, 60, 0.5, "Overcast", "04d"));
        }
        return forecast;
    }

    public int currentCalls() {
        return currentCalls.get();
    }

    public int forecastCalls() {
        return forecastCalls.get();
    }

    public boolean awaitInterrupted(Duration timeout) throws InterruptedException {
        return interrupted.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted.countDown();
            throw new SourceException(id, FailureKind.CANCELLED, "Fetch from " + id + " interrupted", e);
        }
    }

    private void failIfScripted(String city) {
        FailureKind kind = failure;
        if (kind == FailureKind.NOT_FOUND) {
            throw SourceException.notFound(id, city);
        }
        if (kind != null) {
            throw new SourceException(id, kind, id + " scripted failure");
        }
    }
}
