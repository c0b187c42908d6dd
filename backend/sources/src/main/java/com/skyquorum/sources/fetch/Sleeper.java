package com.skyquorum.sources.fetch;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
