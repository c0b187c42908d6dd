package com.skyquorum.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String CATEGORY_SOURCE = "source";
    public static final String CATEGORY_CITY = "city";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
