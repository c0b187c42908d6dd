package com.skyquorum.sources.api;

import com.skyquorum.core.model.ForecastDay;
import com.skyquorum.core.model.Reading;

import java.util.List;

/**
 * One weather provider. Implementations own their city lookup and wire parsing and report every
 * failure as a {@link SourceException}; a city they cannot resolve is {@link FailureKind#NOT_FOUND}.
 */
public interface WeatherSource {
    String id();

    Reading fetchCurrent(String city);

    /**
     * Returns at most {@code days} entries in date order, starting today.
     */
    List<ForecastDay> fetchForecast(String city, int days);
}
