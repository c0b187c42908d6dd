package com.skyquorum.service.coordinator;

public class WeatherUnavailableException extends RuntimeException {
    public enum Reason {
        ALL_SOURCES_FAILED,
        NOT_AVAILABLE
    }

    private final String city;
    private final Reason reason;

    public WeatherUnavailableException(String city, Reason reason, String message) {
        super(message);
        this.city = city;
        this.reason = reason;
    }

    public String city() {
        return city;
    }

    public Reason reason() {
        return reason;
    }
}
