package com.skyquorum.sources.api;

import java.util.Objects;

public class SourceException extends RuntimeException {
    private final String sourceId;
    private final FailureKind kind;
    private final int statusCode;

    public SourceException(String sourceId, FailureKind kind, String message) {
        this(sourceId, kind, message, -1, null);
    }

    public SourceException(String sourceId, FailureKind kind, String message, Throwable cause) {
        this(sourceId, kind, message, -1, cause);
    }

    public SourceException(String sourceId, FailureKind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId is required");
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.statusCode = statusCode;
    }

    public static SourceException forStatus(String sourceId, int statusCode, String target) {
        return new SourceException(
                sourceId,
                FailureKind.forStatus(statusCode),
                "HTTP " + statusCode + " from " + target,
                statusCode,
                null
        );
    }

    public static SourceException notFound(String sourceId, String city) {
        return new SourceException(sourceId, FailureKind.NOT_FOUND, "City not known to " + sourceId + ": " + city);
    }

    public String sourceId() {
        return sourceId;
    }

    public FailureKind kind() {
        return kind;
    }

    /**
     * HTTP status behind the failure, or -1 when the failure did not come from a response.
     */
    public int statusCode() {
        return statusCode;
    }

    public boolean retryable() {
        return kind.retryable();
    }
}
