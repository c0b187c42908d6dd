package com.skyquorum.sources.api;

public enum FailureKind {
    TRANSPORT(true),
    RATE_LIMITED(true),
    CLIENT_REJECTED(false),
    SERVER_ERROR(true),
    PARSE(false),
    BREAKER_OPEN(false),
    NOT_FOUND(false),
    CANCELLED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    /**
     * 2xx is not a failure and has no kind; callers check success first.
     */
    public static FailureKind forStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return CLIENT_REJECTED;
        }
        return SERVER_ERROR;
    }
}
