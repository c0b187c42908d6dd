package com.skyquorum.sources.fetch;

import com.skyquorum.sources.api.FailureKind;
import com.skyquorum.sources.api.SourceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Issues requests for one source. Every call passes through that source's circuit breaker, and inside
 * the breaker retryable failures are attempted again with exponential backoff. The breaker sees one
 * outcome per call, after all retries.
 */
public final class ResilientFetcher {
    private static final Logger LOGGER = Logger.getLogger(ResilientFetcher.class.getName());

    private final String sourceId;
    private final HttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final Sleeper sleeper;

    public ResilientFetcher(
            String sourceId,
            HttpTransport transport,
            RetryPolicy retryPolicy,
            CircuitBreaker circuitBreaker,
            Sleeper sleeper
    ) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId is required");
        this.transport = Objects.requireNonNull(transport, "transport is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    public String sourceId() {
        return sourceId;
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    /**
     * Returns the body of the first 2xx response.
     *
     * @throws SourceException with {@link FailureKind#BREAKER_OPEN} when the breaker refuses the call,
     *                         {@link FailureKind#CANCELLED} when the thread is interrupted, otherwise the
     *                         last failure seen once retries are spent or a non-retryable one occurs
     */
    public byte[] fetch(HttpRequest request) {
        try {
            return circuitBreaker.executeSupplier(() -> fetchWithRetry(request));
        } catch (CallNotPermittedException e) {
            throw new SourceException(sourceId, FailureKind.BREAKER_OPEN, "Circuit open for " + sourceId, e);
        }
    }

    private byte[] fetchWithRetry(HttpRequest request) {
        String target = request.method() + " " + request.uri().getHost() + request.uri().getPath();
        SourceException lastFailure = null;
        for (int attempt = 0; attempt <= retryPolicy.maxRetries(); attempt++) {
            if (attempt > 0) {
                backoff(attempt, lastFailure);
            }
            try {
                TransportResponse response = transport.send(request);
                if (response.successful()) {
                    return response.body();
                }
                lastFailure = SourceException.forStatus(sourceId, response.statusCode(), target);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceException(sourceId, FailureKind.CANCELLED, "Request to " + target + " interrupted", e);
            } catch (IOException e) {
                lastFailure = new SourceException(
                        sourceId,
                        FailureKind.TRANSPORT,
                        "Transport failure calling " + target + ": " + e.getMessage(),
                        e
                );
            }
            if (!lastFailure.retryable()) {
                throw lastFailure;
            }
            if (attempt < retryPolicy.maxRetries()) {
                LOGGER.fine("Attempt " + (attempt + 1) + " for " + sourceId + " failed: " + lastFailure.getMessage());
            }
        }
        LOGGER.fine(sourceId + " gave up after " + (retryPolicy.maxRetries() + 1) + " attempts");
        throw lastFailure;
    }

    private void backoff(int attempt, SourceException lastFailure) {
        Duration delay = retryPolicy.delayBefore(attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            SourceException cancelled = new SourceException(
                    sourceId,
                    FailureKind.CANCELLED,
                    "Backoff for " + sourceId + " interrupted before retry " + attempt,
                    e
            );
            cancelled.addSuppressed(lastFailure);
            throw cancelled;
        }
    }
}
