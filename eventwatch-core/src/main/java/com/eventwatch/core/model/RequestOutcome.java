package com.eventwatch.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * What happened once the downstream handler returned or threw.
 */
public final class RequestOutcome {

    private final Integer statusCode;
    private final Duration elapsed;
    private final Throwable failure;

    private RequestOutcome(Integer statusCode, Duration elapsed, Throwable failure) {
        this.statusCode = statusCode;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.failure = failure;
    }

    public static RequestOutcome completed(int statusCode, Duration elapsed) {
        return new RequestOutcome(statusCode, elapsed, null);
    }

    public static RequestOutcome failed(Throwable failure, Duration elapsed) {
        return new RequestOutcome(null, elapsed, Objects.requireNonNull(failure, "failure"));
    }

    /** Response status, or {@code null} when the downstream call threw. */
    public Integer getStatusCode() {
        return statusCode;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public Throwable getFailure() {
        return failure;
    }

    public boolean isFailed() {
        return failure != null;
    }

    @Override
    public String toString() {
        return "RequestOutcome{status=" + statusCode + ", elapsed=" + elapsed.toMillis() + "ms"
                + (failure != null ? ", failure=" + failure.getClass().getSimpleName() : "") + '}';
    }
}
