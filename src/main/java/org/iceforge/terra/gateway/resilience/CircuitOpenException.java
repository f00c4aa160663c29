package org.iceforge.terra.gateway.resilience;

import java.time.Duration;

/**
 * Thrown instead of running a call while the breaker refuses traffic.
 */
public class CircuitOpenException extends RuntimeException {

    private final Duration retryAfter;

    public CircuitOpenException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Whole seconds, rounded up, never below one.
     */
    public long retryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
