package com.conduit.model;

import java.time.Duration;

/**
 * Breaker parameters a route binds to the endpoints it selects.
 *
 * @param enabled       when false the route skips the breaker check entirely
 * @param threshold     consecutive failures in {@code CLOSED} that open the circuit
 * @param openDuration  how long an open circuit rejects traffic before probing
 * @param halfOpenQuota successes in {@code HALF_OPEN} needed to close again
 */
public record CircuitBreakerSettings(
        boolean enabled,
        int threshold,
        Duration openDuration,
        int halfOpenQuota
) {

    public CircuitBreakerSettings {
        if (threshold < 1) {
            throw new IllegalArgumentException("Circuit breaker threshold must be at least 1, got " + threshold);
        }
        if (halfOpenQuota < 1) {
            throw new IllegalArgumentException("Half-open quota must be at least 1, got " + halfOpenQuota);
        }
        if (openDuration == null || openDuration.isNegative() || openDuration.isZero()) {
            throw new IllegalArgumentException("Open duration must be positive, got " + openDuration);
        }
    }

    public static CircuitBreakerSettings of(int threshold, Duration openDuration, int halfOpenQuota) {
        return new CircuitBreakerSettings(true, threshold, openDuration, halfOpenQuota);
    }
}
