package com.conduit.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable snapshot of one endpoint's breaker. Every transition produces a new instance.
 */
@Value
@With
@Builder(toBuilder = true)
public class CircuitBreakerState {

    String endpointId;
    CircuitState state;
    int failureCount;
    int successCount;
    Instant lastFailureTime;
    Instant nextAttemptTime;
    CircuitBreakerSettings settings;

    public static CircuitBreakerState closed(String endpointId, CircuitBreakerSettings settings, Instant now) {
        return CircuitBreakerState.builder()
                .endpointId(endpointId)
                .state(CircuitState.CLOSED)
                .failureCount(0)
                .successCount(0)
                .lastFailureTime(now)
                .nextAttemptTime(now)
                .settings(settings)
                .build();
    }

    public boolean isOpen() {
        return state == CircuitState.OPEN;
    }
}
