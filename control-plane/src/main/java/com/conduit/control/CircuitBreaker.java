package com.conduit.control;

import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.model.CircuitBreakerSettings;
import com.conduit.model.CircuitBreakerState;
import com.conduit.model.CircuitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-endpoint breaker table.
 * <pre>
 * CLOSED --threshold failures--> OPEN --nextAttemptTime reached, on next attempt--> HALF_OPEN
 * HALF_OPEN --quota successes--> CLOSED
 * HALF_OPEN --any failure------> OPEN
 * </pre>
 * A breaker is created on the first reported result. Settings bound by a route before that are
 * remembered and used when it is created.
 */
@Slf4j
@Component
public class CircuitBreaker {

    private final CircuitBreakerSettings defaults;
    private final Clock clock;
    private final EventBus eventBus;

    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();
    private final Map<String, CircuitBreakerSettings> pendingSettings = new ConcurrentHashMap<>();

    public CircuitBreaker(
            @Value("${conduit.mesh.circuit-breaker.threshold:5}") int failureThreshold,
            @Value("${conduit.mesh.circuit-breaker.open-duration-ms:60000}") long openDurationMs,
            @Value("${conduit.mesh.circuit-breaker.half-open-quota:3}") int halfOpenQuota,
            Clock clock,
            EventBus eventBus) {
        this.defaults = CircuitBreakerSettings.of(failureThreshold, Duration.ofMillis(openDurationMs), halfOpenQuota);
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /**
     * Gate check made while routing. An open breaker whose retry time has passed moves to
     * {@code HALF_OPEN} here and lets the request through.
     *
     * @param routeSettings settings of the matched route, or null to keep the current ones
     * @return false when the breaker is open and still waiting
     */
    public boolean allowRequest(String endpointId, CircuitBreakerSettings routeSettings) {
        Instant now = clock.instant();
        boolean[] allowed = {true};

        CircuitBreakerState result = states.computeIfPresent(endpointId, (id, current) -> {
            CircuitBreakerState state = routeSettings != null ? current.withSettings(routeSettings) : current;
            if (state.getState() != CircuitState.OPEN) {
                return state;
            }
            if (now.isBefore(state.getNextAttemptTime())) {
                allowed[0] = false;
                return state;
            }
            log.info("Circuit breaker transition: endpoint={}, OPEN -> HALF_OPEN", id);
            return state.toBuilder()
                    .state(CircuitState.HALF_OPEN)
                    .successCount(0)
                    .build();
        });

        if (result == null && routeSettings != null) {
            pendingSettings.put(endpointId, routeSettings);
        }
        return allowed[0];
    }

    public void recordResult(String endpointId, boolean success) {
        Instant now = clock.instant();
        CircuitBreakerState[] previous = new CircuitBreakerState[1];

        CircuitBreakerState updated = states.compute(endpointId, (id, current) -> {
            CircuitBreakerState state = current != null
                    ? current
                    : CircuitBreakerState.closed(id, pendingSettings.getOrDefault(id, defaults), now);
            previous[0] = state;
            return success ? onSuccess(state) : onFailure(state, now);
        });
        pendingSettings.remove(endpointId);

        CircuitState from = previous[0].getState();
        CircuitState to = updated.getState();
        if (from != to) {
            log.info("Circuit breaker transition: endpoint={}, {} -> {}", endpointId, from, to);
            if (to == CircuitState.OPEN) {
                log.warn("Circuit breaker opened for {} after {} failures, retry at {}",
                        endpointId, updated.getFailureCount(), updated.getNextAttemptTime());
                eventBus.publish(EventTypes.CIRCUIT_BREAKER_OPENED, ControlPlaneEvent.SOURCE_MESH, updated);
            }
        }
    }

    /**
     * Administrative override. Forcing {@code OPEN} schedules a fresh retry time; forcing
     * {@code CLOSED} resets both counters.
     *
     * @return false when no breaker exists for the endpoint
     */
    public boolean forceState(String endpointId, CircuitState target) {
        if (target == CircuitState.HALF_OPEN) {
            throw new IllegalArgumentException("Circuit breaker can only be forced OPEN or CLOSED");
        }
        Instant now = clock.instant();

        CircuitBreakerState updated = states.computeIfPresent(endpointId, (id, current) -> {
            if (target == CircuitState.OPEN) {
                return current.toBuilder()
                        .state(CircuitState.OPEN)
                        .nextAttemptTime(now.plus(current.getSettings().openDuration()))
                        .build();
            }
            return current.toBuilder()
                    .state(CircuitState.CLOSED)
                    .failureCount(0)
                    .successCount(0)
                    .build();
        });

        if (updated == null) {
            return false;
        }
        log.info("Circuit breaker state forced: endpoint={}, state={}", endpointId, target);
        return true;
    }

    public Optional<CircuitBreakerState> get(String endpointId) {
        return Optional.ofNullable(states.get(endpointId));
    }

    public List<CircuitBreakerState> getAll() {
        return List.copyOf(states.values());
    }

    public CircuitBreakerSettings getDefaults() {
        return defaults;
    }

    private CircuitBreakerState onSuccess(CircuitBreakerState state) {
        return switch (state.getState()) {
            case CLOSED -> state.withFailureCount(0);
            case HALF_OPEN -> {
                int successes = state.getSuccessCount() + 1;
                if (successes >= state.getSettings().halfOpenQuota()) {
                    yield state.toBuilder()
                            .state(CircuitState.CLOSED)
                            .failureCount(0)
                            .successCount(0)
                            .build();
                }
                yield state.withSuccessCount(successes);
            }
            case OPEN -> state;
        };
    }

    private CircuitBreakerState onFailure(CircuitBreakerState state, Instant now) {
        CircuitBreakerState failed = state.toBuilder()
                .failureCount(state.getFailureCount() + 1)
                .lastFailureTime(now)
                .build();

        return switch (state.getState()) {
            case CLOSED -> failed.getFailureCount() >= state.getSettings().threshold()
                    ? open(failed, now)
                    : failed;
            case HALF_OPEN -> open(failed, now);
            case OPEN -> failed;
        };
    }

    private static CircuitBreakerState open(CircuitBreakerState state, Instant now) {
        return state.toBuilder()
                .state(CircuitState.OPEN)
                .nextAttemptTime(now.plus(state.getSettings().openDuration()))
                .build();
    }
}
