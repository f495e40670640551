package com.conduit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A routing entry owned by one service. {@code circuitBreaker} may be null, in which case the
 * mesh-wide breaker defaults apply. The timeout is carried for the caller to enforce.
 */
@Value
@Builder(toBuilder = true)
public class ServiceRoute {

    public static final String ANY_METHOD = "*";

    String id;
    String name;
    String serviceName;
    String path;
    @Builder.Default
    List<String> methods = List.of(ANY_METHOD);
    @Builder.Default
    Map<String, String> headers = Map.of();
    @Builder.Default
    long timeoutMs = 30_000;
    @Builder.Default
    int retries = 3;
    CircuitBreakerSettings circuitBreaker;
    @Builder.Default
    LoadBalancingStrategy strategy = LoadBalancingStrategy.ROUND_ROBIN;
    @Builder.Default
    boolean healthCheck = true;

    public boolean acceptsMethod(String method) {
        return methods.contains(ANY_METHOD) || methods.contains(method.toUpperCase());
    }

    /**
     * Exact match, or prefix match when the pattern ends in {@code *}.
     */
    public boolean matchesPath(String requestPath) {
        if (path.equals(requestPath)) {
            return true;
        }
        if (path.endsWith("*")) {
            String prefix = path.substring(0, path.length() - 1);
            return requestPath.startsWith(prefix);
        }
        return false;
    }

    public boolean isCircuitBreakerEnabled() {
        return circuitBreaker == null || circuitBreaker.enabled();
    }
}
