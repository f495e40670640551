package com.conduit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of routing one request. Either {@code endpoint} is set, or {@code error} and
 * {@code message} explain why not. {@code route} is set whenever a route matched.
 * <p>
 * {@code mirrorTarget} and {@code injectedDelayMs} are advisory: the caller mirrors traffic and
 * applies delays.
 */
@Value
@Builder
public class RoutingResult {

    ServiceEndpoint endpoint;
    ServiceRoute route;
    RoutingError error;
    String message;
    String mirrorTarget;
    long injectedDelayMs;

    public boolean isRouted() {
        return endpoint != null && error == null;
    }

    public static RoutingResult failure(RoutingError error, ServiceRoute route, String message) {
        return RoutingResult.builder()
                .error(error)
                .route(route)
                .message(message)
                .build();
    }
}
