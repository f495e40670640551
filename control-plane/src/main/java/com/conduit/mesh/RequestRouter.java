package com.conduit.mesh;

import com.conduit.control.CircuitBreaker;
import com.conduit.model.RouteRequest;
import com.conduit.model.RoutingError;
import com.conduit.model.RoutingResult;
import com.conduit.model.ServiceEndpoint;
import com.conduit.model.ServiceRoute;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Answers "where should this request go": route match, traffic policy, endpoint selection and the
 * endpoint's breaker, in that order. Failures come back as {@link RoutingResult}s, never as
 * exceptions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestRouter {

    private final RouteTable routeTable;
    private final TrafficPolicyEngine policyEngine;
    private final ServiceRegistry registry;
    private final LoadBalancer loadBalancer;
    private final CircuitBreaker circuitBreaker;

    public RoutingResult route(String serviceName, RouteRequest request) {
        try {
            return doRoute(serviceName, request);
        } catch (RuntimeException e) {
            log.error("Routing failed for {} {} {}", serviceName, request.getMethod(), request.getPath(), e);
            return RoutingResult.failure(RoutingError.INTERNAL_ERROR, null, e.getMessage());
        }
    }

    private RoutingResult doRoute(String serviceName, RouteRequest request) {
        String method = request.getMethod().toUpperCase();

        Optional<ServiceRoute> matched = routeTable.findMatch(serviceName, request.getPath(), method);
        if (matched.isEmpty()) {
            log.debug("No route for {} {} on {}", method, request.getPath(), serviceName);
            return RoutingResult.failure(RoutingError.NO_ROUTE, null,
                    "No route found for " + method + " " + request.getPath());
        }
        ServiceRoute route = matched.get();

        PolicyDecision decision = policyEngine.evaluate(serviceName, request);
        if (decision.isAbort()) {
            return RoutingResult.builder()
                    .route(route)
                    .error(RoutingError.FAULT_INJECTED)
                    .message("Simulated fault: HTTP " + decision.abortStatus())
                    .mirrorTarget(decision.mirrorService())
                    .injectedDelayMs(decision.delayMs())
                    .build();
        }

        String targetService = decision.redirectService() != null ? decision.redirectService() : serviceName;

        Optional<ServiceEndpoint> selected = loadBalancer.select(registry.getEndpoints(targetService), route.getStrategy());
        if (selected.isEmpty()) {
            log.warn("No healthy endpoints available for {}", targetService);
            return RoutingResult.failure(RoutingError.NO_HEALTHY_ENDPOINTS, route,
                    "No healthy endpoints available for " + targetService);
        }
        ServiceEndpoint endpoint = selected.get();

        if (route.isCircuitBreakerEnabled()
                && !circuitBreaker.allowRequest(endpoint.getId(), route.getCircuitBreaker())) {
            return RoutingResult.failure(RoutingError.CIRCUIT_OPEN, route,
                    "Circuit breaker open for " + endpoint.getId());
        }

        return RoutingResult.builder()
                .endpoint(endpoint)
                .route(route)
                .mirrorTarget(decision.mirrorService())
                .injectedDelayMs(decision.delayMs())
                .build();
    }
}
