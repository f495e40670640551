package com.conduit.mesh;

import com.conduit.control.CircuitBreaker;
import com.conduit.control.HealthChecker;
import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.metrics.EndpointMetrics;
import com.conduit.metrics.MetricsRegistry;
import com.conduit.model.CircuitBreakerState;
import com.conduit.model.CircuitState;
import com.conduit.model.RequestOutcome;
import com.conduit.model.RouteRequest;
import com.conduit.model.RoutingResult;
import com.conduit.model.ServiceEndpoint;
import com.conduit.model.ServiceInstances;
import com.conduit.model.ServiceRoute;
import com.conduit.model.TrafficPolicy;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Entry point of the service mesh. Owns endpoint and route registration, routing, result
 * reporting and breaker administration, and publishes a mesh event for each change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceMesh {

    private final ServiceRegistry registry;
    private final RouteTable routeTable;
    private final TrafficPolicyEngine policyEngine;
    private final RequestRouter router;
    private final CircuitBreaker circuitBreaker;
    private final MetricsRegistry metricsRegistry;
    private final HealthChecker healthChecker;
    private final MeshMetricsReporter metricsReporter;
    private final EventBus eventBus;
    private final Clock clock;

    private final List<EventBus.Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public void registerService(ServiceEndpoint endpoint) {
        registry.register(endpoint);
        publish(EventTypes.SERVICE_REGISTERED, endpoint);
    }

    public boolean deregisterService(String serviceName, String endpointId) {
        return registry.deregister(serviceName, endpointId)
                .map(removed -> {
                    publish(EventTypes.SERVICE_DEREGISTERED, removed);
                    return true;
                })
                .orElse(false);
    }

    public void createRoute(ServiceRoute route) {
        routeTable.put(route);
        log.info("Route created: {} {} -> {} ({})", route.getId(), route.getPath(), route.getServiceName(), route.getStrategy());
        publish(EventTypes.ROUTE_CREATED, route);
    }

    public boolean removeRoute(String routeId) {
        return routeTable.remove(routeId)
                .map(removed -> {
                    log.info("Route removed: {}", routeId);
                    publish(EventTypes.ROUTE_REMOVED, removed);
                    return true;
                })
                .orElse(false);
    }

    public void setTrafficPolicy(TrafficPolicy policy) {
        policyEngine.setPolicy(policy);
        log.info("Traffic policy set for {} with {} rules", policy.getServiceName(), policy.getRules().size());
        publish(EventTypes.TRAFFIC_POLICY_SET, policy);
    }

    public RoutingResult routeRequest(String serviceName, RouteRequest request) {
        return router.route(serviceName, request);
    }

    /**
     * Feeds one request outcome back into the endpoint's breaker and metrics.
     */
    public void recordRequestResult(String endpointId, boolean success, long latencyMs) {
        RequestOutcome outcome = RequestOutcome.builder()
                .endpointId(endpointId)
                .timestamp(clock.instant())
                .latencyMs(latencyMs)
                .success(success)
                .build();

        circuitBreaker.recordResult(endpointId, success);
        metricsRegistry.record(outcome);
        publish(EventTypes.REQUEST_RECORDED, outcome);
    }

    public List<ServiceInstances> discoverServices() {
        return registry.listServices();
    }

    /**
     * A single entry for {@code serviceName}, with an empty endpoint list when nothing is registered.
     */
    public List<ServiceInstances> discoverServices(String serviceName) {
        return List.of(new ServiceInstances(serviceName, registry.getEndpoints(serviceName)));
    }

    public Map<String, EndpointMetrics.Snapshot> getMetrics() {
        return metricsRegistry.snapshotAll();
    }

    /**
     * Metrics of the endpoints currently registered under {@code serviceName}.
     */
    public Map<String, EndpointMetrics.Snapshot> getMetrics(String serviceName) {
        return metricsRegistry.snapshotOf(registry.getEndpoints(serviceName).stream()
                .map(ServiceEndpoint::getId)
                .toList());
    }

    public List<CircuitBreakerState> getCircuitBreakerStatus() {
        return circuitBreaker.getAll();
    }

    public boolean setCircuitBreakerState(String endpointId, CircuitState state) {
        return circuitBreaker.forceState(endpointId, state);
    }

    public EventBus.Subscription on(String eventType, Consumer<ControlPlaneEvent> listener) {
        EventBus.Subscription subscription = eventBus.subscribe(eventType, listener);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Stops the health and metrics ticks and drops listeners registered through {@link #on}.
     */
    @PreDestroy
    public void close() {
        healthChecker.close();
        metricsReporter.close();
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
        log.info("Service mesh closed");
    }

    private void publish(String eventType, Object payload) {
        eventBus.publish(eventType, ControlPlaneEvent.SOURCE_MESH, payload);
    }
}
