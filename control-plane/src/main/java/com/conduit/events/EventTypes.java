package com.conduit.events;

/**
 * Event names published on the {@link EventBus}. External consumers key on these strings.
 */
public final class EventTypes {

    public static final String SERVICE_REGISTERED = "serviceRegistered";
    public static final String SERVICE_DEREGISTERED = "serviceDeregistered";
    public static final String ROUTE_CREATED = "routeCreated";
    public static final String ROUTE_REMOVED = "routeRemoved";
    public static final String TRAFFIC_POLICY_SET = "trafficPolicySet";
    public static final String HEALTH_CHANGED = "healthChanged";
    public static final String CIRCUIT_BREAKER_OPENED = "circuitBreakerOpened";
    public static final String REQUEST_RECORDED = "requestRecorded";
    public static final String METRICS_COLLECTED = "metricsCollected";
    public static final String ALERT_CREATED = "alertCreated";
    public static final String ALERT_ACKNOWLEDGED = "alertAcknowledged";
    public static final String LIMITS_UPDATED = "limitsUpdated";

    private EventTypes() {
    }
}
