package com.conduit.model;

public enum RoutingError {
    NO_ROUTE,
    FAULT_INJECTED,
    NO_HEALTHY_ENDPOINTS,
    CIRCUIT_OPEN,
    INTERNAL_ERROR
}
