package com.conduit.model;

public enum EndpointHealth {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN
}
