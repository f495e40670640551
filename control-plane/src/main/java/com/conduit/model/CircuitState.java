package com.conduit.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
