package com.conduit.monitor.model;

public enum AlertSeverity {
    WARNING,
    CRITICAL
}
