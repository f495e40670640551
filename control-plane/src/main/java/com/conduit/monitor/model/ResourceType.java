package com.conduit.monitor.model;

public enum ResourceType {
    CPU,
    MEMORY,
    NETWORK,
    DISK,
    PROCESSES
}
