package com.conduit.monitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
@With
@Builder
public class ResourceAlert {

    String id;
    String containerId;
    ResourceType type;
    AlertSeverity severity;
    double threshold;
    double currentValue;
    String message;
    Instant timestamp;
    boolean acknowledged;
}
