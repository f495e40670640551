package com.conduit.monitor;

import com.conduit.monitor.model.AlertSeverity;
import com.conduit.monitor.model.ResourceType;

/**
 * A threshold breach found in one sample, before cooldown deduplication.
 */
public record AlertCandidate(
        String containerId,
        ResourceType type,
        AlertSeverity severity,
        double threshold,
        double currentValue,
        String message
) {
}
