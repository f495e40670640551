package com.conduit.monitor;

import com.conduit.monitor.model.ResourceLimit;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Limits that were successfully applied, by container id.
 */
@Component
public class ResourceLimitStore {

    private final Map<String, ResourceLimit> limits = new ConcurrentHashMap<>();

    public void put(String containerId, ResourceLimit limit) {
        limits.put(containerId, limit);
    }

    public Optional<ResourceLimit> get(String containerId) {
        return Optional.ofNullable(limits.get(containerId));
    }
}
