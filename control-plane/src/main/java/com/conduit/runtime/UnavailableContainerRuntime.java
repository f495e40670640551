package com.conduit.runtime;

import com.conduit.monitor.model.ResourceLimit;
import com.conduit.runtime.stats.ContainerStats;

/**
 * Used when {@code conduit.monitor.runtime=none}. Sampling is skipped and limit updates fail.
 */
public class UnavailableContainerRuntime implements ContainerRuntime {

    @Override
    public ContainerStats fetchStats(String containerId) {
        throw new ContainerRuntimeException(containerId, "No container runtime configured");
    }

    @Override
    public void updateLimits(String containerId, ResourceLimit limit) {
        throw new ContainerRuntimeException(containerId, "No container runtime configured");
    }
}
