package com.conduit.runtime;

import com.conduit.monitor.model.ResourceLimit;
import com.conduit.runtime.stats.ContainerStats;

/**
 * The container engine as seen by the resource monitor.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link DockerContainerRuntime}: Docker Engine through docker-java</li>
 *   <li>{@link UnavailableContainerRuntime}: no engine configured, every call fails</li>
 * </ul>
 */
public interface ContainerRuntime {

    /**
     * One non-streaming statistics snapshot.
     *
     * @throws ContainerRuntimeException if the engine call fails or returns nothing
     */
    ContainerStats fetchStats(String containerId);

    /**
     * Applies the memory and CPU parts of {@code limit} to a running container.
     *
     * @throws ContainerRuntimeException if the engine rejects the update
     */
    void updateLimits(String containerId, ResourceLimit limit);
}
