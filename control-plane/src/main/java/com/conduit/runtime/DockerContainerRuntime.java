package com.conduit.runtime;

import com.conduit.monitor.model.ResourceLimit;
import com.conduit.runtime.stats.ContainerStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.UpdateContainerCmd;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.core.InvocationBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Docker Engine runtime. Statistics are fetched once per call ({@code stream=false}) and converted
 * through Jackson onto {@link ContainerStats}, so engine JSON and docker-java objects share one
 * model.
 * <p>
 * Only memory, swap, reservation and CPU quota can be changed on a running container through the
 * update endpoint; process and block-IO limits are kept by the monitor but not pushed.
 */
@Slf4j
public class DockerContainerRuntime implements ContainerRuntime {

    static final int CPU_PERIOD_MICROS = 100_000;

    private final DockerClient dockerClient;
    private final ObjectMapper objectMapper;

    public DockerContainerRuntime(DockerClient dockerClient, ObjectMapper objectMapper) {
        this.dockerClient = dockerClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ContainerStats fetchStats(String containerId) {
        Statistics statistics;
        try (InvocationBuilder.AsyncResultCallback<Statistics> callback = dockerClient.statsCmd(containerId)
                .withNoStream(true)
                .exec(new InvocationBuilder.AsyncResultCallback<>())) {
            statistics = callback.awaitResult();
        } catch (IOException e) {
            throw new ContainerRuntimeException(containerId, "Failed to close stats stream", e);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(containerId, "Stats request failed: " + e.getMessage(), e);
        }

        if (statistics == null) {
            throw new ContainerRuntimeException(containerId, "No statistics returned for container " + containerId);
        }

        try {
            return objectMapper.convertValue(statistics, ContainerStats.class);
        } catch (IllegalArgumentException e) {
            throw new ContainerRuntimeException(containerId, "Unreadable statistics for container " + containerId, e);
        }
    }

    @Override
    public void updateLimits(String containerId, ResourceLimit limit) {
        UpdateContainerCmd cmd = dockerClient.updateContainerCmd(containerId);

        ResourceLimit.Memory memory = limit.getMemory();
        if (memory != null) {
            cmd.withMemory(memory.limit());
            cmd.withMemorySwap(memory.swap());
            cmd.withMemoryReservation(memory.reservation());
        }

        ResourceLimit.Cpu cpu = limit.getCpu();
        if (cpu != null) {
            cmd.withCpuQuota((int) Math.floor(cpu.percentage() * 1000));
            cmd.withCpuPeriod(CPU_PERIOD_MICROS);
        }

        try {
            cmd.exec();
            log.debug("Updated limits on container {}", containerId);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(containerId, "Limit update rejected: " + e.getMessage(), e);
        }
    }
}
