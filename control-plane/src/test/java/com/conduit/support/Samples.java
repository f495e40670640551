package com.conduit.support;

import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.runtime.stats.ContainerStats;

import java.time.Instant;
import java.util.Map;

/**
 * Builders for samples and raw engine snapshots used across monitor tests.
 */
public final class Samples {

    private Samples() {
    }

    public static ResourceMetrics sample(String containerId, Instant timestamp, double cpu, double memoryPercentage) {
        return ResourceMetrics.builder()
                .containerId(containerId)
                .timestamp(timestamp)
                .cpu(new ResourceMetrics.Cpu(cpu, 0, 0, 0))
                .memory(new ResourceMetrics.Memory((long) memoryPercentage, 100, memoryPercentage, 0, 0, 0))
                .network(new ResourceMetrics.Network(0, 0, 0, 0, 0, 0))
                .disk(new ResourceMetrics.Disk(0, 0, 0, 0))
                .processes(new ResourceMetrics.Processes(0, 0, 0, 0))
                .build();
    }

    /**
     * A snapshot whose derived CPU usage is {@code cpuPercent} (one decimal of precision).
     */
    public static ContainerStats stats(double cpuPercent, long memoryUsage, long memoryLimit, long pids) {
        long cpuTotal = Math.round(cpuPercent * 10);
        return new ContainerStats(
                new ContainerStats.CpuStats(new ContainerStats.CpuUsage(cpuTotal, 0L, 0L), 1000L, null),
                new ContainerStats.CpuStats(new ContainerStats.CpuUsage(0L, 0L, 0L), 0L, null),
                new ContainerStats.MemoryStats(memoryUsage, memoryLimit, Map.of()),
                Map.of("eth0", new ContainerStats.NetworkStats(1000L, 500L, 10L, 5L, 0L, 0L)),
                null,
                new ContainerStats.PidsStats(pids));
    }
}
