package com.conduit.monitor;

import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.runtime.stats.ContainerStats;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;

/**
 * Derives a {@link ResourceMetrics} sample from a raw engine snapshot.
 */
@Component
public class ResourceMetricsCalculator {

    private static final String READ = "Read";
    private static final String WRITE = "Write";

    public ResourceMetrics calculate(String containerId, ContainerStats stats, Instant timestamp) {
        return ResourceMetrics.builder()
                .containerId(containerId)
                .timestamp(timestamp)
                .cpu(cpu(stats))
                .memory(memory(stats))
                .network(network(stats))
                .disk(disk(stats))
                .processes(new ResourceMetrics.Processes(stats.currentPids(), 0, 0, 0))
                .build();
    }

    /**
     * Container share of host CPU time since the previous reading, in [0, 100]. Missing previous
     * readings count as zero.
     */
    static double cpuUsage(ContainerStats stats) {
        long cpuDelta = stats.cpu().totalUsage() - stats.precpu().totalUsage();
        long systemDelta = stats.cpu().systemUsage() - stats.precpu().systemUsage();

        double usage = systemDelta > 0 ? ((double) cpuDelta / systemDelta) * 100.0 : 0.0;
        return Math.min(100.0, Math.max(0.0, usage));
    }

    private static ResourceMetrics.Cpu cpu(ContainerStats stats) {
        ContainerStats.CpuStats current = stats.cpu();
        return new ResourceMetrics.Cpu(cpuUsage(stats), current.throttledTime(), current.kernelUsage(), current.userUsage());
    }

    private static ResourceMetrics.Memory memory(ContainerStats stats) {
        ContainerStats.MemoryStats memory = stats.memory();
        long usage = memory.usageBytes();
        long limit = memory.limitBytes();
        double percentage = limit > 0 ? ((double) usage / limit) * 100.0 : 0.0;

        return new ResourceMetrics.Memory(usage, limit, percentage,
                memory.stat("cache"), memory.stat("rss"), memory.stat("swap"));
    }

    private static ResourceMetrics.Network network(ContainerStats stats) {
        Collection<ContainerStats.NetworkStats> interfaces = stats.networkInterfaces().values();
        long rxBytes = 0;
        long txBytes = 0;
        long rxPackets = 0;
        long txPackets = 0;
        long rxErrors = 0;
        long txErrors = 0;

        for (ContainerStats.NetworkStats iface : interfaces) {
            if (iface == null) {
                continue;
            }
            rxBytes += orZero(iface.rxBytes());
            txBytes += orZero(iface.txBytes());
            rxPackets += orZero(iface.rxPackets());
            txPackets += orZero(iface.txPackets());
            rxErrors += orZero(iface.rxErrors());
            txErrors += orZero(iface.txErrors());
        }
        return new ResourceMetrics.Network(rxBytes, txBytes, rxPackets, txPackets, rxErrors, txErrors);
    }

    private static ResourceMetrics.Disk disk(ContainerStats stats) {
        ContainerStats.BlkioStats blkio = stats.blkio();
        return new ResourceMetrics.Disk(blkio.bytes(READ), blkio.bytes(WRITE), blkio.ops(READ), blkio.ops(WRITE));
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
