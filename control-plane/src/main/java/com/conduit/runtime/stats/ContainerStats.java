package com.conduit.runtime.stats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One Docker Engine statistics snapshot, bound from the engine's snake_case JSON. Any section may
 * be missing; readers go through the null-safe accessors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerStats(
        @JsonProperty("cpu_stats") CpuStats cpuStats,
        @JsonProperty("precpu_stats") CpuStats precpuStats,
        @JsonProperty("memory_stats") MemoryStats memoryStats,
        @JsonProperty("networks") Map<String, NetworkStats> networks,
        @JsonProperty("blkio_stats") BlkioStats blkioStats,
        @JsonProperty("pids_stats") PidsStats pidsStats
) {

    public CpuStats cpu() {
        return cpuStats != null ? cpuStats : CpuStats.EMPTY;
    }

    public CpuStats precpu() {
        return precpuStats != null ? precpuStats : CpuStats.EMPTY;
    }

    public MemoryStats memory() {
        return memoryStats != null ? memoryStats : MemoryStats.EMPTY;
    }

    public Map<String, NetworkStats> networkInterfaces() {
        return networks != null ? networks : Map.of();
    }

    public BlkioStats blkio() {
        return blkioStats != null ? blkioStats : BlkioStats.EMPTY;
    }

    public long currentPids() {
        return pidsStats != null ? value(pidsStats.current()) : 0;
    }

    static long value(Long boxed) {
        return boxed != null ? boxed : 0L;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CpuStats(
            @JsonProperty("cpu_usage") CpuUsage cpuUsage,
            @JsonProperty("system_cpu_usage") Long systemCpuUsage,
            @JsonProperty("throttling_data") ThrottlingData throttlingData
    ) {
        static final CpuStats EMPTY = new CpuStats(null, null, null);

        public long totalUsage() {
            return cpuUsage != null ? value(cpuUsage.totalUsage()) : 0;
        }

        public long kernelUsage() {
            return cpuUsage != null ? value(cpuUsage.usageInKernelmode()) : 0;
        }

        public long userUsage() {
            return cpuUsage != null ? value(cpuUsage.usageInUsermode()) : 0;
        }

        public long systemUsage() {
            return value(systemCpuUsage);
        }

        public long throttledTime() {
            return throttlingData != null ? value(throttlingData.throttledTime()) : 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CpuUsage(
            @JsonProperty("total_usage") Long totalUsage,
            @JsonProperty("usage_in_kernelmode") Long usageInKernelmode,
            @JsonProperty("usage_in_usermode") Long usageInUsermode
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThrottlingData(
            @JsonProperty("throttled_time") Long throttledTime
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MemoryStats(
            @JsonProperty("usage") Long usage,
            @JsonProperty("limit") Long limit,
            @JsonProperty("stats") Map<String, Long> stats
    ) {
        static final MemoryStats EMPTY = new MemoryStats(null, null, null);

        public long usageBytes() {
            return value(usage);
        }

        public long limitBytes() {
            return value(limit);
        }

        public long stat(String name) {
            return stats != null ? value(stats.get(name)) : 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetworkStats(
            @JsonProperty("rx_bytes") Long rxBytes,
            @JsonProperty("tx_bytes") Long txBytes,
            @JsonProperty("rx_packets") Long rxPackets,
            @JsonProperty("tx_packets") Long txPackets,
            @JsonProperty("rx_errors") Long rxErrors,
            @JsonProperty("tx_errors") Long txErrors
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlkioStats(
            @JsonProperty("io_service_bytes_recursive") List<BlkioEntry> ioServiceBytesRecursive,
            @JsonProperty("io_serviced_recursive") List<BlkioEntry> ioServicedRecursive
    ) {
        static final BlkioStats EMPTY = new BlkioStats(null, null);

        public long bytes(String op) {
            return sum(ioServiceBytesRecursive, op);
        }

        public long ops(String op) {
            return sum(ioServicedRecursive, op);
        }

        private static long sum(List<BlkioEntry> entries, String op) {
            if (entries == null) {
                return 0;
            }
            return entries.stream()
                    .filter(e -> op.equals(e.op()))
                    .mapToLong(e -> value(e.value()))
                    .sum();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlkioEntry(
            @JsonProperty("op") String op,
            @JsonProperty("value") Long value
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PidsStats(
            @JsonProperty("current") Long current
    ) {
    }
}
