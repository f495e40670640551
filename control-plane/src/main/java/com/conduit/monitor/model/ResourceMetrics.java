package com.conduit.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One derived sample for one container. CPU and memory percentages are in [0, 100]; byte and
 * packet counters are cumulative as reported by the engine.
 */
@Value
@Builder
public class ResourceMetrics {

    String containerId;
    Instant timestamp;
    Cpu cpu;
    Memory memory;
    Network network;
    Disk disk;
    Processes processes;

    public record Cpu(double usage, long throttled, long system, long user) {
    }

    public record Memory(long usage, long limit, double percentage, long cache, long rss, long swap) {
    }

    public record Network(long rxBytes, long txBytes, long rxPackets, long txPackets, long rxErrors, long txErrors) {
    }

    public record Disk(long readBytes, long writeBytes, long readOps, long writeOps) {
    }

    public record Processes(long running, long sleeping, long stopped, long zombie) {
    }
}
