package com.conduit.monitor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Requested limits for one container. Sections left null are not changed on the container.
 */
@Value
@Builder
public class ResourceLimit {

    String containerId;
    Cpu cpu;
    Memory memory;
    Network network;
    Disk disk;
    Processes processes;

    /**
     * @param percentage CPU share in percent; pushed as a quota of {@code percentage * 1000}us per 100ms
     */
    public record Cpu(double cores, double percentage) {
    }

    /** All values in bytes. */
    public record Memory(long limit, long swap, long reservation) {
    }

    public record Network(long bandwidth, int connections) {
    }

    /** Rates in bytes per second, space in bytes. */
    public record Disk(long readRate, long writeRate, long space) {
    }

    public record Processes(int max) {
    }
}
