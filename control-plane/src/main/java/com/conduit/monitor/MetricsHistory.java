package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.monitor.model.ResourceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-container sample history, bounded by count on append and by age on {@link #sweep}.
 */
@Slf4j
@Component
public class MetricsHistory {

    private final int capacity;
    private final Map<String, SampleRingBuffer<ResourceMetrics>> histories = new ConcurrentHashMap<>();

    public MetricsHistory(MonitorProperties properties) {
        this.capacity = properties.getHistoryCapacity();
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
    }

    public void track(String containerId) {
        histories.computeIfAbsent(containerId, id -> new SampleRingBuffer<>(capacity));
    }

    public void append(ResourceMetrics sample) {
        histories.computeIfAbsent(sample.getContainerId(), id -> new SampleRingBuffer<>(capacity))
                .add(sample);
    }

    public List<ResourceMetrics> samples(String containerId) {
        SampleRingBuffer<ResourceMetrics> buffer = histories.get(containerId);
        return buffer != null ? buffer.snapshot() : List.of();
    }

    public List<ResourceMetrics> latest(String containerId, int count) {
        SampleRingBuffer<ResourceMetrics> buffer = histories.get(containerId);
        return buffer != null ? buffer.latest(count) : List.of();
    }

    public Optional<ResourceMetrics> latest(String containerId) {
        SampleRingBuffer<ResourceMetrics> buffer = histories.get(containerId);
        return buffer != null ? buffer.latest() : Optional.empty();
    }

    public List<ResourceMetrics> since(String containerId, Instant cutoff) {
        return samples(containerId).stream()
                .filter(m -> !m.getTimestamp().isBefore(cutoff))
                .toList();
    }

    /**
     * Drops samples older than {@code cutoff} from every history.
     */
    public int sweep(Instant cutoff) {
        int removed = 0;
        for (SampleRingBuffer<ResourceMetrics> buffer : histories.values()) {
            removed += buffer.removeIf(m -> m.getTimestamp().isBefore(cutoff));
        }
        return removed;
    }

    public int capacity() {
        return capacity;
    }
}
