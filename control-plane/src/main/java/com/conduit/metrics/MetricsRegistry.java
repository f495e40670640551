package com.conduit.metrics;

import com.conduit.model.RequestOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class MetricsRegistry {

    private final Map<String, EndpointMetrics> metricsMap = new ConcurrentHashMap<>();

    public EndpointMetrics getOrCreate(String endpointId) {
        return metricsMap.computeIfAbsent(endpointId, id -> {
            log.info("Creating metrics for endpoint: {}", id);
            return new EndpointMetrics(id);
        });
    }

    public void record(RequestOutcome outcome) {
        EndpointMetrics metrics = getOrCreate(outcome.getEndpointId());
        metrics.record(outcome);

        if (log.isDebugEnabled()) {
            log.debug("Recorded: endpoint={}, latency={}ms, success={}, errorRate={}%",
                    outcome.getEndpointId(),
                    outcome.getLatencyMs(),
                    outcome.isSuccess(),
                    String.format("%.2f", metrics.getErrorRate()));
        }
    }

    public Optional<EndpointMetrics> get(String endpointId) {
        return Optional.ofNullable(metricsMap.get(endpointId));
    }

    public Map<String, EndpointMetrics.Snapshot> snapshotAll() {
        Map<String, EndpointMetrics.Snapshot> result = new LinkedHashMap<>();
        metricsMap.forEach((id, metrics) -> result.put(id, metrics.snapshot()));
        return result;
    }

    public Map<String, EndpointMetrics.Snapshot> snapshotOf(Collection<String> endpointIds) {
        Map<String, EndpointMetrics.Snapshot> result = new LinkedHashMap<>();
        for (String id : endpointIds) {
            EndpointMetrics metrics = metricsMap.get(id);
            if (metrics != null) {
                result.put(id, metrics.snapshot());
            }
        }
        return result;
    }

    public long totalRequests() {
        return metricsMap.values().stream()
                .mapToLong(EndpointMetrics::getTotalRequests)
                .sum();
    }
}
