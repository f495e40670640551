package com.conduit.monitor;

import com.conduit.control.TickGuard;
import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.runtime.ContainerRuntime;
import com.conduit.runtime.ContainerRuntimeException;
import com.conduit.runtime.stats.ContainerStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Samples every monitored container once per tick, stores the derived sample and runs the threshold
 * checks on it. A container whose stats cannot be fetched is skipped for that tick.
 */
@Slf4j
@Component
public class ResourceMetricsCollector {

    private final ContainerRuntime runtime;
    private final ResourceMetricsCalculator calculator;
    private final MetricsHistory history;
    private final ThresholdEvaluator thresholdEvaluator;
    private final AlertManager alertManager;
    private final ResourceLimitStore limitStore;
    private final EventBus eventBus;
    private final Clock clock;
    private final TickGuard guard = new TickGuard();

    private final Set<String> activeContainers = ConcurrentHashMap.newKeySet();

    public ResourceMetricsCollector(ContainerRuntime runtime,
                                    ResourceMetricsCalculator calculator,
                                    MetricsHistory history,
                                    ThresholdEvaluator thresholdEvaluator,
                                    AlertManager alertManager,
                                    ResourceLimitStore limitStore,
                                    EventBus eventBus,
                                    Clock clock) {
        this.runtime = runtime;
        this.calculator = calculator;
        this.history = history;
        this.thresholdEvaluator = thresholdEvaluator;
        this.alertManager = alertManager;
        this.limitStore = limitStore;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void track(String containerId) {
        activeContainers.add(containerId);
    }

    public void untrack(String containerId) {
        activeContainers.remove(containerId);
    }

    public Set<String> activeContainers() {
        return Set.copyOf(activeContainers);
    }

    @Scheduled(fixedDelayString = "${conduit.monitor.interval-ms:5000}",
            initialDelayString = "${conduit.monitor.interval-ms:5000}")
    public void execute() {
        long generation = guard.begin();
        if (generation < 0) {
            return;
        }

        int sampled = 0;
        for (String containerId : activeContainers) {
            if (collect(containerId, generation)) {
                sampled++;
            }
        }
        log.debug("Resource sampling executed: containers={}, sampled={}", activeContainers.size(), sampled);
    }

    public void close() {
        guard.close();
    }

    private boolean collect(String containerId, long generation) {
        ContainerStats stats;
        try {
            stats = runtime.fetchStats(containerId);
        } catch (ContainerRuntimeException e) {
            log.debug("Failed to collect metrics for container {}: {}", containerId, e.getMessage());
            return false;
        }

        ResourceMetrics sample = calculator.calculate(containerId, stats, clock.instant());
        if (!guard.isCurrent(generation)) {
            log.debug("Sample for {} discarded after shutdown", containerId);
            return false;
        }

        history.append(sample);
        thresholdEvaluator.evaluate(sample, limitStore.get(containerId).orElse(null))
                .forEach(alertManager::raise);
        eventBus.publish(EventTypes.METRICS_COLLECTED, ControlPlaneEvent.SOURCE_MONITOR, sample);
        return true;
    }
}
