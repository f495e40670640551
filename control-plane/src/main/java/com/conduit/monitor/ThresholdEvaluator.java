package com.conduit.monitor;

import com.conduit.monitor.model.AlertSeverity;
import com.conduit.monitor.model.ResourceLimit;
import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.monitor.model.ResourceType;
import com.conduit.monitor.model.ThresholdConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a sample against the configured levels. For each resource at most one alert is produced:
 * critical is tested first, comparisons are strict.
 */
@Component
public class ThresholdEvaluator {

    private static final double PROCESS_LIMIT_RATIO = 0.9;

    private final ThresholdConfig thresholds;

    public ThresholdEvaluator(ThresholdConfig thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param limit applied limits of the container, or null when none were set
     */
    public List<AlertCandidate> evaluate(ResourceMetrics sample, ResourceLimit limit) {
        List<AlertCandidate> breaches = new ArrayList<>(3);

        double cpu = sample.getCpu().usage();
        check(sample.getContainerId(), ResourceType.CPU, "CPU usage", cpu, thresholds.cpu(), breaches);

        double memory = sample.getMemory().percentage();
        check(sample.getContainerId(), ResourceType.MEMORY, "memory usage", memory, thresholds.memory(), breaches);

        if (limit != null && limit.getProcesses() != null) {
            long running = sample.getProcesses().running();
            int max = limit.getProcesses().max();
            if (running > max * PROCESS_LIMIT_RATIO) {
                breaches.add(new AlertCandidate(sample.getContainerId(), ResourceType.PROCESSES,
                        AlertSeverity.WARNING, max, running, "High process count: " + running));
            }
        }
        return breaches;
    }

    private static void check(String containerId, ResourceType type, String label, double value,
                              ThresholdConfig.Level level, List<AlertCandidate> out) {
        if (value > level.critical()) {
            out.add(new AlertCandidate(containerId, type, AlertSeverity.CRITICAL, level.critical(), value,
                    String.format(Locale.ROOT, "Critical %s: %.1f%%", label, value)));
        } else if (value > level.warning()) {
            out.add(new AlertCandidate(containerId, type, AlertSeverity.WARNING, level.warning(), value,
                    String.format(Locale.ROOT, "High %s: %.1f%%", label, value)));
        }
    }
}
