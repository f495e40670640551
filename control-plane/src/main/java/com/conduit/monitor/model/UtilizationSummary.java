package com.conduit.monitor.model;

/**
 * Fleet-wide view over the latest sample of each monitored container.
 *
 * @param averageMemoryUsage mean memory usage in bytes
 * @param totalMemoryUsed    summed memory usage in bytes
 * @param activeAlerts       unacknowledged alerts
 */
public record UtilizationSummary(
        int totalContainers,
        double averageCpuUsage,
        double averageMemoryUsage,
        long totalMemoryUsed,
        int activeAlerts,
        int criticalAlerts
) {
}
