package com.conduit.monitor;

import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.monitor.model.AlertSeverity;
import com.conduit.monitor.model.ResourceAlert;
import com.conduit.monitor.model.ResourceForecast;
import com.conduit.monitor.model.ResourceLimit;
import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.monitor.model.ResourceTrends;
import com.conduit.monitor.model.UtilizationSummary;
import com.conduit.runtime.ContainerRuntime;
import com.conduit.runtime.ContainerRuntimeException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Entry point of resource monitoring: which containers are sampled, their limits, history, alerts,
 * trends and forecasts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourceMonitor {

    public static final Duration DEFAULT_TREND_WINDOW = Duration.ofHours(1);
    public static final int DEFAULT_FORECAST_MINUTES = 30;

    private final ResourceMetricsCollector collector;
    private final MetricsHistory history;
    private final AlertManager alertManager;
    private final ResourceLimitStore limitStore;
    private final TrendForecaster forecaster;
    private final RetentionSweeper sweeper;
    private final ContainerRuntime runtime;
    private final EventBus eventBus;
    private final Clock clock;

    private final List<EventBus.Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public void addContainer(String containerId) {
        collector.track(containerId);
        history.track(containerId);
        alertManager.track(containerId);
        log.info("Container added to resource monitoring: {}", containerId);
    }

    /**
     * Stops sampling. History and alerts stay until the retention sweep ages them out.
     */
    public void removeContainer(String containerId) {
        collector.untrack(containerId);
        log.info("Container removed from resource monitoring: {}", containerId);
    }

    /**
     * Pushes the limits to the runtime and remembers them only if the runtime accepted them.
     */
    public boolean setResourceLimits(String containerId, ResourceLimit limit) {
        try {
            runtime.updateLimits(containerId, limit);
        } catch (ContainerRuntimeException e) {
            log.error("Failed to set resource limits for {}: {}", containerId, e.getMessage(), e);
            return false;
        }

        limitStore.put(containerId, limit);
        log.info("Resource limits updated for {}", containerId);
        eventBus.publish(EventTypes.LIMITS_UPDATED, ControlPlaneEvent.SOURCE_MONITOR, limit);
        return true;
    }

    public Optional<ResourceLimit> getLimits(String containerId) {
        return limitStore.get(containerId);
    }

    public List<ResourceMetrics> getMetrics(String containerId) {
        return history.samples(containerId);
    }

    public List<ResourceAlert> getAlerts(String containerId) {
        return alertManager.getAlerts(containerId);
    }

    public List<ResourceAlert> getAllAlerts() {
        return alertManager.getActiveAlerts();
    }

    public boolean acknowledgeAlert(String alertId) {
        return alertManager.acknowledge(alertId);
    }

    public UtilizationSummary getUtilizationSummary() {
        Set<String> containers = collector.activeContainers();
        double totalCpu = 0;
        long totalMemory = 0;
        int sampled = 0;

        for (String containerId : containers) {
            Optional<ResourceMetrics> latest = history.latest(containerId);
            if (latest.isPresent()) {
                totalCpu += latest.get().getCpu().usage();
                totalMemory += latest.get().getMemory().usage();
                sampled++;
            }
        }

        List<ResourceAlert> active = alertManager.getActiveAlerts();
        int critical = (int) active.stream()
                .filter(a -> a.getSeverity() == AlertSeverity.CRITICAL)
                .count();

        return new UtilizationSummary(
                containers.size(),
                sampled > 0 ? totalCpu / sampled : 0,
                sampled > 0 ? (double) totalMemory / sampled : 0,
                totalMemory,
                active.size(),
                critical);
    }

    public ResourceTrends getResourceTrends(String containerId) {
        return getResourceTrends(containerId, DEFAULT_TREND_WINDOW);
    }

    public ResourceTrends getResourceTrends(String containerId, Duration window) {
        List<ResourceMetrics> recent = history.since(containerId, clock.instant().minus(window));

        return new ResourceTrends(
                recent.stream()
                        .map(m -> new ResourceTrends.Point(m.getTimestamp(), m.getCpu().usage()))
                        .toList(),
                recent.stream()
                        .map(m -> new ResourceTrends.Point(m.getTimestamp(), m.getMemory().percentage()))
                        .toList(),
                recent.stream()
                        .map(m -> new ResourceTrends.NetworkPoint(m.getTimestamp(),
                                m.getNetwork().rxBytes(), m.getNetwork().txBytes()))
                        .toList());
    }

    public ResourceForecast predictResourceUsage(String containerId) {
        return predictResourceUsage(containerId, DEFAULT_FORECAST_MINUTES);
    }

    public ResourceForecast predictResourceUsage(String containerId, int forecastMinutes) {
        return forecaster.forecast(history.samples(containerId), forecastMinutes);
    }

    public EventBus.Subscription on(String eventType, Consumer<ControlPlaneEvent> listener) {
        EventBus.Subscription subscription = eventBus.subscribe(eventType, listener);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Stops sampling and sweeping and drops listeners registered through {@link #on}.
     */
    @PreDestroy
    public void close() {
        collector.close();
        sweeper.close();
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
        log.info("Resource monitor closed");
    }
}
