package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.monitor.model.AlertSeverity;
import com.conduit.monitor.model.ResourceAlert;
import com.conduit.monitor.model.ResourceForecast;
import com.conduit.monitor.model.ResourceLimit;
import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.monitor.model.ResourceTrends;
import com.conduit.monitor.model.ResourceType;
import com.conduit.monitor.model.ThresholdConfig;
import com.conduit.monitor.model.UtilizationSummary;
import com.conduit.runtime.ContainerRuntime;
import com.conduit.runtime.ContainerRuntimeException;
import com.conduit.support.MutableClock;
import com.conduit.support.Samples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ResourceMonitorTest {

    private static final long MIB = 1024 * 1024;

    private MutableClock clock;
    private EventBus eventBus;
    private ContainerRuntime runtime;
    private MonitorProperties properties;
    private List<ControlPlaneEvent> events;
    private ResourceMonitor monitor;
    private ResourceMetricsCollector collector;
    private RetentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        eventBus = new EventBus(clock);
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        runtime = mock(ContainerRuntime.class);
        properties = new MonitorProperties();
        properties.setHistoryCapacity(3);
        build();
    }

    private void build() {
        ThresholdConfig thresholds = ThresholdConfig.defaults();
        MetricsHistory history = new MetricsHistory(properties);
        AlertManager alertManager = new AlertManager(properties, eventBus, clock);
        ResourceLimitStore limitStore = new ResourceLimitStore();
        collector = new ResourceMetricsCollector(runtime, new ResourceMetricsCalculator(), history,
                new ThresholdEvaluator(thresholds), alertManager, limitStore, eventBus, clock);
        sweeper = new RetentionSweeper(history, alertManager, properties, clock);
        monitor = new ResourceMonitor(collector, history, alertManager, limitStore,
                new TrendForecaster(properties, thresholds), sweeper, runtime, eventBus, clock);
    }

    private void tick() {
        collector.execute();
        clock.advance(Duration.ofSeconds(5));
    }

    private List<String> eventTypes() {
        return events.stream().map(ControlPlaneEvent::eventType).toList();
    }

    @Nested
    @DisplayName("sampling")
    class Sampling {

        @Test
        @DisplayName("a tick stores a sample and raises its alerts before publishing the sample")
        void tickStoresAndAlerts() {
            when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(95, 256 * MIB, 1024 * MIB, 4));
            monitor.addContainer("c-1");

            collector.execute();

            List<ResourceMetrics> samples = monitor.getMetrics("c-1");
            assertEquals(1, samples.size());
            assertEquals(95.0, samples.get(0).getCpu().usage(), 1e-9);
            assertEquals(25.0, samples.get(0).getMemory().percentage(), 1e-9);
            assertEquals(clock.instant(), samples.get(0).getTimestamp());

            List<ResourceAlert> alerts = monitor.getAlerts("c-1");
            assertEquals(1, alerts.size());
            assertEquals(ResourceType.CPU, alerts.get(0).getType());
            assertEquals(AlertSeverity.CRITICAL, alerts.get(0).getSeverity());
            assertEquals(List.of(EventTypes.ALERT_CREATED, EventTypes.METRICS_COLLECTED), eventTypes());
            assertEquals(ControlPlaneEvent.SOURCE_MONITOR, events.get(0).source());
        }

        @Test
        @DisplayName("a failed fetch skips that container only")
        void failedFetchSkipped() {
            when(runtime.fetchStats("gone")).thenThrow(new ContainerRuntimeException("gone", "No such container"));
            when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(10, 10, 100, 1));
            monitor.addContainer("gone");
            monitor.addContainer("c-1");

            assertDoesNotThrow(() -> collector.execute());

            assertTrue(monitor.getMetrics("gone").isEmpty());
            assertEquals(1, monitor.getMetrics("c-1").size());
        }

        @Test
        @DisplayName("history is bounded and evicts the oldest samples")
        void boundedHistory() {
            when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(10, 10, 100, 1));
            monitor.addContainer("c-1");
            Instant third = clock.instant().plusSeconds(10);

            for (int i = 0; i < 5; i++) {
                tick();
            }

            List<ResourceMetrics> samples = monitor.getMetrics("c-1");
            assertEquals(3, samples.size());
            assertEquals(third, samples.get(0).getTimestamp());
            assertEquals(third.plusSeconds(10), samples.get(2).getTimestamp());
        }

        @Test
        @DisplayName("removed containers stop being sampled but keep their history")
        void removeContainer() {
            when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(10, 10, 100, 1));
            monitor.addContainer("c-1");
            tick();

            monitor.removeContainer("c-1");
            tick();

            verify(runtime, times(1)).fetchStats("c-1");
            assertEquals(1, monitor.getMetrics("c-1").size());
        }

        @Test
        @DisplayName("no sampling after close")
        void closeStopsSampling() {
            monitor.addContainer("c-1");
            monitor.close();

            collector.execute();

            verify(runtime, never()).fetchStats(anyString());
        }
    }

    @Nested
    @DisplayName("limits")
    class Limits {

        private final ResourceLimit limit = ResourceLimit.builder()
                .containerId("c-1")
                .cpu(new ResourceLimit.Cpu(1, 50))
                .memory(new ResourceLimit.Memory(512 * MIB, 1024 * MIB, 256 * MIB))
                .processes(new ResourceLimit.Processes(10))
                .build();

        @Test
        @DisplayName("accepted limits are stored and announced")
        void accepted() {
            assertTrue(monitor.setResourceLimits("c-1", limit));

            verify(runtime).updateLimits("c-1", limit);
            assertEquals(limit, monitor.getLimits("c-1").orElseThrow());
            assertEquals(List.of(EventTypes.LIMITS_UPDATED), eventTypes());
        }

        @Test
        @DisplayName("rejected limits are not stored")
        void rejected() {
            doThrow(new ContainerRuntimeException("c-1", "rejected")).when(runtime).updateLimits(eq("c-1"), any());

            assertFalse(monitor.setResourceLimits("c-1", limit));

            assertTrue(monitor.getLimits("c-1").isEmpty());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("stored process limits drive process alerts")
        void processAlerts() {
            monitor.setResourceLimits("c-1", limit);
            when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(10, 10, 100, 10));
            monitor.addContainer("c-1");

            collector.execute();

            List<ResourceAlert> alerts = monitor.getAllAlerts();
            assertEquals(1, alerts.size());
            assertEquals(ResourceType.PROCESSES, alerts.get(0).getType());
        }
    }

    @Test
    @DisplayName("acknowledging an alert removes it from the active list")
    void acknowledgeAlert() {
        when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(75, 10, 100, 1));
        monitor.addContainer("c-1");
        collector.execute();
        ResourceAlert alert = monitor.getAllAlerts().get(0);

        assertTrue(monitor.acknowledgeAlert(alert.getId()));

        assertTrue(monitor.getAllAlerts().isEmpty());
        assertEquals(1, monitor.getAlerts("c-1").size());
    }

    @Test
    @DisplayName("utilization summary averages the latest samples")
    void utilizationSummary() {
        when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(20, 100, 1000, 1));
        when(runtime.fetchStats("c-2")).thenReturn(Samples.stats(92, 300, 1000, 1));
        monitor.addContainer("c-1");
        monitor.addContainer("c-2");
        monitor.addContainer("idle");
        when(runtime.fetchStats("idle")).thenThrow(new ContainerRuntimeException("idle", "not running"));

        collector.execute();
        UtilizationSummary summary = monitor.getUtilizationSummary();

        assertEquals(3, summary.totalContainers());
        assertEquals(56.0, summary.averageCpuUsage(), 1e-9);
        assertEquals(200.0, summary.averageMemoryUsage(), 1e-9);
        assertEquals(400, summary.totalMemoryUsed());
        assertEquals(1, summary.activeAlerts());
        assertEquals(1, summary.criticalAlerts());
    }

    @Test
    @DisplayName("an empty monitor summarises to zeros")
    void emptySummary() {
        UtilizationSummary summary = monitor.getUtilizationSummary();

        assertEquals(0, summary.totalContainers());
        assertEquals(0.0, summary.averageCpuUsage());
        assertEquals(0, summary.totalMemoryUsed());
    }

    @Test
    @DisplayName("trends cover the requested window only")
    void trends() {
        properties.setHistoryCapacity(100);
        build();
        when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(30, 500, 1000, 1));
        monitor.addContainer("c-1");

        collector.execute();
        clock.advance(Duration.ofMinutes(20));
        collector.execute();
        clock.advance(Duration.ofMinutes(1));

        ResourceTrends recent = monitor.getResourceTrends("c-1", Duration.ofMinutes(10));
        ResourceTrends all = monitor.getResourceTrends("c-1");

        assertEquals(1, recent.cpu().size());
        assertEquals(30.0, recent.cpu().get(0).value(), 1e-9);
        assertEquals(50.0, recent.memory().get(0).value(), 1e-9);
        assertEquals(1000, recent.network().get(0).rx());
        assertEquals(500, recent.network().get(0).tx());
        assertEquals(2, all.cpu().size());
    }

    @Test
    @DisplayName("forecasting needs at least ten samples")
    void forecastNeedsData() {
        ResourceForecast forecast = monitor.predictResourceUsage("c-1");

        assertEquals(List.of("Insufficient data for prediction"), forecast.alerts());
    }

    @Test
    @DisplayName("the retention sweep drops aged samples and alerts")
    void retentionSweep() {
        properties.setHistoryCapacity(100);
        build();
        when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(95, 10, 100, 1));
        monitor.addContainer("c-1");
        collector.execute();
        clock.advance(Duration.ofMinutes(50));
        when(runtime.fetchStats("c-1")).thenReturn(Samples.stats(10, 10, 100, 1));
        collector.execute();

        clock.advance(Duration.ofMinutes(15));
        sweeper.execute();

        assertEquals(1, monitor.getMetrics("c-1").size());
        assertEquals(10.0, monitor.getMetrics("c-1").get(0).getCpu().usage(), 1e-9);
        assertTrue(monitor.getAlerts("c-1").isEmpty());
    }

    @Test
    @DisplayName("close drops listeners registered through the monitor")
    void closeDropsListeners() {
        List<ControlPlaneEvent> seen = new ArrayList<>();
        monitor.on(EventTypes.LIMITS_UPDATED, seen::add);
        ResourceLimit limit = ResourceLimit.builder().containerId("c-1").build();

        monitor.setResourceLimits("c-1", limit);
        monitor.close();
        monitor.setResourceLimits("c-1", limit);

        assertEquals(1, seen.size());
    }
}
