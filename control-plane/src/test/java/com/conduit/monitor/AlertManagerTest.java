package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.monitor.model.AlertSeverity;
import com.conduit.monitor.model.ResourceAlert;
import com.conduit.monitor.model.ResourceType;
import com.conduit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AlertManagerTest {

    private MutableClock clock;
    private AlertManager alertManager;
    private List<ControlPlaneEvent> events;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        EventBus eventBus = new EventBus(clock);
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        alertManager = new AlertManager(new MonitorProperties(), eventBus, clock);
    }

    private static AlertCandidate cpu(String containerId, AlertSeverity severity, double value) {
        return new AlertCandidate(containerId, ResourceType.CPU, severity,
                severity == AlertSeverity.CRITICAL ? 90 : 70, value, "CPU " + value);
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        @Test
        @DisplayName("the same breach within the cooldown produces one alert")
        void suppressedWithinCooldown() {
            Optional<ResourceAlert> first = alertManager.raise(cpu("c-1", AlertSeverity.CRITICAL, 95));
            clock.advance(Duration.ofMinutes(4));
            Optional<ResourceAlert> second = alertManager.raise(cpu("c-1", AlertSeverity.CRITICAL, 97));

            assertTrue(first.isPresent());
            assertTrue(second.isEmpty());
            assertEquals(1, alertManager.getAlerts("c-1").size());
            assertEquals(1, events.size());
            assertEquals(EventTypes.ALERT_CREATED, events.get(0).eventType());
            assertEquals(ControlPlaneEvent.SOURCE_MONITOR, events.get(0).source());
        }

        @Test
        @DisplayName("a new alert is raised once the cooldown has passed")
        void raisedAfterCooldown() {
            alertManager.raise(cpu("c-1", AlertSeverity.CRITICAL, 95));
            clock.advance(Duration.ofMinutes(5));

            assertTrue(alertManager.raise(cpu("c-1", AlertSeverity.CRITICAL, 95)).isPresent());
            assertEquals(2, alertManager.getAlerts("c-1").size());
        }

        @Test
        @DisplayName("an acknowledged alert does not suppress a new one")
        void acknowledgedDoesNotSuppress() {
            ResourceAlert alert = alertManager.raise(cpu("c-1", AlertSeverity.WARNING, 75)).orElseThrow();
            assertTrue(alertManager.acknowledge(alert.getId()));

            assertTrue(alertManager.raise(cpu("c-1", AlertSeverity.WARNING, 76)).isPresent());
        }

        @Test
        @DisplayName("severity, type and container are part of the key")
        void keyedBySeverityTypeAndContainer() {
            alertManager.raise(cpu("c-1", AlertSeverity.WARNING, 75));

            assertTrue(alertManager.raise(cpu("c-1", AlertSeverity.CRITICAL, 95)).isPresent());
            assertTrue(alertManager.raise(cpu("c-2", AlertSeverity.WARNING, 75)).isPresent());
            assertTrue(alertManager.raise(new AlertCandidate("c-1", ResourceType.MEMORY, AlertSeverity.WARNING,
                    80, 85, "memory")).isPresent());
        }
    }

    @Test
    @DisplayName("acknowledge marks the alert and reports unknown ids")
    void acknowledge() {
        ResourceAlert alert = alertManager.raise(cpu("c-1", AlertSeverity.WARNING, 75)).orElseThrow();

        assertTrue(alertManager.acknowledge(alert.getId()));
        assertFalse(alertManager.acknowledge("no-such-alert"));

        assertTrue(alertManager.getAlerts("c-1").get(0).isAcknowledged());
        assertTrue(alertManager.getActiveAlerts().isEmpty());
        assertEquals(EventTypes.ALERT_ACKNOWLEDGED, events.get(events.size() - 1).eventType());
    }

    @Test
    @DisplayName("active alerts are unacknowledged and newest first")
    void activeAlertsOrder() {
        alertManager.raise(cpu("c-1", AlertSeverity.WARNING, 75));
        clock.advance(Duration.ofSeconds(5));
        alertManager.raise(cpu("c-2", AlertSeverity.WARNING, 75));
        clock.advance(Duration.ofSeconds(5));
        ResourceAlert acked = alertManager.raise(cpu("c-3", AlertSeverity.WARNING, 75)).orElseThrow();
        alertManager.acknowledge(acked.getId());

        List<ResourceAlert> active = alertManager.getActiveAlerts();

        assertEquals(List.of("c-2", "c-1"), active.stream().map(ResourceAlert::getContainerId).toList());
    }

    @Test
    @DisplayName("sweep drops alerts older than the cutoff")
    void sweep() {
        alertManager.raise(cpu("c-1", AlertSeverity.WARNING, 75));
        clock.advance(Duration.ofMinutes(30));
        alertManager.raise(cpu("c-1", AlertSeverity.CRITICAL, 95));

        int removed = alertManager.sweep(clock.instant().minus(Duration.ofMinutes(10)));

        assertEquals(1, removed);
        assertEquals(AlertSeverity.CRITICAL, alertManager.getAlerts("c-1").get(0).getSeverity());
    }
}
