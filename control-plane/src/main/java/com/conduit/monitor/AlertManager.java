package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.monitor.model.ResourceAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Alert lists per container. Each list is immutable and replaced atomically.
 * <p>
 * A new alert is suppressed while an unacknowledged alert of the same type and severity for the same
 * container is younger than the cooldown.
 */
@Slf4j
@Component
public class AlertManager {

    private final Duration cooldown;
    private final EventBus eventBus;
    private final Clock clock;

    private final Map<String, List<ResourceAlert>> alerts = new ConcurrentHashMap<>();

    public AlertManager(MonitorProperties properties, EventBus eventBus, Clock clock) {
        this.cooldown = Duration.ofMillis(properties.getAlertCooldownMs());
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void track(String containerId) {
        alerts.putIfAbsent(containerId, List.of());
    }

    public Optional<ResourceAlert> raise(AlertCandidate candidate) {
        Instant now = clock.instant();
        AtomicReference<ResourceAlert> created = new AtomicReference<>();

        alerts.compute(candidate.containerId(), (id, current) -> {
            List<ResourceAlert> existing = current != null ? current : List.of();
            if (isCoolingDown(existing, candidate, now)) {
                return current;
            }

            ResourceAlert alert = ResourceAlert.builder()
                    .id(UUID.randomUUID().toString())
                    .containerId(id)
                    .type(candidate.type())
                    .severity(candidate.severity())
                    .threshold(candidate.threshold())
                    .currentValue(candidate.currentValue())
                    .message(candidate.message())
                    .timestamp(now)
                    .acknowledged(false)
                    .build();
            created.set(alert);

            List<ResourceAlert> updated = new ArrayList<>(existing);
            updated.add(alert);
            return List.copyOf(updated);
        });

        ResourceAlert alert = created.get();
        if (alert == null) {
            log.debug("Alert suppressed by cooldown: container={}, type={}, severity={}",
                    candidate.containerId(), candidate.type(), candidate.severity());
            return Optional.empty();
        }

        log.warn("Resource alert created: container={}, type={}, severity={}, message={}",
                alert.getContainerId(), alert.getType(), alert.getSeverity(), alert.getMessage());
        eventBus.publish(EventTypes.ALERT_CREATED, ControlPlaneEvent.SOURCE_MONITOR, alert);
        return Optional.of(alert);
    }

    /**
     * @return false when no alert has this id
     */
    public boolean acknowledge(String alertId) {
        for (String containerId : alerts.keySet()) {
            AtomicReference<ResourceAlert> acknowledged = new AtomicReference<>();

            alerts.computeIfPresent(containerId, (id, current) -> {
                List<ResourceAlert> updated = new ArrayList<>(current.size());
                for (ResourceAlert alert : current) {
                    if (alert.getId().equals(alertId)) {
                        ResourceAlert acked = alert.withAcknowledged(true);
                        acknowledged.set(acked);
                        updated.add(acked);
                    } else {
                        updated.add(alert);
                    }
                }
                return acknowledged.get() != null ? List.copyOf(updated) : current;
            });

            if (acknowledged.get() != null) {
                log.info("Alert acknowledged: {} on {}", alertId, containerId);
                eventBus.publish(EventTypes.ALERT_ACKNOWLEDGED, ControlPlaneEvent.SOURCE_MONITOR, acknowledged.get());
                return true;
            }
        }
        return false;
    }

    public List<ResourceAlert> getAlerts(String containerId) {
        return alerts.getOrDefault(containerId, List.of());
    }

    /**
     * Unacknowledged alerts across all containers, newest first.
     */
    public List<ResourceAlert> getActiveAlerts() {
        return alerts.values().stream()
                .flatMap(List::stream)
                .filter(a -> !a.isAcknowledged())
                .sorted(Comparator.comparing(ResourceAlert::getTimestamp).reversed())
                .toList();
    }

    /**
     * Drops alerts raised before {@code cutoff}.
     */
    public int sweep(Instant cutoff) {
        int[] removed = {0};
        for (String containerId : alerts.keySet()) {
            alerts.computeIfPresent(containerId, (id, current) -> {
                List<ResourceAlert> kept = current.stream()
                        .filter(a -> !a.getTimestamp().isBefore(cutoff))
                        .toList();
                removed[0] += current.size() - kept.size();
                return kept;
            });
        }
        return removed[0];
    }

    private boolean isCoolingDown(List<ResourceAlert> existing, AlertCandidate candidate, Instant now) {
        return existing.stream().anyMatch(a -> !a.isAcknowledged()
                && a.getType() == candidate.type()
                && a.getSeverity() == candidate.severity()
                && Duration.between(a.getTimestamp(), now).compareTo(cooldown) < 0);
    }
}
