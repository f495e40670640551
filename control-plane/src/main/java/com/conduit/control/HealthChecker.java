package com.conduit.control;

import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.mesh.ServiceRegistry;
import com.conduit.model.EndpointHealth;
import com.conduit.model.ServiceEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Component
public class HealthChecker {

    private final ServiceRegistry registry;
    private final HealthProbe probe;
    private final EventBus eventBus;
    private final Clock clock;
    private final TickGuard guard = new TickGuard();

    private volatile Instant lastExecution;

    public HealthChecker(ServiceRegistry registry, HealthProbe probe, EventBus eventBus, Clock clock) {
        this.registry = registry;
        this.probe = probe;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${conduit.mesh.health-check-interval-ms:30000}",
            initialDelayString = "${conduit.mesh.health-check-interval-ms:30000}")
    public void execute() {
        long generation = guard.begin();
        if (generation < 0) {
            return;
        }
        lastExecution = clock.instant();

        List<ServiceEndpoint> endpoints = registry.getAllEndpoints();
        for (ServiceEndpoint endpoint : endpoints) {
            EndpointHealth health = probeSafely(endpoint);

            if (!guard.isCurrent(generation)) {
                log.debug("Health check tick discarded after shutdown");
                return;
            }

            registry.updateHealth(endpoint.getServiceName(), endpoint.getId(), health)
                    .ifPresent(updated -> {
                        log.info("Endpoint health changed: {}/{} {} -> {}",
                                updated.getServiceName(), updated.getId(), endpoint.getHealth(), updated.getHealth());
                        eventBus.publish(EventTypes.HEALTH_CHANGED, ControlPlaneEvent.SOURCE_MESH, updated);
                    });
        }

        log.debug("Health check executed: endpoints={}", endpoints.size());
    }

    public void close() {
        guard.close();
    }

    public Instant getLastExecution() {
        return lastExecution;
    }

    private EndpointHealth probeSafely(ServiceEndpoint endpoint) {
        try {
            EndpointHealth health = probe.check(endpoint);
            return health != null ? health : EndpointHealth.UNKNOWN;
        } catch (RuntimeException e) {
            log.error("Health check failed for endpoint {}", endpoint.getId(), e);
            return EndpointHealth.UNHEALTHY;
        }
    }
}
