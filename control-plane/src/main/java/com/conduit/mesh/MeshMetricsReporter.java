package com.conduit.mesh;

import com.conduit.control.TickGuard;
import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.metrics.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
public class MeshMetricsReporter {

    private final ServiceRegistry registry;
    private final MetricsRegistry metricsRegistry;
    private final EventBus eventBus;
    private final Clock clock;
    private final TickGuard guard = new TickGuard();

    public MeshMetricsReporter(ServiceRegistry registry, MetricsRegistry metricsRegistry,
                               EventBus eventBus, Clock clock) {
        this.registry = registry;
        this.metricsRegistry = metricsRegistry;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${conduit.mesh.metrics-interval-ms:10000}",
            initialDelayString = "${conduit.mesh.metrics-interval-ms:10000}")
    public void execute() {
        long generation = guard.begin();
        if (generation < 0) {
            return;
        }
        try {
            MeshSummary summary = new MeshSummary(
                    metricsRegistry.totalRequests(),
                    registry.serviceCount(),
                    registry.endpointCount(),
                    clock.instant());

            if (!guard.isCurrent(generation)) {
                return;
            }
            eventBus.publish(EventTypes.METRICS_COLLECTED, ControlPlaneEvent.SOURCE_MESH, summary);

            log.debug("Mesh metrics: requests={}, services={}, endpoints={}",
                    summary.totalRequests(), summary.serviceCount(), summary.endpointCount());
        } catch (Exception e) {
            log.error("Mesh metrics tick failed", e);
        }
    }

    public void close() {
        guard.close();
    }
}
