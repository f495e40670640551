package com.conduit.control;

import com.conduit.events.ControlPlaneEvent;
import com.conduit.events.EventBus;
import com.conduit.events.EventTypes;
import com.conduit.mesh.ServiceRegistry;
import com.conduit.model.EndpointHealth;
import com.conduit.model.ServiceEndpoint;
import com.conduit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckerTest {

    private MutableClock clock;
    private EventBus eventBus;
    private ServiceRegistry registry;
    private List<ControlPlaneEvent> changes;
    private AtomicReference<EndpointHealth> probeResult;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        eventBus = new EventBus(clock);
        registry = new ServiceRegistry();
        registry.register(ServiceEndpoint.builder()
                .id("a-1")
                .serviceName("agents")
                .host("localhost")
                .port(8080)
                .build());
        changes = new ArrayList<>();
        eventBus.subscribe(EventTypes.HEALTH_CHANGED, changes::add);
        probeResult = new AtomicReference<>(EndpointHealth.HEALTHY);
    }

    private ServiceEndpoint current() {
        return registry.getEndpoints("agents").get(0);
    }

    @Test
    @DisplayName("publishes healthChanged only when the probe result differs")
    void publishesOnChange() {
        HealthChecker checker = new HealthChecker(registry, e -> probeResult.get(), eventBus, clock);

        checker.execute();
        checker.execute();

        assertEquals(EndpointHealth.HEALTHY, current().getHealth());
        assertEquals(1, changes.size());
        assertEquals(EndpointHealth.HEALTHY, changes.get(0).payloadAs(ServiceEndpoint.class).getHealth());
        assertEquals(clock.instant(), checker.getLastExecution());

        probeResult.set(EndpointHealth.UNHEALTHY);
        checker.execute();

        assertEquals(EndpointHealth.UNHEALTHY, current().getHealth());
        assertEquals(2, changes.size());
    }

    @Test
    @DisplayName("a throwing probe marks the endpoint unhealthy")
    void throwingProbe() {
        HealthChecker checker = new HealthChecker(registry, e -> {
            throw new IllegalStateException("probe exploded");
        }, eventBus, clock);

        assertDoesNotThrow(checker::execute);

        assertEquals(EndpointHealth.UNHEALTHY, current().getHealth());
    }

    @Test
    @DisplayName("no updates after close")
    void closedCheckerDoesNothing() {
        HealthChecker checker = new HealthChecker(registry, e -> probeResult.get(), eventBus, clock);
        checker.close();

        checker.execute();

        assertEquals(EndpointHealth.UNKNOWN, current().getHealth());
        assertTrue(changes.isEmpty());
    }

    @Test
    @DisplayName("a close during the tick discards the tick's writes")
    void closeDuringTick() {
        AtomicReference<HealthChecker> self = new AtomicReference<>();
        HealthChecker checker = new HealthChecker(registry, e -> {
            self.get().close();
            return EndpointHealth.HEALTHY;
        }, eventBus, clock);
        self.set(checker);

        checker.execute();

        assertEquals(EndpointHealth.UNKNOWN, current().getHealth());
        assertTrue(changes.isEmpty());
    }
}
