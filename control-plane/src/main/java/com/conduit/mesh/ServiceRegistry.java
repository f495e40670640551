package com.conduit.mesh;

import com.conduit.model.EndpointHealth;
import com.conduit.model.ServiceEndpoint;
import com.conduit.model.ServiceInstances;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Endpoints grouped by service name. Each service's list is immutable and swapped atomically, so
 * readers always see a consistent list and mutations on one service never block another.
 */
@Slf4j
public class ServiceRegistry {

    private final Map<String, List<ServiceEndpoint>> services = new ConcurrentHashMap<>();

    /**
     * Inserts the endpoint, or replaces the one with the same id in its service.
     */
    public void register(ServiceEndpoint endpoint) {
        validate(endpoint);

        services.compute(endpoint.getServiceName(), (name, current) -> {
            List<ServiceEndpoint> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            int index = indexOf(updated, endpoint.getId());
            if (index >= 0) {
                updated.set(index, endpoint);
            } else {
                updated.add(endpoint);
            }
            return List.copyOf(updated);
        });

        log.info("Registered endpoint: {}/{} at {} with weight {}",
                endpoint.getServiceName(), endpoint.getId(), endpoint.getAddress(), endpoint.getWeight());
    }

    /**
     * Removes the endpoint. A service left without endpoints is forgotten.
     *
     * @return the removed endpoint, empty if it was not registered
     */
    public Optional<ServiceEndpoint> deregister(String serviceName, String endpointId) {
        AtomicReference<ServiceEndpoint> removed = new AtomicReference<>();

        services.computeIfPresent(serviceName, (name, current) -> {
            int index = indexOf(current, endpointId);
            if (index < 0) {
                return current;
            }
            List<ServiceEndpoint> updated = new ArrayList<>(current);
            removed.set(updated.remove(index));
            return updated.isEmpty() ? null : List.copyOf(updated);
        });

        if (removed.get() != null) {
            log.info("Deregistered endpoint: {}/{}", serviceName, endpointId);
        }
        return Optional.ofNullable(removed.get());
    }

    /**
     * Replaces the endpoint with a copy carrying the new health.
     *
     * @return the updated endpoint, empty if the endpoint is gone or its health did not change
     */
    public Optional<ServiceEndpoint> updateHealth(String serviceName, String endpointId, EndpointHealth health) {
        AtomicReference<ServiceEndpoint> changed = new AtomicReference<>();

        services.computeIfPresent(serviceName, (name, current) -> {
            int index = indexOf(current, endpointId);
            if (index < 0 || current.get(index).getHealth() == health) {
                return current;
            }
            List<ServiceEndpoint> updated = new ArrayList<>(current);
            ServiceEndpoint replacement = updated.get(index).withHealth(health);
            updated.set(index, replacement);
            changed.set(replacement);
            return List.copyOf(updated);
        });

        return Optional.ofNullable(changed.get());
    }

    public List<ServiceEndpoint> getEndpoints(String serviceName) {
        return services.getOrDefault(serviceName, List.of());
    }

    public List<ServiceEndpoint> getAllEndpoints() {
        return services.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    public List<ServiceInstances> listServices() {
        return services.entrySet().stream()
                .map(e -> new ServiceInstances(e.getKey(), e.getValue()))
                .toList();
    }

    public int serviceCount() {
        return services.size();
    }

    public int endpointCount() {
        return services.values().stream()
                .mapToInt(List::size)
                .sum();
    }

    private static int indexOf(List<ServiceEndpoint> endpoints, String endpointId) {
        for (int i = 0; i < endpoints.size(); i++) {
            if (endpoints.get(i).getId().equals(endpointId)) {
                return i;
            }
        }
        return -1;
    }

    private static void validate(ServiceEndpoint endpoint) {
        if (endpoint.getId() == null || endpoint.getId().isBlank()) {
            throw new IllegalArgumentException("Endpoint id is required");
        }
        if (endpoint.getServiceName() == null || endpoint.getServiceName().isBlank()) {
            throw new IllegalArgumentException("Service name is required for endpoint " + endpoint.getId());
        }
        if (endpoint.getWeight() < 0) {
            throw new IllegalArgumentException("Endpoint weight must not be negative: " + endpoint.getId());
        }
    }
}
