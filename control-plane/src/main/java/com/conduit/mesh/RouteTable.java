package com.conduit.mesh;

import com.conduit.model.ServiceRoute;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes in creation order. Writers publish a fresh copy; readers iterate whatever copy is current.
 */
@Slf4j
@Component
public class RouteTable {

    private volatile Map<String, ServiceRoute> routes = Map.of();

    public synchronized void put(ServiceRoute route) {
        if (route.getId() == null || route.getServiceName() == null || route.getPath() == null) {
            throw new IllegalArgumentException("Route id, service name and path are required");
        }
        Map<String, ServiceRoute> updated = new LinkedHashMap<>(routes);
        updated.put(route.getId(), route);
        routes = updated;
    }

    public synchronized Optional<ServiceRoute> remove(String routeId) {
        if (!routes.containsKey(routeId)) {
            return Optional.empty();
        }
        Map<String, ServiceRoute> updated = new LinkedHashMap<>(routes);
        ServiceRoute removed = updated.remove(routeId);
        routes = updated;
        return Optional.of(removed);
    }

    /**
     * First route of {@code serviceName}, in creation order, that accepts the method and path.
     */
    public Optional<ServiceRoute> findMatch(String serviceName, String path, String method) {
        return routes.values().stream()
                .filter(r -> r.getServiceName().equals(serviceName))
                .filter(r -> r.acceptsMethod(method))
                .filter(r -> r.matchesPath(path))
                .findFirst();
    }

    public List<ServiceRoute> getAll() {
        return List.copyOf(routes.values());
    }
}
