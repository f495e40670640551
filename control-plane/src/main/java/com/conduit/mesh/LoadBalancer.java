package com.conduit.mesh;

import com.conduit.model.LoadBalancingStrategy;
import com.conduit.model.ServiceEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Component
public class LoadBalancer {

    /**
     * Picks one healthy endpoint, or nothing when none is healthy.
     */
    public Optional<ServiceEndpoint> select(List<ServiceEndpoint> endpoints, LoadBalancingStrategy strategy) {
        List<ServiceEndpoint> healthy = endpoints.stream()
                .filter(ServiceEndpoint::isHealthy)
                .toList();

        if (healthy.isEmpty()) {
            log.debug("No healthy endpoints among {} candidates", endpoints.size());
            return Optional.empty();
        }

        return switch (strategy) {
            case WEIGHTED -> weightedRandomSelection(healthy);
            case ROUND_ROBIN -> Optional.of(healthy.get(ThreadLocalRandom.current().nextInt(healthy.size())));
            // no connection or client address tracking: first healthy endpoint wins
            case LEAST_CONNECTIONS, IP_HASH -> Optional.of(healthy.get(0));
        };
    }

    /**
     * Cumulative-weight walk over a uniform draw in {@code [0, totalWeight)}. A zero-weight
     * endpoint never wins; if every weight is zero nothing is selected.
     */
    private Optional<ServiceEndpoint> weightedRandomSelection(List<ServiceEndpoint> endpoints) {
        int totalWeight = endpoints.stream()
                .mapToInt(ServiceEndpoint::getWeight)
                .sum();

        if (totalWeight <= 0) {
            log.debug("All {} healthy endpoints carry zero weight", endpoints.size());
            return Optional.empty();
        }

        int random = ThreadLocalRandom.current().nextInt(totalWeight);
        int currentSum = 0;

        for (ServiceEndpoint endpoint : endpoints) {
            currentSum += endpoint.getWeight();
            if (random < currentSum) {
                return Optional.of(endpoint);
            }
        }

        return Optional.of(endpoints.get(endpoints.size() - 1));
    }
}
