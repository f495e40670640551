package com.conduit.control;

import com.conduit.model.EndpointHealth;
import com.conduit.model.ServiceEndpoint;

/**
 * Reachability check run by the {@link HealthChecker}. Implementations must bound their own
 * running time; an exception is treated as {@link EndpointHealth#UNHEALTHY}.
 */
@FunctionalInterface
public interface HealthProbe {

    EndpointHealth check(ServiceEndpoint endpoint);
}
