package com.conduit.model;

/**
 * Endpoint selection strategies a route can ask for.
 * <p>
 * Only {@link #WEIGHTED} is exact. {@link #ROUND_ROBIN} is a stateless uniform pick, and
 * {@link #LEAST_CONNECTIONS} / {@link #IP_HASH} take the first healthy endpoint because neither
 * connection counts nor client addresses are tracked.
 */
public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    WEIGHTED,
    LEAST_CONNECTIONS,
    IP_HASH
}
