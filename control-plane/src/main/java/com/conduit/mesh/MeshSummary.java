package com.conduit.mesh;

import java.time.Instant;

/**
 * Periodic aggregate published as a {@code metricsCollected} event from the mesh.
 */
public record MeshSummary(
        long totalRequests,
        int serviceCount,
        int endpointCount,
        Instant timestamp
) {
}
