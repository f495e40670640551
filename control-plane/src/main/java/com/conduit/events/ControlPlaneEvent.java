package com.conduit.events;

import java.time.Instant;

/**
 * A notification emitted by the mesh or the resource monitor.
 *
 * @param eventType one of the names in {@link EventTypes}
 * @param source    {@code "mesh"} or {@code "monitor"}
 * @param payload   the object the event is about (endpoint, route, alert, sample, ...)
 * @param timestamp when the event was published
 */
public record ControlPlaneEvent(
        String eventType,
        String source,
        Object payload,
        Instant timestamp
) {

    public static final String SOURCE_MESH = "mesh";
    public static final String SOURCE_MONITOR = "monitor";

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
