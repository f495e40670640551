package com.conduit.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * One addressable instance backing a named service. Instances are immutable; a health change
 * replaces the registered object.
 */
@Value
@With
@Builder(toBuilder = true)
public class ServiceEndpoint {

    String id;
    String serviceName;
    String host;
    int port;
    @Builder.Default
    Protocol protocol = Protocol.HTTP;
    @Builder.Default
    EndpointHealth health = EndpointHealth.UNKNOWN;
    @Builder.Default
    int weight = 100;
    @Builder.Default
    List<String> tags = List.of();
    @Builder.Default
    Map<String, String> metadata = Map.of();

    public boolean isHealthy() {
        return health == EndpointHealth.HEALTHY;
    }

    public String getAddress() {
        return host + ":" + port;
    }
}
