package com.conduit.config;

import com.conduit.control.HealthProbe;
import com.conduit.control.NetworkHealthProbe;
import com.conduit.mesh.ServiceRegistry;
import com.conduit.model.CircuitBreakerSettings;
import com.conduit.model.Protocol;
import com.conduit.model.ServiceEndpoint;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
public class MeshConfig {

    @Bean
    @ConfigurationProperties(prefix = "conduit.mesh")
    public MeshProperties meshProperties() {
        return new MeshProperties();
    }

    @Bean
    public ServiceRegistry serviceRegistry(MeshProperties properties) {
        properties.validate();
        ServiceRegistry registry = new ServiceRegistry();

        for (EndpointDefinition def : properties.getEndpoints()) {
            registry.register(def.toEndpoint());
        }

        log.info("Initialized service registry with {} endpoints across {} services",
                registry.endpointCount(), registry.serviceCount());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(HealthProbe.class)
    public HealthProbe healthProbe(MeshProperties properties) {
        return new NetworkHealthProbe(Duration.ofMillis(properties.getProbeTimeoutMs()));
    }

    @Data
    public static class MeshProperties {
        private long healthCheckIntervalMs = 30_000;
        private long probeTimeoutMs = 2_000;
        private long metricsIntervalMs = 10_000;
        private CircuitBreakerDefaults circuitBreaker = new CircuitBreakerDefaults();
        private List<EndpointDefinition> endpoints = new ArrayList<>();

        void validate() {
            if (healthCheckIntervalMs <= 0 || metricsIntervalMs <= 0) {
                throw new IllegalArgumentException("Mesh tick intervals must be positive");
            }
            if (probeTimeoutMs <= 0) {
                throw new IllegalArgumentException("Probe timeout must be positive: " + probeTimeoutMs);
            }
            // throws on invalid breaker defaults
            circuitBreaker.toSettings();
        }
    }

    /**
     * Mesh-wide breaker defaults. {@link com.conduit.control.CircuitBreaker} reads the same keys.
     */
    @Data
    public static class CircuitBreakerDefaults {
        private int threshold = 5;
        private long openDurationMs = 60_000;
        private int halfOpenQuota = 3;

        CircuitBreakerSettings toSettings() {
            return CircuitBreakerSettings.of(threshold, Duration.ofMillis(openDurationMs), halfOpenQuota);
        }
    }

    @Data
    public static class EndpointDefinition {
        private String id;
        private String serviceName;
        private String host;
        private int port;
        private Protocol protocol = Protocol.HTTP;
        private int weight = 100;
        private List<String> tags = new ArrayList<>();
        private Map<String, String> metadata = new HashMap<>();

        ServiceEndpoint toEndpoint() {
            return ServiceEndpoint.builder()
                    .id(id)
                    .serviceName(serviceName)
                    .host(host)
                    .port(port)
                    .protocol(protocol)
                    .weight(weight)
                    .tags(List.copyOf(tags))
                    .metadata(Map.copyOf(metadata))
                    .build();
        }
    }
}
