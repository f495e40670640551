package com.conduit.config;

import com.conduit.monitor.model.ThresholdConfig;
import com.conduit.runtime.ContainerRuntime;
import com.conduit.runtime.DockerContainerRuntime;
import com.conduit.runtime.UnavailableContainerRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class MonitorConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConfigurationProperties(prefix = "conduit.monitor")
    public MonitorProperties monitorProperties() {
        return new MonitorProperties();
    }

    @Bean
    public ThresholdConfig thresholdConfig(MonitorProperties properties) {
        properties.validate();
        return properties.getThresholds().toThresholdConfig();
    }

    @Bean
    @ConditionalOnProperty(name = "conduit.monitor.runtime", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient(MonitorProperties properties) {
        String dockerHost = properties.getDockerHost() != null
                ? properties.getDockerHost()
                : System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(5))
                .responseTimeout(Duration.ofSeconds(10))
                .build();

        log.info("Docker client configured for {}", dockerHost);
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "conduit.monitor.runtime", havingValue = "docker", matchIfMissing = true)
    public ContainerRuntime dockerContainerRuntime(DockerClient dockerClient, ObjectMapper objectMapper) {
        return new DockerContainerRuntime(dockerClient, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "conduit.monitor.runtime", havingValue = "none")
    public ContainerRuntime unavailableContainerRuntime() {
        log.warn("No container runtime configured, resource sampling is disabled");
        return new UnavailableContainerRuntime();
    }

    @Data
    public static class MonitorProperties {
        private long intervalMs = 5_000;
        private int historyCapacity = 720;
        private long metricsRetentionMs = 3_600_000;
        private long alertRetentionMs = 3_600_000;
        private long alertCooldownMs = 300_000;
        private long sweepIntervalMs = 300_000;
        private String runtime = "docker";
        private String dockerHost;
        private Thresholds thresholds = new Thresholds();

        public void validate() {
            if (intervalMs <= 0 || sweepIntervalMs <= 0) {
                throw new IllegalArgumentException("Monitor intervals must be positive");
            }
            if (historyCapacity <= 0) {
                throw new IllegalArgumentException("History capacity must be positive: " + historyCapacity);
            }
            if (metricsRetentionMs <= 0 || alertRetentionMs <= 0 || alertCooldownMs < 0) {
                throw new IllegalArgumentException("Retention and cooldown must not be negative");
            }
        }
    }

    @Data
    public static class Thresholds {
        private Level cpu = new Level(70, 90);
        private Level memory = new Level(80, 95);
        private Level network = new Level(100 * 1024 * 1024, 200 * 1024 * 1024);
        private Level disk = new Level(50 * 1024 * 1024, 100 * 1024 * 1024);
        private Level processes = new Level(100, 200);

        public ThresholdConfig toThresholdConfig() {
            return new ThresholdConfig(cpu.toLevel(), memory.toLevel(), network.toLevel(),
                    disk.toLevel(), processes.toLevel());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {
        private double warning;
        private double critical;

        ThresholdConfig.Level toLevel() {
            return new ThresholdConfig.Level(warning, critical);
        }
    }
}
