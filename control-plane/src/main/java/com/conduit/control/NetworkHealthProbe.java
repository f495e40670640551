package com.conduit.control;

import com.conduit.model.EndpointHealth;
import com.conduit.model.Protocol;
import com.conduit.model.ServiceEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Default probe: HTTP(S) GET against the endpoint's health path, a plain TCP connect for
 * {@code tcp} endpoints. UDP has no handshake to test, so those report {@code UNKNOWN}.
 */
@Slf4j
public class NetworkHealthProbe implements HealthProbe {

    public static final String HEALTH_PATH_METADATA = "healthPath";
    private static final String DEFAULT_HEALTH_PATH = "/health";

    private final HttpClient httpClient;
    private final Duration timeout;

    public NetworkHealthProbe(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        log.info("NetworkHealthProbe initialized with {}ms timeout", timeout.toMillis());
    }

    @Override
    public EndpointHealth check(ServiceEndpoint endpoint) {
        Protocol protocol = endpoint.getProtocol();
        return switch (protocol) {
            case HTTP, HTTPS -> checkHttp(endpoint);
            case TCP -> checkTcp(endpoint);
            case UDP -> EndpointHealth.UNKNOWN;
        };
    }

    private EndpointHealth checkHttp(ServiceEndpoint endpoint) {
        String path = endpoint.getMetadata().getOrDefault(HEALTH_PATH_METADATA, DEFAULT_HEALTH_PATH);
        String scheme = endpoint.getProtocol() == Protocol.HTTPS ? "https" : "http";
        URI uri = URI.create(scheme + "://" + endpoint.getAddress() + path);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            return status >= 200 && status < 400 ? EndpointHealth.HEALTHY : EndpointHealth.UNHEALTHY;
        } catch (HttpTimeoutException e) {
            log.debug("Health probe to {} timed out after {}ms", uri, timeout.toMillis());
            return EndpointHealth.UNHEALTHY;
        } catch (IOException e) {
            log.debug("Health probe to {} failed: {}", uri, e.getMessage());
            return EndpointHealth.UNHEALTHY;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EndpointHealth.UNHEALTHY;
        }
    }

    private EndpointHealth checkTcp(ServiceEndpoint endpoint) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(endpoint.getHost(), endpoint.getPort()), (int) timeout.toMillis());
            return EndpointHealth.HEALTHY;
        } catch (IOException e) {
            log.debug("TCP probe to {} failed: {}", endpoint.getAddress(), e.getMessage());
            return EndpointHealth.UNHEALTHY;
        }
    }
}
