package com.conduit.mesh;

import com.conduit.model.RouteRequest;
import com.conduit.model.TrafficPolicy;
import com.conduit.model.TrafficRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Holds one policy per service and evaluates it against requests. Only the first matching rule
 * applies. Delay and abort draw their own trials. A destination naming another service always
 * redirects; otherwise a declared mirror marks its target.
 */
@Slf4j
@Component
public class TrafficPolicyEngine {

    private final Map<String, TrafficPolicy> policies = new ConcurrentHashMap<>();

    public void setPolicy(TrafficPolicy policy) {
        if (policy.getServiceName() == null) {
            throw new IllegalArgumentException("Traffic policy requires a service name");
        }
        policies.put(policy.getServiceName(), policy);
    }

    public Optional<TrafficPolicy> getPolicy(String serviceName) {
        return Optional.ofNullable(policies.get(serviceName));
    }

    public PolicyDecision evaluate(String serviceName, RouteRequest request) {
        TrafficPolicy policy = policies.get(serviceName);
        if (policy == null) {
            return PolicyDecision.NONE;
        }

        for (TrafficRule rule : policy.getRules()) {
            if (matches(rule, request)) {
                return apply(policy, rule);
            }
        }
        return PolicyDecision.NONE;
    }

    private PolicyDecision apply(TrafficPolicy policy, TrafficRule rule) {
        long delayMs = 0;
        Integer abortStatus = null;

        TrafficRule.FaultInjection fault = rule.getFault();
        if (fault != null) {
            if (fault.delay() != null && trial(fault.delay().percentage())) {
                delayMs = fault.delay().fixedDelayMs();
            }
            if (fault.abort() != null && trial(fault.abort().percentage())) {
                abortStatus = fault.abort().httpStatus();
            }
        }

        String redirect = null;
        TrafficRule.Destination destination = rule.getDestination();
        if (destination != null
                && destination.service() != null
                && !destination.service().equals(policy.getServiceName())) {
            redirect = destination.service();
        }

        // destination weight and mirror percentage are carried for the caller, not sampled here
        String mirror = null;
        if (redirect == null && rule.getMirror() != null) {
            mirror = rule.getMirror().service();
        }

        log.debug("Traffic rule applied for {}: redirect={}, abort={}, delay={}ms, mirror={}",
                policy.getServiceName(), redirect, abortStatus, delayMs, mirror);
        return new PolicyDecision(redirect, abortStatus, delayMs, mirror);
    }

    static boolean matches(TrafficRule rule, RouteRequest request) {
        return containsAll(request.getHeaders(), rule.getMatchHeaders())
                && containsAll(request.getQueryParams(), rule.getMatchQueryParams());
    }

    private static boolean containsAll(Map<String, String> actual, Map<String, String> expected) {
        if (expected == null || expected.isEmpty()) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        for (Map.Entry<String, String> entry : expected.entrySet()) {
            if (!entry.getValue().equals(actual.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean trial(double percentage) {
        return ThreadLocalRandom.current().nextDouble() < percentage / 100.0;
    }
}
