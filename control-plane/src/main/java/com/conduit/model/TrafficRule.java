package com.conduit.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One ordered entry of a {@link TrafficPolicy}. Every declared header and query parameter must be
 * present on the request with an equal value for the rule to match.
 */
@Value
@Builder
public class TrafficRule {

    @Builder.Default
    Map<String, String> matchHeaders = Map.of();
    @Builder.Default
    Map<String, String> matchQueryParams = Map.of();
    Destination destination;
    FaultInjection fault;
    Mirror mirror;

    /**
     * @param weight percentage (0-100) of matched traffic sent to {@code service}; null means all
     */
    public record Destination(String service, String subset, Integer weight) {

        public static Destination to(String service) {
            return new Destination(service, null, null);
        }
    }

    public record FaultInjection(Delay delay, Abort abort) {
    }

    public record Delay(double percentage, long fixedDelayMs) {
    }

    public record Abort(double percentage, int httpStatus) {
    }

    public record Mirror(String service, double percentage) {
    }
}
