package com.conduit.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A request result reported back by the caller after forwarding to an endpoint.
 */
@Value
@Builder
public class RequestOutcome {

    String endpointId;
    Instant timestamp;
    long latencyMs;
    boolean success;
}
