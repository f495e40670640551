package com.conduit.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TrafficPolicy {

    String serviceName;
    @Singular
    List<TrafficRule> rules;
}
