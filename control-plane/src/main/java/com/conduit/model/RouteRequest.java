package com.conduit.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RouteRequest {

    String path;
    String method;
    @Builder.Default
    Map<String, String> headers = Map.of();
    @Builder.Default
    Map<String, String> queryParams = Map.of();

    public static RouteRequest of(String method, String path) {
        return RouteRequest.builder().method(method).path(path).build();
    }
}
