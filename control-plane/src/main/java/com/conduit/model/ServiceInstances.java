package com.conduit.model;

import java.util.List;

public record ServiceInstances(String serviceName, List<ServiceEndpoint> endpoints) {
}
