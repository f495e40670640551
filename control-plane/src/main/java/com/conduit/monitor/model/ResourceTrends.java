package com.conduit.monitor.model;

import java.time.Instant;
import java.util.List;

public record ResourceTrends(
        List<Point> cpu,
        List<Point> memory,
        List<NetworkPoint> network
) {

    public record Point(Instant timestamp, double value) {
    }

    public record NetworkPoint(Instant timestamp, long rx, long tx) {
    }
}
