package com.conduit.metrics;

import com.conduit.model.RequestOutcome;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Accretive request counters for one endpoint.
 * <p>
 * Latency figures are coarse: p50 is a 0.5-alpha blend seeded at zero, p95 and p99
 * are running maxima.
 */
public class EndpointMetrics {

    private static final double P50_ALPHA = 0.5;

    @Getter
    private final String endpointId;
    private final LongAdder total = new LongAdder();
    private final LongAdder success = new LongAdder();
    private final LongAdder error = new LongAdder();
    private final EWMACalculator p50 = new EWMACalculator(P50_ALPHA, 0.0);
    private final AtomicLong p95 = new AtomicLong();
    private final AtomicLong p99 = new AtomicLong();
    @Getter
    private volatile Instant lastUpdate;

    public EndpointMetrics(String endpointId) {
        this.endpointId = endpointId;
    }

    public void record(RequestOutcome outcome) {
        total.increment();
        if (outcome.isSuccess()) {
            success.increment();
        } else {
            error.increment();
        }

        long latency = outcome.getLatencyMs();
        p50.update(latency);
        p95.accumulateAndGet(latency, Math::max);
        p99.accumulateAndGet(latency, Math::max);

        lastUpdate = outcome.getTimestamp();
    }

    public long getTotalRequests() {
        return total.sum();
    }

    public double getErrorRate() {
        long requests = total.sum();
        if (requests == 0) {
            return 0.0;
        }
        return (error.sum() * 100.0) / requests;
    }

    public Snapshot snapshot() {
        return new Snapshot(endpointId, total.sum(), success.sum(), error.sum(),
                p50.getValue(), p95.get(), p99.get());
    }

    public record Snapshot(
            String endpointId,
            long totalRequests,
            long successfulRequests,
            long failedRequests,
            double p50LatencyMs,
            long p95LatencyMs,
            long p99LatencyMs
    ) {
    }
}
