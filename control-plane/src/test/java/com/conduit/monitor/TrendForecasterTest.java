package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.monitor.model.ResourceForecast;
import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.monitor.model.ThresholdConfig;
import com.conduit.support.Samples;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

class TrendForecasterTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private final TrendForecaster forecaster = new TrendForecaster(new MonitorProperties(), ThresholdConfig.defaults());

    private static List<ResourceMetrics> series(int count, IntToDoubleFunction cpu, IntToDoubleFunction memory) {
        List<ResourceMetrics> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(Samples.sample("c-1", START.plusSeconds(5L * i), cpu.applyAsDouble(i), memory.applyAsDouble(i)));
        }
        return samples;
    }

    @Test
    @DisplayName("fewer than ten samples gives no prediction")
    void insufficientData() {
        ResourceForecast forecast = forecaster.forecast(series(9, i -> 50, i -> 50), 30);

        assertEquals(0, forecast.cpu().predicted());
        assertEquals(0, forecast.cpu().confidence());
        assertEquals(0, forecast.memory().predicted());
        assertEquals(0, forecast.memory().confidence());
        assertEquals(List.of("Insufficient data for prediction"), forecast.alerts());
    }

    @Test
    @DisplayName("projects a linear trend from the last sample")
    void linearProjection() {
        // one minute ahead at 5s sampling is 12 steps
        ResourceForecast forecast = forecaster.forecast(series(10, i -> 10 + 2 * i, i -> 50), 1);

        assertEquals(52.0, forecast.cpu().predicted(), 1e-9);
        assertEquals(1.0, forecast.cpu().confidence(), 1e-9);
        assertEquals(50.0, forecast.memory().predicted(), 1e-9);
        assertEquals(0.0, forecast.memory().confidence());
        assertTrue(forecast.alerts().isEmpty());
    }

    @Test
    @DisplayName("only the newest twenty samples are fitted")
    void usesRecentWindow() {
        ResourceForecast forecast = forecaster.forecast(series(25, i -> i < 5 ? 100 : i, i -> 10), 1);

        assertEquals(36.0, forecast.cpu().predicted(), 1e-9);
        assertEquals(1.0, forecast.cpu().confidence(), 1e-9);
    }

    @Test
    @DisplayName("predictions are clamped and raise warnings above the warning thresholds")
    void clampedWithAlerts() {
        ResourceForecast forecast = forecaster.forecast(series(10, i -> 40 + i, i -> 60 + i), 30);

        assertEquals(100.0, forecast.cpu().predicted());
        assertEquals(100.0, forecast.memory().predicted());
        assertEquals(List.of(
                "CPU usage may exceed 70% in 30 minutes",
                "Memory usage may exceed 80% in 30 minutes"), forecast.alerts());
    }

    @Test
    @DisplayName("falling usage is clamped at zero")
    void clampedAtZero() {
        ResourceForecast forecast = forecaster.forecast(series(10, i -> 20 - i, i -> 20 - i), 30);

        assertEquals(0.0, forecast.cpu().predicted());
        assertEquals(0.0, forecast.memory().predicted());
        assertTrue(forecast.alerts().isEmpty());
    }
}
