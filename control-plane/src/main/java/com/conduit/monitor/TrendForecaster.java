package com.conduit.monitor;

import com.conduit.config.MonitorConfig.MonitorProperties;
import com.conduit.monitor.model.ResourceForecast;
import com.conduit.monitor.model.ResourceMetrics;
import com.conduit.monitor.model.ThresholdConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Least-squares projection of CPU and memory percentages over the most recent samples.
 */
@Component
public class TrendForecaster {

    static final int MIN_SAMPLES = 10;
    static final int WINDOW = 20;
    static final String INSUFFICIENT_DATA = "Insufficient data for prediction";

    private final long samplingIntervalMs;
    private final ThresholdConfig thresholds;

    public TrendForecaster(MonitorProperties properties, ThresholdConfig thresholds) {
        this.samplingIntervalMs = properties.getIntervalMs();
        this.thresholds = thresholds;
    }

    public ResourceForecast forecast(List<ResourceMetrics> history, int horizonMinutes) {
        if (history.size() < MIN_SAMPLES) {
            return new ResourceForecast(ResourceForecast.Prediction.NONE, ResourceForecast.Prediction.NONE,
                    List.of(INSUFFICIENT_DATA));
        }

        List<ResourceMetrics> recent = history.subList(Math.max(0, history.size() - WINDOW), history.size());
        double[] cpu = recent.stream().mapToDouble(m -> m.getCpu().usage()).toArray();
        double[] memory = recent.stream().mapToDouble(m -> m.getMemory().percentage()).toArray();

        double steps = horizonMinutes * 60_000.0 / samplingIntervalMs;
        Trend cpuTrend = Trend.fit(cpu);
        Trend memoryTrend = Trend.fit(memory);
        double predictedCpu = clamp(cpuTrend.project(steps), 0, 100);
        double predictedMemory = clamp(memoryTrend.project(steps), 0, 100);

        List<String> alerts = new ArrayList<>(2);
        double cpuWarning = thresholds.cpu().warning();
        if (predictedCpu > cpuWarning) {
            alerts.add("CPU usage may exceed " + percent(cpuWarning) + "% in " + horizonMinutes + " minutes");
        }
        double memoryWarning = thresholds.memory().warning();
        if (predictedMemory > memoryWarning) {
            alerts.add("Memory usage may exceed " + percent(memoryWarning) + "% in " + horizonMinutes + " minutes");
        }

        return new ResourceForecast(
                new ResourceForecast.Prediction(predictedCpu, cpuTrend.confidence()),
                new ResourceForecast.Prediction(predictedMemory, memoryTrend.confidence()),
                List.copyOf(alerts));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String percent(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }

    /**
     * Fit of {@code y = intercept + slope * x} with x the sample index.
     *
     * @param last       fitted value at the newest sample
     * @param confidence R² clamped to [0, 1], 0 for a flat series
     */
    record Trend(double last, double slope, double confidence) {

        double project(double steps) {
            return last + slope * steps;
        }

        static Trend fit(double[] values) {
            int n = values.length;
            if (n < 2) {
                return new Trend(n == 1 ? values[0] : 0, 0, 0);
            }

            double meanX = (n - 1) / 2.0;
            double meanY = 0;
            for (double v : values) {
                meanY += v;
            }
            meanY /= n;

            double numerator = 0;
            double denominator = 0;
            for (int i = 0; i < n; i++) {
                numerator += (i - meanX) * (values[i] - meanY);
                denominator += (i - meanX) * (i - meanX);
            }

            double slope = denominator == 0 ? 0 : numerator / denominator;
            double intercept = meanY - slope * meanX;

            double totalSumSquares = 0;
            double residualSumSquares = 0;
            for (int i = 0; i < n; i++) {
                double fitted = intercept + slope * i;
                totalSumSquares += (values[i] - meanY) * (values[i] - meanY);
                residualSumSquares += (values[i] - fitted) * (values[i] - fitted);
            }

            double rSquared = totalSumSquares == 0 ? 0 : 1 - residualSumSquares / totalSumSquares;
            return new Trend(intercept + slope * (n - 1), slope, clamp(rSquared, 0, 1));
        }
    }
}
