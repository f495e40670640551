package com.conduit.monitor.model;

import java.util.List;

/**
 * Projected CPU and memory percentages. {@code alerts} holds human-readable warnings.
 */
public record ResourceForecast(
        Prediction cpu,
        Prediction memory,
        List<String> alerts
) {

    /**
     * @param predicted  projected percentage in [0, 100]
     * @param confidence R² of the fit in [0, 1]
     */
    public record Prediction(double predicted, double confidence) {

        public static final Prediction NONE = new Prediction(0, 0);
    }
}
