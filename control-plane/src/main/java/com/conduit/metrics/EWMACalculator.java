package com.conduit.metrics;

/**
 * Exponentially weighted blend starting from a fixed seed. With alpha 0.5 each update moves the
 * value halfway towards the new observation.
 */
public class EWMACalculator {

    private final double alpha;
    private volatile double currentValue;

    public EWMACalculator(double alpha, double seed) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("EWMA alpha must be in (0, 1], got " + alpha);
        }
        this.alpha = alpha;
        this.currentValue = seed;
    }

    public synchronized double update(double newValue) {
        currentValue = (alpha * newValue) + ((1 - alpha) * currentValue);
        return currentValue;
    }

    public double getValue() {
        return currentValue;
    }
}
