package com.questrail.peerlink.time;

/**
 * Exponential moving average with a running variance, smoothing factor
 * {@code 2 / (n + 1)}. The first sample initializes the average directly.
 *
 * <p>Not thread-safe.</p>
 */
public final class ExponentialMovingAverage {

    private final double alpha;
    private boolean initialized;
    private double value;
    private double variance;

    public ExponentialMovingAverage(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1");
        }
        this.alpha = 2.0 / (n + 1);
    }

    public void add(double sample) {
        if (!initialized) {
            value = sample;
            variance = 0;
            initialized = true;
            return;
        }
        double delta = sample - value;
        value += alpha * delta;
        variance = (1 - alpha) * (variance + alpha * delta * delta);
    }

    public double value() {
        return value;
    }

    public double variance() {
        return variance;
    }

    public double standardDeviation() {
        return Math.sqrt(variance);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void reset() {
        initialized = false;
        value = 0;
        variance = 0;
    }
}
