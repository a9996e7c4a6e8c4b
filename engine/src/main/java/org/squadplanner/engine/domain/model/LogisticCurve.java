package org.squadplanner.engine.domain.model;

/**
 * Logistic curve rescaled so that f(0) = floor and f(1) = 1.
 */
public final class LogisticCurve implements ResponseCurve {

    private final double midpoint;
    private final double steepness;
    private final double floor;
    private final double low;
    private final double high;

    public LogisticCurve(double midpoint, double steepness, double floor) {
        if (steepness <= 0) {
            throw new IllegalArgumentException("steepness must be positive: " + steepness);
        }
        if (floor < 0 || floor > 1) {
            throw new IllegalArgumentException("floor must be in [0, 1]: " + floor);
        }
        this.midpoint = midpoint;
        this.steepness = steepness;
        this.floor = floor;
        this.low = raw(0.0);
        this.high = raw(1.0);
    }

    private double raw(double x) {
        return 1.0 / (1.0 + Math.exp(-steepness * (x - midpoint)));
    }

    @Override
    public double apply(double x) {
        double clamped = Math.max(0.0, Math.min(1.0, x));
        double normalized = (raw(clamped) - low) / (high - low);
        return floor + (1.0 - floor) * Math.max(0.0, Math.min(1.0, normalized));
    }

    @Override
    public double floor() {
        return floor;
    }

    public double getMidpoint() {
        return midpoint;
    }

    public double getSteepness() {
        return steepness;
    }

    @Override
    public String toString() {
        return String.format("Logistic{T=%.2f, k=%.1f, floor=%.2f}", midpoint, steepness, floor);
    }
}
