package org.squadplanner.engine.domain.model;

/**
 * Flat at {@code floor} below {@code lower}, 1 above {@code upper}, linear in between.
 */
public final class LinearCurve implements ResponseCurve {

    private final double lower;
    private final double upper;
    private final double floor;

    public LinearCurve(double lower, double upper, double floor) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("lower must be below upper: " + lower + " >= " + upper);
        }
        if (floor < 0 || floor > 1) {
            throw new IllegalArgumentException("floor must be in [0, 1]: " + floor);
        }
        this.lower = lower;
        this.upper = upper;
        this.floor = floor;
    }

    @Override
    public double apply(double x) {
        double t = (x - lower) / (upper - lower);
        return floor + (1.0 - floor) * Math.max(0.0, Math.min(1.0, t));
    }

    @Override
    public double floor() {
        return floor;
    }

    @Override
    public String toString() {
        return String.format("Linear{%.2f..%.2f, floor=%.2f}", lower, upper, floor);
    }
}
