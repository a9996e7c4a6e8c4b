package org.squadplanner.engine.domain.model;

import java.util.Arrays;

/**
 * Interpolates between breakpoints, constant beyond the first and last one.
 * Breakpoints must be strictly increasing in x and non-decreasing in y, with y in [0, 1].
 */
public final class PiecewiseLinearCurve implements ResponseCurve {

    private final double[] xs;
    private final double[] ys;

    public PiecewiseLinearCurve(double[] xs, double[] ys) {
        if (xs.length != ys.length || xs.length < 2) {
            throw new IllegalArgumentException("need at least two breakpoints with matching x and y");
        }
        for (int i = 0; i < xs.length; i++) {
            if (ys[i] < 0 || ys[i] > 1) {
                throw new IllegalArgumentException("y must be in [0, 1]: " + ys[i]);
            }
            if (i > 0 && (xs[i] <= xs[i - 1] || ys[i] < ys[i - 1])) {
                throw new IllegalArgumentException("breakpoints must be increasing at index " + i);
            }
        }
        this.xs = xs.clone();
        this.ys = ys.clone();
    }

    @Override
    public double apply(double x) {
        if (x <= xs[0]) {
            return ys[0];
        }
        int last = xs.length - 1;
        if (x >= xs[last]) {
            return ys[last];
        }
        int i = 1;
        while (xs[i] < x) {
            i++;
        }
        double t = (x - xs[i - 1]) / (xs[i] - xs[i - 1]);
        return ys[i - 1] + t * (ys[i] - ys[i - 1]);
    }

    @Override
    public double floor() {
        return ys[0];
    }

    @Override
    public String toString() {
        return "Piecewise{x=" + Arrays.toString(xs) + ", y=" + Arrays.toString(ys) + "}";
    }
}
