package org.squadplanner.engine.domain.model;

/**
 * Bounded non-decreasing map from a state fraction in [0, 1] to a multiplier in [floor, 1].
 */
public interface ResponseCurve {

    double apply(double x);

    double floor();
}
