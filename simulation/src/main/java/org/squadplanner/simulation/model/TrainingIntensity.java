package org.squadplanner.simulation.model;

/**
 * Between-event training load. Lighter training speeds readiness recovery.
 */
public enum TrainingIntensity {
    LOW(1.2),
    MEDIUM(1.0),
    HIGH(0.8);

    private final double recoveryModifier;

    TrainingIntensity(double recoveryModifier) {
        this.recoveryModifier = recoveryModifier;
    }

    public double getRecoveryModifier() {
        return recoveryModifier;
    }
}
