package org.squadplanner.simulation.model;

/**
 * Importance level of a scheduled event. Consumed as an input; the core never classifies it.
 */
public enum Importance {
    HIGH(1.10, 1.30),
    MEDIUM(1.00, 1.00),
    LOW(0.90, 0.80),
    SHARPNESS(0.85, 0.80);

    private final double intensity;
    private final double competitiveness;

    Importance(double intensity, double competitiveness) {
        this.intensity = intensity;
        this.competitiveness = competitiveness;
    }

    /**
     * Physical intensity of a full appearance, scales readiness loss.
     */
    public double getIntensity() {
        return intensity;
    }

    /**
     * Scales sharpness gained per minute played: competitive events sharpen faster.
     */
    public double getCompetitiveness() {
        return competitiveness;
    }
}
