package org.squadplanner.simulation.model;

/**
 * Named bands of a familiarity score in [0, 1].
 */
public enum FamiliarityTier {
    NATURAL(0.90),
    ACCOMPLISHED(0.70),
    COMPETENT(0.50),
    UNCONVINCING(0.25),
    AWKWARD(0.0);

    private final double lowerBound;

    FamiliarityTier(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static FamiliarityTier of(double score) {
        ValidationException.requireInRange(score, 0.0, 1.0, "familiarity", "tier");
        for (FamiliarityTier tier : values()) {
            if (score >= tier.lowerBound) {
                return tier;
            }
        }
        return AWKWARD;
    }
}
