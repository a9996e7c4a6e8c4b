package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.Importance;

import java.util.Objects;

/**
 * Immutable factors of one Global Selection Score:
 * GSS = baseRating x readiness x sharpness x familiarity x load.
 */
public final class ScoreBreakdown implements Comparable<ScoreBreakdown> {

    private final String workerId;
    private final String slotId;
    private final Importance importance;
    private final double baseRating;
    private final double readinessFactor;
    private final double sharpnessFactor;
    private final double familiarityFactor;
    private final double loadFactor;
    private final double gss;
    private final double developmentBonus;
    private final boolean belowReadinessFloor;

    private ScoreBreakdown(Builder builder) {
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId must not be null");
        this.slotId = Objects.requireNonNull(builder.slotId, "slotId must not be null");
        this.importance = Objects.requireNonNull(builder.importance, "importance must not be null");
        this.baseRating = builder.baseRating;
        this.readinessFactor = builder.readinessFactor;
        this.sharpnessFactor = builder.sharpnessFactor;
        this.familiarityFactor = builder.familiarityFactor;
        this.loadFactor = builder.loadFactor;
        this.gss = baseRating * readinessFactor * sharpnessFactor * familiarityFactor * loadFactor;
        this.developmentBonus = builder.developmentBonus;
        this.belowReadinessFloor = builder.belowReadinessFloor;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getSlotId() {
        return slotId;
    }

    public Importance getImportance() {
        return importance;
    }

    public double getBaseRating() {
        return baseRating;
    }

    public double getReadinessFactor() {
        return readinessFactor;
    }

    public double getSharpnessFactor() {
        return sharpnessFactor;
    }

    public double getFamiliarityFactor() {
        return familiarityFactor;
    }

    public double getLoadFactor() {
        return loadFactor;
    }

    public double getGss() {
        return gss;
    }

    /**
     * Extra utility for routing minutes to rusty workers in sharpness-building events. Not part of the GSS.
     */
    public double getDevelopmentBonus() {
        return developmentBonus;
    }

    public boolean isBelowReadinessFloor() {
        return belowReadinessFloor;
    }

    /**
     * Name of the multiplier holding this score down the most.
     */
    public String getLimitingFactor() {
        String name = "readiness";
        double min = readinessFactor;
        if (sharpnessFactor < min) {
            name = "sharpness";
            min = sharpnessFactor;
        }
        if (familiarityFactor < min) {
            name = "familiarity";
            min = familiarityFactor;
        }
        if (loadFactor < min) {
            name = "load";
        }
        return name;
    }

    @Override
    public int compareTo(ScoreBreakdown other) {
        // Higher GSS first
        return Double.compare(other.gss, this.gss);
    }

    @Override
    public String toString() {
        return String.format("GSS{%s@%s=%.1f base=%.1f R=%.3f S=%.3f F=%.3f L=%.2f}",
                workerId, slotId, gss, baseRating, readinessFactor, sharpnessFactor, familiarityFactor, loadFactor);
    }

    /**
     * Builder for ScoreBreakdown.
     */
    public static final class Builder {
        private String workerId;
        private String slotId;
        private Importance importance;
        private double baseRating;
        private double readinessFactor = 1.0;
        private double sharpnessFactor = 1.0;
        private double familiarityFactor = 1.0;
        private double loadFactor = 1.0;
        private double developmentBonus;
        private boolean belowReadinessFloor;

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder slotId(String slotId) {
            this.slotId = slotId;
            return this;
        }

        public Builder importance(Importance importance) {
            this.importance = importance;
            return this;
        }

        public Builder baseRating(double baseRating) {
            this.baseRating = baseRating;
            return this;
        }

        public Builder readinessFactor(double readinessFactor) {
            this.readinessFactor = readinessFactor;
            return this;
        }

        public Builder sharpnessFactor(double sharpnessFactor) {
            this.sharpnessFactor = sharpnessFactor;
            return this;
        }

        public Builder familiarityFactor(double familiarityFactor) {
            this.familiarityFactor = familiarityFactor;
            return this;
        }

        public Builder loadFactor(double loadFactor) {
            this.loadFactor = loadFactor;
            return this;
        }

        public Builder developmentBonus(double developmentBonus) {
            this.developmentBonus = developmentBonus;
            return this;
        }

        public Builder belowReadinessFloor(boolean belowReadinessFloor) {
            this.belowReadinessFloor = belowReadinessFloor;
            return this;
        }

        public ScoreBreakdown build() {
            return new ScoreBreakdown(this);
        }
    }
}
