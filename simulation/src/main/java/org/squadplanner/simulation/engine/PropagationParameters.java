package org.squadplanner.simulation.engine;

import org.squadplanner.simulation.model.ValidationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable constants of the worker state dynamics.
 * Rates are fractions of the [0, 1] readiness and sharpness scales.
 */
public final class PropagationParameters {

    private final double readinessLossPer90;
    private final double dailyRecovery;
    private final double sharpnessGainPer90;
    private final double dailySharpnessDecay;
    private final int windowDays;
    private final double jadednessThresholdMinutes;
    private final int jadednessConsecutiveAppearances;
    private final int jadednessClearDays;
    private final double freshRatio;
    private final double fitRatio;
    private final int maxRecoveryDays;
    private final Map<String, Double> taskFatigueMultipliers;

    private PropagationParameters(Builder builder) {
        this.readinessLossPer90 = ValidationException.requireNonNegative(
                builder.readinessLossPer90, "readinessLossPer90", "propagation");
        this.dailyRecovery = ValidationException.requireNonNegative(
                builder.dailyRecovery, "dailyRecovery", "propagation");
        this.sharpnessGainPer90 = ValidationException.requireNonNegative(
                builder.sharpnessGainPer90, "sharpnessGainPer90", "propagation");
        this.dailySharpnessDecay = ValidationException.requireNonNegative(
                builder.dailySharpnessDecay, "dailySharpnessDecay", "propagation");
        this.jadednessThresholdMinutes = builder.jadednessThresholdMinutes;
        this.windowDays = builder.windowDays;
        this.jadednessConsecutiveAppearances = builder.jadednessConsecutiveAppearances;
        this.jadednessClearDays = builder.jadednessClearDays;
        this.freshRatio = builder.freshRatio;
        this.fitRatio = builder.fitRatio;
        this.maxRecoveryDays = builder.maxRecoveryDays;
        this.taskFatigueMultipliers = Collections.unmodifiableMap(new HashMap<>(builder.taskFatigueMultipliers));
        if (windowDays <= 0 || maxRecoveryDays <= 0 || jadednessConsecutiveAppearances <= 0) {
            throw new ValidationException("window, recovery bound and jadedness streak must be positive", "propagation");
        }
        if (jadednessThresholdMinutes <= 0) {
            throw new ValidationException("jadedness threshold must be positive", "propagation");
        }
        if (!(freshRatio > 0 && freshRatio < fitRatio)) {
            throw new ValidationException("load ratios must satisfy 0 < fresh < fit", "propagation");
        }
        taskFatigueMultipliers.forEach((task, m) ->
                ValidationException.requireNonNegative(m, "taskFatigueMultiplier[" + task + "]", "propagation"));
    }

    public static PropagationParameters defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getReadinessLossPer90() {
        return readinessLossPer90;
    }

    public double getDailyRecovery() {
        return dailyRecovery;
    }

    public double getSharpnessGainPer90() {
        return sharpnessGainPer90;
    }

    public double getDailySharpnessDecay() {
        return dailySharpnessDecay;
    }

    /**
     * Length of the rolling minutes window, in days.
     */
    public int getWindowDays() {
        return windowDays;
    }

    public double getJadednessThresholdMinutes() {
        return jadednessThresholdMinutes;
    }

    public int getJadednessConsecutiveAppearances() {
        return jadednessConsecutiveAppearances;
    }

    public int getJadednessClearDays() {
        return jadednessClearDays;
    }

    public double getFreshRatio() {
        return freshRatio;
    }

    public double getFitRatio() {
        return fitRatio;
    }

    public int getMaxRecoveryDays() {
        return maxRecoveryDays;
    }

    public double getTaskFatigueMultiplier(String task) {
        return task == null ? 1.0 : taskFatigueMultipliers.getOrDefault(task, 1.0);
    }

    public Map<String, Double> getTaskFatigueMultipliers() {
        return taskFatigueMultipliers;
    }

    /**
     * Builder for PropagationParameters, preloaded with the default dynamics.
     */
    public static final class Builder {
        // A fresh worker with average stamina ends a full medium event at about 0.72
        private double readinessLossPer90 = 0.28;
        private double dailyRecovery = 0.05;
        private double sharpnessGainPer90 = 0.08;
        private double dailySharpnessDecay = 0.008;
        private int windowDays = 14;
        private double jadednessThresholdMinutes = 450;
        private int jadednessConsecutiveAppearances = 3;
        private int jadednessClearDays = 7;
        private double freshRatio = 0.4;
        private double fitRatio = 0.7;
        private int maxRecoveryDays = 90;
        private final Map<String, Double> taskFatigueMultipliers = new HashMap<>();

        private Builder() {
            taskFatigueMultipliers.put("GK", 0.8);
            taskFatigueMultipliers.put("D(C)", 0.8);
            taskFatigueMultipliers.put("D(L)", 1.2);
            taskFatigueMultipliers.put("D(R)", 1.2);
            taskFatigueMultipliers.put("WB(L)", 1.2);
            taskFatigueMultipliers.put("WB(R)", 1.2);
            taskFatigueMultipliers.put("DM", 1.2);
        }

        public Builder readinessLossPer90(double readinessLossPer90) {
            this.readinessLossPer90 = readinessLossPer90;
            return this;
        }

        public Builder dailyRecovery(double dailyRecovery) {
            this.dailyRecovery = dailyRecovery;
            return this;
        }

        public Builder sharpnessGainPer90(double sharpnessGainPer90) {
            this.sharpnessGainPer90 = sharpnessGainPer90;
            return this;
        }

        public Builder dailySharpnessDecay(double dailySharpnessDecay) {
            this.dailySharpnessDecay = dailySharpnessDecay;
            return this;
        }

        public Builder windowDays(int windowDays) {
            this.windowDays = windowDays;
            return this;
        }

        public Builder jadednessThresholdMinutes(double jadednessThresholdMinutes) {
            this.jadednessThresholdMinutes = jadednessThresholdMinutes;
            return this;
        }

        public Builder jadednessConsecutiveAppearances(int jadednessConsecutiveAppearances) {
            this.jadednessConsecutiveAppearances = jadednessConsecutiveAppearances;
            return this;
        }

        public Builder jadednessClearDays(int jadednessClearDays) {
            this.jadednessClearDays = jadednessClearDays;
            return this;
        }

        public Builder loadRatios(double freshRatio, double fitRatio) {
            this.freshRatio = freshRatio;
            this.fitRatio = fitRatio;
            return this;
        }

        public Builder maxRecoveryDays(int maxRecoveryDays) {
            this.maxRecoveryDays = maxRecoveryDays;
            return this;
        }

        public Builder taskFatigueMultiplier(String task, double multiplier) {
            taskFatigueMultipliers.put(Objects.requireNonNull(task, "task must not be null"), multiplier);
            return this;
        }

        public PropagationParameters build() {
            return new PropagationParameters(this);
        }
    }
}
