package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ScoreBreakdown;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using multiplicative scoring.
 *
 * Score formula (higher = better):
 *   GSS = base_rating
 *       x readiness_curve[importance](readiness)
 *       x sharpness_curve[importance](sharpness)
 *       x (familiarity_floor + (1 - familiarity_floor) x combined_familiarity)
 *       x load_multiplier[load]
 *
 *   combined_familiarity = mean(ip, oop) - gap_penalty x |ip - oop|
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    @Override
    public ScoreBreakdown score(Worker worker, TaskSlot slot, Importance importance, PlannerConfig config) {
        Objects.requireNonNull(worker, "worker must not be null");
        Objects.requireNonNull(slot, "slot must not be null");
        Objects.requireNonNull(importance, "importance must not be null");
        Objects.requireNonNull(config, "config must not be null");
        validateState(worker);

        double base = baseRating(worker, slot);
        double readiness = config.getReadinessCurve(importance).apply(worker.getReadiness());
        double sharpness = config.getSharpnessCurve(importance).apply(worker.getSharpness());
        double familiarity = calculateFamiliarityFactor(worker, slot, config);
        double load = config.getLoadMultiplier(worker.getLoad());

        ScoreBreakdown breakdown = new ScoreBreakdown.Builder()
                .workerId(worker.getId())
                .slotId(slot.getId())
                .importance(importance)
                .baseRating(base)
                .readinessFactor(readiness)
                .sharpnessFactor(sharpness)
                .familiarityFactor(familiarity)
                .loadFactor(load)
                .developmentBonus(calculateDevelopmentBonus(worker, base, importance, config))
                .belowReadinessFloor(worker.getReadiness() < config.getReadinessFloor())
                .build();

        LOG.finest(() -> "Scored " + breakdown);
        return breakdown;
    }

    @Override
    public double baseRating(Worker worker, TaskSlot slot) {
        double inPossession = worker.getRating(slot.getInPossessionTask());
        double outOfPossession = worker.getRating(slot.getOutOfPossessionTask());
        if (inPossession <= 0 || outOfPossession <= 0) {
            return 0.0;
        }
        return 2 * inPossession * outOfPossession / (inPossession + outOfPossession);
    }

    /**
     * Penalized combination of the two phase familiarities.
     * Never rewards a worker for being strong in only one phase.
     */
    private double calculateFamiliarityFactor(Worker worker, TaskSlot slot, PlannerConfig config) {
        double ip = worker.getInPossessionFamiliarity(slot.getInPossessionTask());
        double oop = worker.getOutOfPossessionFamiliarity(slot.getOutOfPossessionTask());
        double combined = (ip + oop) / 2 - config.getFamiliarityGapPenalty() * Math.abs(ip - oop);
        combined = Math.max(0.0, Math.min(1.0, combined));
        double floor = config.getFamiliarityFloor();
        return floor + (1 - floor) * combined;
    }

    /**
     * Sharpness-building events favour rusty workers. Kept out of the GSS so the score stays
     * monotone in sharpness.
     */
    private double calculateDevelopmentBonus(Worker worker, double base, Importance importance, PlannerConfig config) {
        if (importance != Importance.SHARPNESS) {
            return 0.0;
        }
        return config.getSharpnessBoost() * base * (1 - worker.getSharpness());
    }

    private static void validateState(Worker worker) {
        ValidationException.requireInRange(worker.getReadiness(), 0.0, 1.0, "readiness", worker.getId());
        ValidationException.requireInRange(worker.getSharpness(), 0.0, 1.0, "sharpness", worker.getId());
    }
}
