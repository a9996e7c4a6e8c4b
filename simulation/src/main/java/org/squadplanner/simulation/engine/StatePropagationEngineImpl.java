package org.squadplanner.simulation.engine;

import org.squadplanner.simulation.model.Appearance;
import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Deterministic state dynamics.
 *
 * Played:  readiness -= lossPer90 * min/90 * staminaFactor * intensity * taskFatigue
 *          sharpness += gainPer90 * min/90 * competitiveness
 * Rested:  readiness += days * dailyRecovery * fitnessFactor * ageFactor * trainingModifier
 *          sharpness -= days * dailySharpnessDecay
 * Both values are clamped to [0, 1] after every step.
 */
public final class StatePropagationEngineImpl implements StatePropagationEngine {

    private static final Logger LOG = Logger.getLogger(StatePropagationEngineImpl.class.getName());

    private final PropagationParameters params;

    public StatePropagationEngineImpl(PropagationParameters params) {
        this.params = Objects.requireNonNull(params, "params must not be null");
    }

    public StatePropagationEngineImpl() {
        this(PropagationParameters.defaults());
    }

    public PropagationParameters getParameters() {
        return params;
    }

    @Override
    public Worker propagate(Worker worker, Participation participation, int elapsedDays) {
        Objects.requireNonNull(worker, "worker must not be null");
        Objects.requireNonNull(participation, "participation must not be null");
        requireNonNegativeDays(elapsedDays, worker);

        if (!participation.isPlayed()) {
            return rest(worker, elapsedDays);
        }
        Worker afterEvent = play(worker, participation);
        Worker result = elapse(afterEvent, elapsedDays);
        LOG.fine(() -> String.format("%s %s: readiness %.3f -> %.3f, sharpness %.3f -> %.3f, load %s",
                worker.getId(), participation, worker.getReadiness(), result.getReadiness(),
                worker.getSharpness(), result.getSharpness(), result.getLoad()));
        return result;
    }

    @Override
    public Worker rest(Worker worker, int days) {
        Objects.requireNonNull(worker, "worker must not be null");
        requireNonNegativeDays(days, worker);
        if (days == 0) {
            return worker;
        }
        Worker reset = worker.toBuilder().consecutiveAppearances(0).build();
        return elapse(reset, days);
    }

    @Override
    public LoadCategory classifyLoad(Worker worker) {
        if (worker.getLoad() == LoadCategory.JADED
                && worker.getDaysSinceLastAppearance() < params.getJadednessClearDays()) {
            return LoadCategory.JADED;
        }
        double ratio = worker.getWindowMinutes() / jadednessThreshold(worker);
        if (ratio > 1.0 && worker.getConsecutiveAppearances() >= params.getJadednessConsecutiveAppearances()) {
            return LoadCategory.JADED;
        }
        if (ratio <= params.getFreshRatio()) {
            return LoadCategory.FRESH;
        }
        if (ratio <= params.getFitRatio()) {
            return LoadCategory.FIT;
        }
        return LoadCategory.TIRED;
    }

    @Override
    public double jadednessThreshold(Worker worker) {
        double ageFactor;
        if (worker.getAge() >= 32) {
            ageFactor = 0.8;
        } else if (worker.getAge() >= 30 || worker.getAge() < 19) {
            ageFactor = 0.9;
        } else {
            ageFactor = 1.0;
        }
        double fitnessFactor = 1.0 + (worker.getNaturalFitness() - 10) * 0.03;
        return params.getJadednessThresholdMinutes() * ageFactor * fitnessFactor;
    }

    @Override
    public int daysToRecover(Worker worker, double targetReadiness) {
        Objects.requireNonNull(worker, "worker must not be null");
        ValidationException.requireInRange(targetReadiness, 0.0, 1.0, "targetReadiness", worker.getId());
        if (worker.getReadiness() >= targetReadiness) {
            return 0;
        }
        if (dailyRecovery(worker) <= 0) {
            throw new ValidationException("worker " + worker.getId() + " does not recover readiness", worker.getId());
        }
        for (int days = 1; days <= params.getMaxRecoveryDays(); days++) {
            if (rest(worker, days).getReadiness() >= targetReadiness) {
                return days;
            }
        }
        throw new ValidationException(String.format("worker %s cannot reach readiness %.3f within %d days",
                worker.getId(), targetReadiness, params.getMaxRecoveryDays()), worker.getId());
    }

    private Worker play(Worker worker, Participation participation) {
        int minutes = participation.getMinutes();
        if (minutes == 0) {
            return worker;
        }
        double share = minutes / 90.0;
        double staminaFactor = 1.0 + (10 - worker.getStamina()) * 0.05;
        double loss = params.getReadinessLossPer90() * share * staminaFactor
                * participation.getImportance().getIntensity()
                * params.getTaskFatigueMultiplier(participation.getTask());
        double gain = params.getSharpnessGainPer90() * share * participation.getImportance().getCompetitiveness();

        List<Appearance> appearances = new ArrayList<>(worker.getAppearances().size() + 1);
        appearances.add(new Appearance(0, minutes));
        appearances.addAll(worker.getAppearances());

        Worker played = worker.toBuilder()
                .readiness(clamp(worker.getReadiness() - loss))
                .sharpness(clamp(worker.getSharpness() + gain))
                .appearances(appearances)
                .consecutiveAppearances(worker.getConsecutiveAppearances() + 1)
                .daysSinceLastAppearance(0)
                .build();
        return played.toBuilder().load(classifyLoad(played)).build();
    }

    /**
     * Passes days without touching the appearance streak.
     */
    private Worker elapse(Worker worker, int days) {
        if (days == 0) {
            return worker;
        }
        List<Appearance> kept = new ArrayList<>();
        for (Appearance appearance : worker.getAppearances()) {
            Appearance aged = appearance.aged(days);
            if (aged.getDaysAgo() < params.getWindowDays()) {
                kept.add(aged);
            }
        }
        Worker elapsed = worker.toBuilder()
                .readiness(clamp(worker.getReadiness() + days * dailyRecovery(worker)))
                .sharpness(clamp(worker.getSharpness() - days * params.getDailySharpnessDecay()))
                .appearances(kept)
                .daysSinceLastAppearance(worker.getDaysSinceLastAppearance() + days)
                .build();
        return elapsed.toBuilder().load(classifyLoad(elapsed)).build();
    }

    private double dailyRecovery(Worker worker) {
        double fitnessFactor = 0.8 + worker.getNaturalFitness() / 20.0 * 0.4;
        double ageFactor;
        if (worker.getAge() >= 32) {
            ageFactor = 0.85;
        } else if (worker.getAge() >= 30) {
            ageFactor = 0.92;
        } else {
            ageFactor = 1.0;
        }
        return params.getDailyRecovery() * fitnessFactor * ageFactor
                * worker.getTrainingIntensity().getRecoveryModifier();
    }

    private static void requireNonNegativeDays(int days, Worker worker) {
        if (days < 0) {
            throw new ValidationException("elapsed days must not be negative but was " + days, worker.getId());
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
