package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ScoreBreakdown;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.Worker;

/**
 * Service for calculating the Global Selection Score of a worker in a slot.
 * Scores are only comparable within one event.
 */
public interface ScoringService {

    /**
     * Calculate the score of a worker in a slot.
     * Higher GSS = better candidate.
     *
     * @param worker the worker state at the event
     * @param slot the slot to fill
     * @param importance importance of the event, selects the readiness and sharpness curves
     * @param config the planner configuration
     * @return the score and its factors
     */
    ScoreBreakdown score(Worker worker, TaskSlot slot, Importance importance, PlannerConfig config);

    /**
     * Harmonic mean of the in-possession and out-of-possession ratings, 0 if either is missing.
     */
    double baseRating(Worker worker, TaskSlot slot);

    /**
     * Shorthand for {@code score(...).getGss()}.
     */
    default double gss(Worker worker, TaskSlot slot, Importance importance, PlannerConfig config) {
        return score(worker, slot, importance, config).getGss();
    }
}
