package org.squadplanner.simulation.engine;

import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.Worker;

/**
 * Advances worker state across one event and the days that follow it.
 * Implementations are pure: identical inputs give identical outputs and the input is never modified.
 */
public interface StatePropagationEngine {

    /**
     * Applies one event outcome, then lets {@code elapsedDays} pass.
     *
     * @param worker      state before the event
     * @param participation whether and how the worker took part
     * @param elapsedDays days from this event to the next one, never negative
     * @return the new state
     */
    Worker propagate(Worker worker, Participation participation, int elapsedDays);

    /**
     * Lets days pass without play. Zero days returns the worker unchanged.
     */
    Worker rest(Worker worker, int days);

    /**
     * Load category implied by the worker's rolling window and appearance streak.
     */
    LoadCategory classifyLoad(Worker worker);

    /**
     * Rolling-window minutes above which a worker on a streak becomes jaded.
     */
    double jadednessThreshold(Worker worker);

    /**
     * Number of rest days needed to bring readiness up to {@code targetReadiness}.
     *
     * @throws org.squadplanner.simulation.model.ValidationException when the target is out of range
     *         or cannot be reached within the recovery bound
     */
    int daysToRecover(Worker worker, double targetReadiness);
}
