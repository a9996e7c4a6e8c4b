package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.Assignment;
import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ShadowPrice;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Worker;

import java.util.List;
import java.util.Map;

/**
 * Service for choosing one event's lineup.
 */
public interface AssignmentService {

    /**
     * Assign workers to the slots of an event.
     *
     * @param event the event to fill
     * @param roster every worker, in their state at the event
     * @param shadowPrices opportunity cost per worker id at this event
     * @param history slots held at earlier events, for stability costs
     * @param config the planner configuration
     * @return the lineup; every slot filled exactly once
     * @throws org.squadplanner.simulation.model.ValidationException on malformed input
     * @throws org.squadplanner.engine.domain.error.ConstraintConflictException on contradictory constraints
     * @throws org.squadplanner.engine.domain.error.InfeasibleAssignmentException when no valid lineup exists
     */
    Assignment assign(Event event, List<Worker> roster, Map<String, ShadowPrice> shadowPrices,
                      AssignmentHistory history, PlannerConfig config);
}
