package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.HorizonPlan;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Worker;

import java.util.List;

/**
 * Plans a whole horizon event by event, threading worker state forward.
 */
public interface HorizonPlanner {

    /**
     * @param roster workers in their state before the first event
     * @param events events in date order
     * @param history lineups before the horizon, {@link AssignmentHistory#empty()} if unknown
     * @param config the planner configuration
     * @return one assignment per event and the state trajectory
     */
    HorizonPlan plan(List<Worker> roster, List<Event> events, AssignmentHistory history, PlannerConfig config);
}
