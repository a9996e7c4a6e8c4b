package org.squadplanner.engine.io;

import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Formation;
import org.squadplanner.simulation.model.Worker;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Domain form of a batch planning request.
 */
public final class PlanningRequest {

    private final List<Worker> roster;
    private final List<Event> events;
    private final AssignmentHistory history;
    private final List<Formation> candidateFormations;

    public PlanningRequest(List<Worker> roster, List<Event> events, AssignmentHistory history,
                           List<Formation> candidateFormations) {
        this.roster = Collections.unmodifiableList(Objects.requireNonNull(roster, "roster must not be null"));
        this.events = Collections.unmodifiableList(Objects.requireNonNull(events, "events must not be null"));
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.candidateFormations = Collections.unmodifiableList(
                Objects.requireNonNull(candidateFormations, "candidateFormations must not be null"));
    }

    public List<Worker> getRoster() {
        return roster;
    }

    public List<Event> getEvents() {
        return events;
    }

    public AssignmentHistory getHistory() {
        return history;
    }

    public List<Formation> getCandidateFormations() {
        return candidateFormations;
    }

    public boolean hasCandidateFormations() {
        return !candidateFormations.isEmpty();
    }
}
