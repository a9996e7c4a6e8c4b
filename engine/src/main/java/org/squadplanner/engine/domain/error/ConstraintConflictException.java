package org.squadplanner.engine.domain.error;

import org.squadplanner.simulation.model.PlanningException;

import java.util.Collections;
import java.util.List;

/**
 * Raised when the hard constraints of one event contradict each other.
 * Detected before any cost matrix is built.
 */
public final class ConstraintConflictException extends PlanningException {

    private static final long serialVersionUID = 1L;

    private final String eventId;
    private final List<String> conflicts;

    public ConstraintConflictException(String eventId, List<String> conflicts) {
        super("conflicting constraints for event " + eventId + ": " + conflicts);
        this.eventId = eventId;
        this.conflicts = Collections.unmodifiableList(conflicts);
    }

    public String getEventId() {
        return eventId;
    }

    /**
     * One human-readable description per conflicting pair of constraints.
     */
    public List<String> getConflicts() {
        return conflicts;
    }
}
