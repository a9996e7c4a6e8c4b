package org.squadplanner.engine.domain.error;

import org.squadplanner.simulation.model.PlanningException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when no lineup can fill every slot without breaking a hard constraint.
 * Names the slot and why each candidate was excluded, so the caller can relax something.
 */
public final class InfeasibleAssignmentException extends PlanningException {

    private static final long serialVersionUID = 1L;

    private final String eventId;
    private final String slotId;
    private final Map<String, String> reasons;

    public InfeasibleAssignmentException(String eventId, String slotId, String message, Map<String, String> reasons) {
        super("event " + eventId + ", slot " + slotId + ": " + message);
        this.eventId = eventId;
        this.slotId = slotId;
        this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public String getEventId() {
        return eventId;
    }

    public String getSlotId() {
        return slotId;
    }

    /**
     * Worker id to exclusion reason.
     */
    public Map<String, String> getReasons() {
        return reasons;
    }
}
