package org.squadplanner.simulation.model;

import java.util.Objects;

/**
 * A (worker, slot) pair named by a lock or a rejection.
 */
public final class Pin {

    private final String workerId;
    private final String slotId;

    public Pin(String workerId, String slotId) {
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.slotId = Objects.requireNonNull(slotId, "slotId must not be null");
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getSlotId() {
        return slotId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pin)) {
            return false;
        }
        Pin that = (Pin) o;
        return workerId.equals(that.workerId) && slotId.equals(that.slotId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, slotId);
    }

    @Override
    public String toString() {
        return workerId + "->" + slotId;
    }
}
