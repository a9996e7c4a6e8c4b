package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.TaskSlot;

import java.util.Objects;

/**
 * One filled slot of a lineup with the values that chose it.
 */
public final class SlotAssignment {

    private final TaskSlot slot;
    private final String workerId;
    private final ScoreBreakdown score;
    private final CellCost cost;

    public SlotAssignment(TaskSlot slot, String workerId, ScoreBreakdown score, CellCost cost) {
        this.slot = Objects.requireNonNull(slot, "slot must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.score = Objects.requireNonNull(score, "score must not be null");
        this.cost = Objects.requireNonNull(cost, "cost must not be null");
    }

    public TaskSlot getSlot() {
        return slot;
    }

    public String getWorkerId() {
        return workerId;
    }

    public ScoreBreakdown getScore() {
        return score;
    }

    public CellCost getCost() {
        return cost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotAssignment)) {
            return false;
        }
        SlotAssignment that = (SlotAssignment) o;
        return slot.equals(that.slot) && workerId.equals(that.workerId)
                && Double.compare(cost.getTotal(), that.cost.getTotal()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(slot, workerId, cost.getTotal());
    }

    @Override
    public String toString() {
        return slot.getId() + "=" + workerId;
    }
}
