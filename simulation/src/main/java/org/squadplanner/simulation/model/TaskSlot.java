package org.squadplanner.simulation.model;

import java.util.Objects;

/**
 * A named position in one event's lineup. The in-possession and out-of-possession tasks may differ
 * (a wing back attacking as a winger, for example).
 */
public final class TaskSlot {

    private final String id;
    private final String inPossessionTask;
    private final String outOfPossessionTask;
    private final boolean goalkeeper;

    public TaskSlot(String id, String inPossessionTask, String outOfPossessionTask, boolean goalkeeper) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.inPossessionTask = Objects.requireNonNull(inPossessionTask, "inPossessionTask must not be null");
        this.outOfPossessionTask = Objects.requireNonNull(outOfPossessionTask, "outOfPossessionTask must not be null");
        this.goalkeeper = goalkeeper;
    }

    public static TaskSlot of(String id, String task) {
        return new TaskSlot(id, task, task, false);
    }

    public static TaskSlot goalkeeper(String id, String task) {
        return new TaskSlot(id, task, task, true);
    }

    public String getId() {
        return id;
    }

    public String getInPossessionTask() {
        return inPossessionTask;
    }

    public String getOutOfPossessionTask() {
        return outOfPossessionTask;
    }

    public boolean isGoalkeeper() {
        return goalkeeper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskSlot)) {
            return false;
        }
        TaskSlot that = (TaskSlot) o;
        return goalkeeper == that.goalkeeper
                && id.equals(that.id)
                && inPossessionTask.equals(that.inPossessionTask)
                && outOfPossessionTask.equals(that.outOfPossessionTask);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, inPossessionTask, outOfPossessionTask, goalkeeper);
    }

    @Override
    public String toString() {
        return inPossessionTask.equals(outOfPossessionTask)
                ? id + "(" + inPossessionTask + ")"
                : id + "(" + inPossessionTask + "/" + outOfPossessionTask + ")";
    }
}
