package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lineups for every event of a horizon plus the worker state trajectory.
 * {@code getStatesBefore(k)} is the state the planner used for event k; the last entry is the state
 * after the horizon.
 */
public final class HorizonPlan {

    private final EventSchedule schedule;
    private final List<Assignment> assignments;
    private final List<Map<String, Worker>> trajectory;

    public HorizonPlan(EventSchedule schedule, List<Assignment> assignments, List<Map<String, Worker>> trajectory) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
        List<Map<String, Worker>> copy = new ArrayList<>();
        for (Map<String, Worker> states : trajectory) {
            copy.add(Collections.unmodifiableMap(states));
        }
        this.trajectory = Collections.unmodifiableList(copy);
        if (this.trajectory.size() != this.assignments.size() + 1) {
            throw new IllegalArgumentException("trajectory must hold one state per event plus the final state");
        }
    }

    public EventSchedule getSchedule() {
        return schedule;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public Assignment getAssignment(int eventIndex) {
        return assignments.get(eventIndex);
    }

    public List<Map<String, Worker>> getTrajectory() {
        return trajectory;
    }

    public Map<String, Worker> getStatesBefore(int eventIndex) {
        return trajectory.get(eventIndex);
    }

    public Map<String, Worker> getFinalStates() {
        return trajectory.get(trajectory.size() - 1);
    }

    public double getTotalGss() {
        double total = 0;
        for (Assignment assignment : assignments) {
            total += assignment.getTotalGss();
        }
        return total;
    }

    public int countStarts(String workerId) {
        int starts = 0;
        for (Assignment assignment : assignments) {
            if (assignment.isStarting(workerId)) {
                starts++;
            }
        }
        return starts;
    }

    @Override
    public String toString() {
        return String.format("HorizonPlan{events=%d, totalGss=%.1f}", assignments.size(), getTotalGss());
    }
}
