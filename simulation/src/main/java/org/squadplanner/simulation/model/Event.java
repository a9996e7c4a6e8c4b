package org.squadplanner.simulation.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One scheduled fixture in the planning horizon. Never mutated by the planner.
 */
public final class Event {

    private final String id;
    private final LocalDate date;
    private final Importance importance;
    private final Formation formation;
    private final ConstraintSet constraints;

    public Event(String id, LocalDate date, Importance importance, Formation formation, ConstraintSet constraints) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.importance = Objects.requireNonNull(importance, "importance must not be null");
        this.formation = Objects.requireNonNull(formation, "formation must not be null");
        this.constraints = constraints != null ? constraints : ConstraintSet.empty();
    }

    public Event(String id, LocalDate date, Importance importance, Formation formation) {
        this(id, date, importance, formation, ConstraintSet.empty());
    }

    public String getId() {
        return id;
    }

    public LocalDate getDate() {
        return date;
    }

    public Importance getImportance() {
        return importance;
    }

    public Formation getFormation() {
        return formation;
    }

    public ConstraintSet getConstraints() {
        return constraints;
    }

    /**
     * Copy of this event played in a different formation.
     */
    public Event withFormation(Formation other) {
        return new Event(id, date, importance, other, constraints);
    }

    @Override
    public String toString() {
        return "Event{" + id + ", " + date + ", " + importance + ", " + formation.getName() + "}";
    }
}
