package org.squadplanner.engine.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of planning a horizon in one candidate formation: a plan, or the reason it failed.
 */
public final class FormationResult implements Comparable<FormationResult> {

    private final String formationName;
    private final HorizonPlan plan;
    private final String failure;

    private FormationResult(String formationName, HorizonPlan plan, String failure) {
        this.formationName = Objects.requireNonNull(formationName, "formationName must not be null");
        this.plan = plan;
        this.failure = failure;
    }

    public static FormationResult success(String formationName, HorizonPlan plan) {
        return new FormationResult(formationName, Objects.requireNonNull(plan, "plan must not be null"), null);
    }

    public static FormationResult failure(String formationName, String failure) {
        return new FormationResult(formationName, null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public String getFormationName() {
        return formationName;
    }

    public Optional<HorizonPlan> getPlan() {
        return Optional.ofNullable(plan);
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isFeasible() {
        return plan != null;
    }

    public double getTotalGss() {
        return plan != null ? plan.getTotalGss() : 0.0;
    }

    @Override
    public int compareTo(FormationResult other) {
        // Feasible first, then highest total GSS, then name
        if (isFeasible() != other.isFeasible()) {
            return isFeasible() ? -1 : 1;
        }
        int byGss = Double.compare(other.getTotalGss(), getTotalGss());
        return byGss != 0 ? byGss : formationName.compareTo(other.formationName);
    }

    @Override
    public String toString() {
        return isFeasible()
                ? String.format("FormationResult{%s, totalGss=%.1f}", formationName, getTotalGss())
                : "FormationResult{" + formationName + ", failed: " + failure + "}";
    }
}
