package org.squadplanner.simulation.model;

/**
 * Base type of every error raised while validating, pricing or solving a plan.
 */
public abstract class PlanningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected PlanningException(String message) {
        super(message);
    }
}
