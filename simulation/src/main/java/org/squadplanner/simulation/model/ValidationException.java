package org.squadplanner.simulation.model;

import java.util.Collections;
import java.util.List;

/**
 * Raised when an input state or parameter is malformed or out of range.
 * Always raised before any matrix is built or any state is propagated.
 */
public final class ValidationException extends PlanningException {

    private static final long serialVersionUID = 1L;

    private final List<String> offendingIds;

    public ValidationException(String message, String... offendingIds) {
        super(message);
        this.offendingIds = List.of(offendingIds);
    }

    /**
     * Identifiers of the workers, slots, events or parameters that failed validation.
     */
    public List<String> getOffendingIds() {
        return Collections.unmodifiableList(offendingIds);
    }

    /**
     * Fails unless {@code value} lies in {@code [min, max]}.
     */
    public static double requireInRange(double value, double min, double max, String field, String ownerId) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(
                    String.format("%s of %s must be in [%s, %s] but was %s", field, ownerId, min, max, value),
                    ownerId);
        }
        return value;
    }

    /**
     * Fails unless {@code value} is finite and not negative.
     */
    public static double requireNonNegative(double value, String field, String ownerId) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ValidationException(
                    String.format("%s of %s must be a finite non-negative number but was %s", field, ownerId, value),
                    ownerId);
        }
        return value;
    }
}
