package org.squadplanner.engine.api;

import org.squadplanner.engine.api.dto.ParameterSetDto;

/**
 * Source of planner parameters.
 */
public interface ParameterSource {

    /**
     * Fetch the current parameter set.
     *
     * @return the parameter set, or null when the source is unavailable
     */
    ParameterSetDto fetchParameters();

    /**
     * Human-readable description used in log messages.
     */
    String describe();
}
