package org.squadplanner.engine.cache;

import org.squadplanner.engine.domain.model.PlannerConfig;

/**
 * Cache of the planner parameters loaded from a parameter source.
 */
public interface ParameterCache {

    /**
     * Reload the parameters from the source. Keeps the current parameters if the source fails.
     */
    void refresh();

    /**
     * Get the current planner configuration.
     */
    PlannerConfig getConfig();

    /**
     * Whether at least one refresh has succeeded.
     */
    boolean isInitialized();
}
