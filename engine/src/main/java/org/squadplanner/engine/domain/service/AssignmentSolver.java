package org.squadplanner.engine.domain.service;

/**
 * Minimum-cost perfect matching on a square cost matrix.
 */
public interface AssignmentSolver {

    /**
     * @param costs square matrix, rows are workers and columns are slots or rest sinks
     * @return for each row, the column it is matched to
     */
    int[] solve(double[][] costs);
}
