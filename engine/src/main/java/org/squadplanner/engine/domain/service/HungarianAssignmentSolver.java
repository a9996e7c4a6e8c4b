package org.squadplanner.engine.domain.service;

import java.util.Arrays;

/**
 * Hungarian algorithm with row and column potentials, O(n^3).
 * Ties are broken by the lowest column index, so identical input gives identical output.
 */
public final class HungarianAssignmentSolver implements AssignmentSolver {

    @Override
    public int[] solve(double[][] costs) {
        int n = costs.length;
        for (double[] row : costs) {
            if (row.length != n) {
                throw new IllegalArgumentException("cost matrix must be square");
            }
        }
        if (n == 0) {
            return new int[0];
        }

        // 1-based; column 0 is a virtual start column
        double[] u = new double[n + 1];
        double[] v = new double[n + 1];
        int[] matchOfColumn = new int[n + 1];
        int[] way = new int[n + 1];

        for (int row = 1; row <= n; row++) {
            matchOfColumn[0] = row;
            int column = 0;
            double[] minSlack = new double[n + 1];
            boolean[] used = new boolean[n + 1];
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            do {
                used[column] = true;
                int currentRow = matchOfColumn[column];
                double delta = Double.POSITIVE_INFINITY;
                int next = -1;
                for (int j = 1; j <= n; j++) {
                    if (used[j]) {
                        continue;
                    }
                    double slack = costs[currentRow - 1][j - 1] - u[currentRow] - v[j];
                    if (slack < minSlack[j]) {
                        minSlack[j] = slack;
                        way[j] = column;
                    }
                    if (minSlack[j] < delta) {
                        delta = minSlack[j];
                        next = j;
                    }
                }
                for (int j = 0; j <= n; j++) {
                    if (used[j]) {
                        u[matchOfColumn[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minSlack[j] -= delta;
                    }
                }
                column = next;
            } while (matchOfColumn[column] != 0);

            do {
                int previous = way[column];
                matchOfColumn[column] = matchOfColumn[previous];
                column = previous;
            } while (column != 0);
        }

        int[] result = new int[n];
        for (int j = 1; j <= n; j++) {
            result[matchOfColumn[j] - 1] = j - 1;
        }
        return result;
    }
}
