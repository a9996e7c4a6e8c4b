package org.squadplanner.engine.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HungarianAssignmentSolverTest {

    private final AssignmentSolver solver = new HungarianAssignmentSolver();

    @Test
    void solvesASmallTextbookCase() {
        double[][] costs = {
                {4, 1, 3},
                {2, 0, 5},
                {3, 2, 2}
        };

        int[] columns = solver.solve(costs);

        assertEquals(5.0, total(costs, columns), 1e-9);
        assertIsPermutation(columns);
    }

    @Test
    void matchesBruteForceOnRandomMatrices() {
        Random random = new Random(7);
        for (int round = 0; round < 200; round++) {
            int n = 1 + random.nextInt(7);
            double[][] costs = new double[n][n];
            for (double[] row : costs) {
                for (int j = 0; j < n; j++) {
                    row[j] = random.nextInt(41) - 20 + random.nextDouble();
                }
            }

            int[] columns = solver.solve(costs);

            assertIsPermutation(columns);
            assertEquals(bruteForce(costs), total(costs, columns), 1e-9, () -> Arrays.deepToString(costs));
        }
    }

    @Test
    void avoidsForbiddenCellsWhenPossible() {
        double big = 1e6;
        double[][] costs = {
                {-100, big, 0},
                {big, big, 0},
                {-90, -80, 0}
        };

        int[] columns = solver.solve(costs);

        assertTrue(total(costs, columns) < big);
        assertEquals(2, columns[1]);
    }

    @Test
    void identicalInputGivesIdenticalOutput() {
        double[][] costs = {
                {1, 1, 1},
                {1, 1, 1},
                {1, 1, 1}
        };

        assertArrayEquals(solver.solve(costs), solver.solve(costs));
    }

    @Test
    void rejectsNonSquareMatrices() {
        assertThrows(IllegalArgumentException.class, () -> solver.solve(new double[][]{{1, 2}, {3}}));
        assertEquals(0, solver.solve(new double[0][0]).length);
    }

    private static double total(double[][] costs, int[] columns) {
        double sum = 0;
        for (int i = 0; i < columns.length; i++) {
            sum += costs[i][columns[i]];
        }
        return sum;
    }

    private static void assertIsPermutation(int[] columns) {
        boolean[] seen = new boolean[columns.length];
        for (int column : columns) {
            assertFalse(seen[column], "column used twice: " + column);
            seen[column] = true;
        }
    }

    private static double bruteForce(double[][] costs) {
        int n = costs.length;
        int[] perm = new int[n];
        for (int i = 0; i < n; i++) {
            perm[i] = i;
        }
        double best = Double.POSITIVE_INFINITY;
        do {
            best = Math.min(best, total(costs, perm));
        } while (nextPermutation(perm));
        return best;
    }

    private static boolean nextPermutation(int[] a) {
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        int j = a.length - 1;
        while (a[j] <= a[i]) {
            j--;
        }
        int t = a[i];
        a[i] = a[j];
        a[j] = t;
        for (int l = i + 1, r = a.length - 1; l < r; l++, r--) {
            t = a[l];
            a[l] = a[r];
            a[r] = t;
        }
        return true;
    }
}
