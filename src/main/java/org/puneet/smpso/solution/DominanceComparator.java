package org.puneet.smpso.solution;

import java.util.Comparator;

/**
 * Pareto dominance test over objective vectors (minimization).
 *
 * <p>{@code compare(a, b)} returns -1 if {@code a} dominates {@code b}, 1 if
 * {@code b} dominates {@code a}, and 0 if neither dominates the other. Two
 * identical objective vectors are mutually non-dominated.</p>
 *
 * <p>This is a partial order: a result of 0 does not imply equality, so the
 * comparator is not suitable for sorting.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class DominanceComparator implements Comparator<FloatSolution> {

    @Override
    public int compare(FloatSolution a, FloatSolution b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Cannot compare null solutions");
        }
        if (a.getNumberOfObjectives() != b.getNumberOfObjectives()) {
            throw new IllegalArgumentException(
                String.format("Objective count mismatch: %d vs %d",
                    a.getNumberOfObjectives(), b.getNumberOfObjectives()));
        }

        boolean aBetterSomewhere = false;
        boolean bBetterSomewhere = false;

        for (int i = 0; i < a.getNumberOfObjectives(); i++) {
            double valueA = a.getObjective(i);
            double valueB = b.getObjective(i);
            if (valueA < valueB) {
                aBetterSomewhere = true;
            } else if (valueA > valueB) {
                bBetterSomewhere = true;
            }
            if (aBetterSomewhere && bBetterSomewhere) {
                return 0;
            }
        }

        if (aBetterSomewhere) {
            return -1;
        }
        if (bBetterSomewhere) {
            return 1;
        }
        return 0;
    }

    /**
     * Convenience form of {@link #compare}.
     *
     * @return true if {@code a} dominates {@code b}
     */
    public boolean dominates(FloatSolution a, FloatSolution b) {
        return compare(a, b) < 0;
    }
}
