package org.puneet.smpso.operator;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Perturbs the decision variables of a solution in place, keeping every
 * variable inside its bounds.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public interface MutationOperator {

    /**
     * @param solution the solution to mutate
     * @return the same solution instance
     */
    FloatSolution execute(FloatSolution solution);
}
