package org.puneet.smpso.operator;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Mutation that leaves the solution untouched. Turns the perturbation step
 * off without special-casing the loop.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class NullMutation implements MutationOperator {

    @Override
    public FloatSolution execute(FloatSolution solution) {
        return solution;
    }
}
