package org.puneet.smpso.problem;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.smpso.solution.FloatSolution;

/**
 * Continuous, box-bounded, multi-objective minimization problem.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public interface FloatProblem {

    String getName();

    int getNumberOfVariables();

    int getNumberOfObjectives();

    double getLowerBound(int index);

    double getUpperBound(int index);

    /**
     * Creates a random feasible, unevaluated solution.
     *
     * @param random random source
     * @return new solution with every variable inside its bounds
     */
    FloatSolution createSolution(RandomGenerator random);

    /**
     * Computes the objective values of a solution in place.
     *
     * @param solution the solution to evaluate
     */
    void evaluate(FloatSolution solution);
}
