package org.puneet.smpso.evaluator;

import java.util.List;

import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;

/**
 * Computes the objectives of a whole swarm. The call blocks until every
 * solution has been evaluated, and the returned list preserves the order of
 * the input.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public interface Evaluator {

    /**
     * @param swarm solutions to evaluate in place
     * @param problem problem defining the objectives
     * @return the evaluated swarm, in input order
     */
    List<FloatSolution> evaluate(List<FloatSolution> swarm, FloatProblem problem);
}
