package org.puneet.smpso.evaluator;

import java.util.List;

import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;

/**
 * Evaluates the swarm one solution at a time on the calling thread.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class SequentialEvaluator implements Evaluator {

    @Override
    public List<FloatSolution> evaluate(List<FloatSolution> swarm, FloatProblem problem) {
        for (FloatSolution solution : swarm) {
            problem.evaluate(solution);
        }
        return swarm;
    }
}
