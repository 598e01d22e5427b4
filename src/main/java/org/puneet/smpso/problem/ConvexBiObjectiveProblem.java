package org.puneet.smpso.problem;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Two conflicting convex objectives on the unit hypercube:
 * <pre>
 * f1(x) = sum(x_i^2)
 * f2(x) = sum((x_i - 1)^2)
 * </pre>
 * The Pareto set is the diagonal segment from the origin to (1, ..., 1).
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class ConvexBiObjectiveProblem extends AbstractFloatProblem {

    public ConvexBiObjectiveProblem() {
        this(2);
    }

    public ConvexBiObjectiveProblem(int numberOfVariables) {
        super(2, uniformBounds(numberOfVariables, 0.0), uniformBounds(numberOfVariables, 1.0));
    }

    @Override
    public String getName() {
        return "ConvexBiObjective";
    }

    @Override
    public void evaluate(FloatSolution solution) {
        double f1 = 0.0;
        double f2 = 0.0;
        for (int i = 0; i < solution.getNumberOfVariables(); i++) {
            double x = solution.getVariable(i);
            f1 += x * x;
            f2 += (x - 1.0) * (x - 1.0);
        }
        solution.setObjective(0, f1);
        solution.setObjective(1, f2);
    }
}
