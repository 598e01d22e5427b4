package org.puneet.smpso.problem;

import org.apache.commons.math3.util.FastMath;
import org.puneet.smpso.solution.FloatSolution;

/**
 * ZDT1 benchmark: two objectives with a convex Pareto front
 * {@code f2 = 1 - sqrt(f1)} reached when x_2..x_n are zero.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class ZDT1 extends AbstractFloatProblem {

    /** Standard dimensionality of the benchmark. */
    public static final int DEFAULT_NUMBER_OF_VARIABLES = 30;

    public ZDT1() {
        this(DEFAULT_NUMBER_OF_VARIABLES);
    }

    public ZDT1(int numberOfVariables) {
        super(2, uniformBounds(numberOfVariables, 0.0), uniformBounds(numberOfVariables, 1.0));
    }

    @Override
    public String getName() {
        return "ZDT1";
    }

    @Override
    public void evaluate(FloatSolution solution) {
        int n = solution.getNumberOfVariables();
        double f1 = solution.getVariable(0);

        double g = 0.0;
        for (int i = 1; i < n; i++) {
            g += solution.getVariable(i);
        }
        g = n > 1 ? 1.0 + 9.0 * g / (n - 1) : 1.0;

        double h = 1.0 - FastMath.sqrt(f1 / g);

        solution.setObjective(0, f1);
        solution.setObjective(1, g * h);
    }
}
