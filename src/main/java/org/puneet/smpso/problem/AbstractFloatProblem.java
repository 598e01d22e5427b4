package org.puneet.smpso.problem;

import java.util.Arrays;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for problems with per-variable box bounds. Bounds are validated
 * once at construction so an inverted range fails before any run starts.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public abstract class AbstractFloatProblem implements FloatProblem {

    private static final Logger logger = LoggerFactory.getLogger(AbstractFloatProblem.class);

    private final int numberOfObjectives;
    private final double[] lowerBounds;
    private final double[] upperBounds;

    /**
     * @param numberOfObjectives number of objectives
     * @param lowerBounds lower bound of each variable
     * @param upperBounds upper bound of each variable
     * @throws IllegalArgumentException if the bounds are empty, of different
     *         lengths, non-finite or inverted, or if there are no objectives
     */
    protected AbstractFloatProblem(int numberOfObjectives, double[] lowerBounds, double[] upperBounds) {
        validateBounds(numberOfObjectives, lowerBounds, upperBounds);

        this.numberOfObjectives = numberOfObjectives;
        this.lowerBounds = lowerBounds.clone();
        this.upperBounds = upperBounds.clone();

        logger.debug("Created problem with {} variables and {} objectives",
            lowerBounds.length, numberOfObjectives);
    }

    /**
     * Creates the bound arrays of a problem whose variables all share one range.
     */
    protected static double[] uniformBounds(int numberOfVariables, double value) {
        if (numberOfVariables <= 0) {
            throw new IllegalArgumentException("Number of variables must be positive, got: " + numberOfVariables);
        }
        double[] bounds = new double[numberOfVariables];
        Arrays.fill(bounds, value);
        return bounds;
    }

    private static void validateBounds(int numberOfObjectives, double[] lowerBounds, double[] upperBounds) {
        if (numberOfObjectives <= 0) {
            throw new IllegalArgumentException("Number of objectives must be positive, got: " + numberOfObjectives);
        }
        if (lowerBounds == null || upperBounds == null) {
            throw new IllegalArgumentException("Bounds cannot be null");
        }
        if (lowerBounds.length == 0) {
            throw new IllegalArgumentException("Problem must have at least one variable");
        }
        if (lowerBounds.length != upperBounds.length) {
            throw new IllegalArgumentException(
                String.format("Bound lengths differ: %d lower vs %d upper", lowerBounds.length, upperBounds.length));
        }
        for (int i = 0; i < lowerBounds.length; i++) {
            if (!Double.isFinite(lowerBounds[i]) || !Double.isFinite(upperBounds[i])) {
                throw new IllegalArgumentException("Bounds of variable " + i + " must be finite");
            }
            if (lowerBounds[i] > upperBounds[i]) {
                throw new IllegalArgumentException(
                    String.format("Inverted bounds for variable %d: [%f, %f]", i, lowerBounds[i], upperBounds[i]));
            }
        }
    }

    @Override
    public FloatSolution createSolution(RandomGenerator random) {
        FloatSolution solution = new FloatSolution(getNumberOfVariables(), numberOfObjectives);
        for (int i = 0; i < getNumberOfVariables(); i++) {
            double value = lowerBounds[i] + random.nextDouble() * (upperBounds[i] - lowerBounds[i]);
            solution.setVariable(i, value);
        }
        return solution;
    }

    @Override
    public int getNumberOfVariables() {
        return lowerBounds.length;
    }

    @Override
    public int getNumberOfObjectives() {
        return numberOfObjectives;
    }

    @Override
    public double getLowerBound(int index) {
        return lowerBounds[index];
    }

    @Override
    public double getUpperBound(int index) {
        return upperBounds[index];
    }

    @Override
    public String toString() {
        return String.format("%s{variables=%d, objectives=%d}",
            getName(), getNumberOfVariables(), numberOfObjectives);
    }
}
