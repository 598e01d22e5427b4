package org.puneet.smpso.operator;

import java.util.Objects;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polynomial mutation (Deb and Goyal). Each variable is perturbed with the
 * given probability by a polynomially distributed step whose spread shrinks
 * as the distribution index grows.
 *
 * <p>Mutated values are clamped to the problem bounds.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class PolynomialMutation implements MutationOperator {

    private static final Logger logger = LoggerFactory.getLogger(PolynomialMutation.class);

    /** Distribution index conventionally paired with SMPSO. */
    public static final double DEFAULT_DISTRIBUTION_INDEX = 20.0;

    private final FloatProblem problem;
    private final double mutationProbability;
    private final double distributionIndex;
    private final RandomGenerator random;

    /**
     * Creates a mutation with probability {@code 1 / numberOfVariables} and the
     * default distribution index.
     */
    public PolynomialMutation(FloatProblem problem, RandomGenerator random) {
        this(problem, 1.0 / problem.getNumberOfVariables(), DEFAULT_DISTRIBUTION_INDEX, random);
    }

    /**
     * @param problem problem providing the variable bounds
     * @param mutationProbability per-variable mutation probability in [0, 1]
     * @param distributionIndex non-negative distribution index
     * @param random random source
     * @throws IllegalArgumentException if probability or index is out of range
     */
    public PolynomialMutation(FloatProblem problem, double mutationProbability,
                              double distributionIndex, RandomGenerator random) {
        if (mutationProbability < 0.0 || mutationProbability > 1.0) {
            throw new IllegalArgumentException(
                "Mutation probability must be between 0.0 and 1.0, got: " + mutationProbability);
        }
        if (distributionIndex < 0.0) {
            throw new IllegalArgumentException(
                "Distribution index must be non-negative, got: " + distributionIndex);
        }
        this.problem = Objects.requireNonNull(problem, "Problem cannot be null");
        this.random = Objects.requireNonNull(random, "Random generator cannot be null");
        this.mutationProbability = mutationProbability;
        this.distributionIndex = distributionIndex;

        logger.debug("Initialized PolynomialMutation with probability {} and distribution index {}",
            mutationProbability, distributionIndex);
    }

    @Override
    public FloatSolution execute(FloatSolution solution) {
        Objects.requireNonNull(solution, "Solution cannot be null");

        for (int i = 0; i < solution.getNumberOfVariables(); i++) {
            if (random.nextDouble() <= mutationProbability) {
                solution.setVariable(i, mutateVariable(solution.getVariable(i), i));
            }
        }
        return solution;
    }

    private double mutateVariable(double y, int index) {
        double lower = problem.getLowerBound(index);
        double upper = problem.getUpperBound(index);

        if (lower == upper) {
            return lower;
        }

        double range = upper - lower;
        double delta1 = (y - lower) / range;
        double delta2 = (upper - y) / range;
        double rnd = random.nextDouble();
        double mutPow = 1.0 / (distributionIndex + 1.0);
        double deltaq;

        if (rnd <= 0.5) {
            double xy = 1.0 - delta1;
            double val = 2.0 * rnd + (1.0 - 2.0 * rnd) * FastMath.pow(xy, distributionIndex + 1.0);
            deltaq = FastMath.pow(val, mutPow) - 1.0;
        } else {
            double xy = 1.0 - delta2;
            double val = 2.0 * (1.0 - rnd) + 2.0 * (rnd - 0.5) * FastMath.pow(xy, distributionIndex + 1.0);
            deltaq = 1.0 - FastMath.pow(val, mutPow);
        }

        double mutated = y + deltaq * range;
        return Math.max(lower, Math.min(upper, mutated));
    }

    public double getMutationProbability() {
        return mutationProbability;
    }

    public double getDistributionIndex() {
        return distributionIndex;
    }
}
