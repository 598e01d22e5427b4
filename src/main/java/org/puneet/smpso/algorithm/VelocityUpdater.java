package org.puneet.smpso.algorithm;

import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.puneet.smpso.archive.BoundedArchive;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Speed-constrained velocity update of SMPSO.
 *
 * <p>For particle i and variable j the raw velocity is</p>
 * <pre>
 * v[i][j] = chi(c1, c2) * (w * v[i][j]
 *                          + c1 * r1 * (pbest[j] - x[j])
 *                          + c2 * r2 * (gbest[j] - x[j]))
 * </pre>
 * <p>where r1, r2, c1 and c2 are drawn once per particle per generation and
 * shared by all its variables, and gbest is picked from the leader archive
 * by a binary tournament on crowding, independently for every particle. The
 * result is clamped to {@code [-deltaMax[j], deltaMax[j]]} with
 * {@code deltaMax[j]} half the range of variable j.</p>
 *
 * <p>The velocity matrix belongs to this class and persists across
 * generations; {@link PositionUpdater} reverses entries in place when a
 * particle hits a bound.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public class VelocityUpdater {

    private static final Logger logger = LoggerFactory.getLogger(VelocityUpdater.class);

    private final double[][] velocity;
    private final double[] deltaMax;
    private final double[] deltaMin;

    private final double c1Min;
    private final double c1Max;
    private final double c2Min;
    private final double c2Max;

    private final RandomGenerator random;

    /**
     * Creates the updater with a zeroed velocity matrix.
     *
     * @param problem problem providing the variable bounds
     * @param parameters swarm size and acceleration coefficient ranges
     * @param random random source
     */
    public VelocityUpdater(FloatProblem problem, SmpsoParameters parameters, RandomGenerator random) {
        Objects.requireNonNull(problem, "Problem cannot be null");
        Objects.requireNonNull(parameters, "Parameters cannot be null");
        this.random = Objects.requireNonNull(random, "Random generator cannot be null");

        int numberOfVariables = problem.getNumberOfVariables();
        this.velocity = new double[parameters.getSwarmSize()][numberOfVariables];
        this.deltaMax = new double[numberOfVariables];
        this.deltaMin = new double[numberOfVariables];

        for (int j = 0; j < numberOfVariables; j++) {
            deltaMax[j] = (problem.getUpperBound(j) - problem.getLowerBound(j)) / 2.0;
            deltaMin[j] = -deltaMax[j];
        }

        this.c1Min = parameters.getC1Min();
        this.c1Max = parameters.getC1Max();
        this.c2Min = parameters.getC2Min();
        this.c2Max = parameters.getC2Max();
    }

    /**
     * Computes the new velocity of every particle.
     *
     * @param swarm current particle positions
     * @param personalBests best position seen by each particle
     * @param leaders leader archive with fresh density scores
     * @param inertiaWeight inertia weight for this generation
     */
    public void update(List<FloatSolution> swarm, PersonalBestTracker personalBests,
                       BoundedArchive leaders, double inertiaWeight) {
        for (int i = 0; i < swarm.size(); i++) {
            FloatSolution particle = swarm.get(i);
            FloatSolution bestParticle = personalBests.get(i);
            FloatSolution bestGlobal = selectGlobalBest(leaders);

            double r1 = random.nextDouble();
            double r2 = random.nextDouble();
            double c1 = uniform(c1Min, c1Max);
            double c2 = uniform(c2Min, c2Max);
            double chi = constrictionCoefficient(c1, c2);

            for (int j = 0; j < particle.getNumberOfVariables(); j++) {
                double x = particle.getVariable(j);
                double raw = chi * (inertiaWeight * velocity[i][j]
                    + c1 * r1 * (bestParticle.getVariable(j) - x)
                    + c2 * r2 * (bestGlobal.getVariable(j) - x));
                velocity[i][j] = constrain(raw, j);
            }
        }
        logger.trace("Updated velocity of {} particles with inertia weight {}", swarm.size(), inertiaWeight);
    }

    /**
     * Binary tournament on the leaders' density comparator; the first drawn
     * member wins ties.
     *
     * @param leaders leader archive with fresh density scores
     * @return a copy of the selected leader
     * @throws IllegalStateException if the archive is empty or its scores are stale
     */
    public FloatSolution selectGlobalBest(BoundedArchive leaders) {
        FloatSolution[] pair = leaders.selectTwoForTournament(random);
        if (leaders.getComparator().compare(pair[0], pair[1]) < 1) {
            return pair[0].copy();
        }
        return pair[1].copy();
    }

    /**
     * Clerc and Kennedy constriction coefficient.
     *
     * @return 1.0 when {@code c1 + c2 <= 4}, otherwise
     *         {@code 2 / (2 - rho - sqrt(rho^2 - 4 rho))} with {@code rho = c1 + c2}
     */
    public static double constrictionCoefficient(double c1, double c2) {
        double rho = c1 + c2;
        if (rho <= AlgorithmConstants.CONSTRICTION_THRESHOLD) {
            return 1.0;
        }
        return 2.0 / (2.0 - rho - FastMath.sqrt(rho * rho - 4.0 * rho));
    }

    /**
     * Clamps a raw velocity to the speed limits of a variable.
     *
     * @param value raw velocity
     * @param variableIndex variable index
     * @return value limited to {@code [deltaMin, deltaMax]}
     */
    public double constrain(double value, int variableIndex) {
        if (value > deltaMax[variableIndex]) {
            return deltaMax[variableIndex];
        }
        if (value < deltaMin[variableIndex]) {
            return deltaMin[variableIndex];
        }
        return value;
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    public double getVelocity(int particle, int variable) {
        return velocity[particle][variable];
    }

    public void setVelocity(int particle, int variable, double value) {
        velocity[particle][variable] = value;
    }

    public double getDeltaMax(int variable) {
        return deltaMax[variable];
    }

    public double getDeltaMin(int variable) {
        return deltaMin[variable];
    }

    public int getSwarmSize() {
        return velocity.length;
    }
}
