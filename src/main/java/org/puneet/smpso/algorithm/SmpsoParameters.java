package org.puneet.smpso.algorithm;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration parameters for the SMPSO algorithm.
 *
 * <p>Setters validate single values as they are set. Constraints that span
 * two values (a minimum not above its maximum) are checked by
 * {@link #validate()}, which {@link SMPSO} calls when it takes its own copy
 * of the parameters. Changing a parameters object after an algorithm has
 * been built has no effect on that algorithm.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class SmpsoParameters {

    private static final Logger logger = LoggerFactory.getLogger(SmpsoParameters.class);

    // Swarm and budget
    private int swarmSize;
    private int maxEvaluations;
    private int archiveSize;
    private long maxComputingTimeMillis;
    private long seed;

    // Acceleration coefficient ranges
    private double c1Min;
    private double c1Max;
    private double c2Min;
    private double c2Max;

    // Inertia weight bounds
    private double minWeight;
    private double maxWeight;

    // Boundary velocity factors
    private double changeVelocity1;
    private double changeVelocity2;

    /**
     * Creates a parameters instance with the defaults from {@link AlgorithmConstants}.
     */
    public SmpsoParameters() {
        this.swarmSize = AlgorithmConstants.DEFAULT_SWARM_SIZE;
        this.maxEvaluations = AlgorithmConstants.DEFAULT_MAX_EVALUATIONS;
        this.archiveSize = AlgorithmConstants.DEFAULT_ARCHIVE_SIZE;
        this.maxComputingTimeMillis = AlgorithmConstants.DEFAULT_MAX_COMPUTING_TIME_MILLIS;
        this.seed = AlgorithmConstants.DEFAULT_RANDOM_SEED;

        this.c1Min = AlgorithmConstants.C1_MIN;
        this.c1Max = AlgorithmConstants.C1_MAX;
        this.c2Min = AlgorithmConstants.C2_MIN;
        this.c2Max = AlgorithmConstants.C2_MAX;

        this.minWeight = AlgorithmConstants.MIN_WEIGHT;
        this.maxWeight = AlgorithmConstants.MAX_WEIGHT;

        this.changeVelocity1 = AlgorithmConstants.CHANGE_VELOCITY_1;
        this.changeVelocity2 = AlgorithmConstants.CHANGE_VELOCITY_2;
    }

    /**
     * Validates the constraints between parameters.
     *
     * @throws IllegalArgumentException if a minimum exceeds its maximum, or if
     *         the evaluation counter could overflow an int
     */
    public void validate() {
        if (c1Min > c1Max) {
            throw new IllegalArgumentException(
                String.format("c1Min (%.4f) must not exceed c1Max (%.4f)", c1Min, c1Max));
        }
        if (c2Min > c2Max) {
            throw new IllegalArgumentException(
                String.format("c2Min (%.4f) must not exceed c2Max (%.4f)", c2Min, c2Max));
        }
        if (minWeight > maxWeight) {
            throw new IllegalArgumentException(
                String.format("minWeight (%.4f) must not exceed maxWeight (%.4f)", minWeight, maxWeight));
        }
        // the evaluation counter may pass maxEvaluations by up to one swarm
        if ((long) maxEvaluations + swarmSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("maxEvaluations (%d) plus swarmSize (%d) exceeds %d",
                    maxEvaluations, swarmSize, Integer.MAX_VALUE));
        }
        logger.debug("Validated {}", this);
    }

    /**
     * Creates a deep copy of this parameters instance.
     *
     * @return a new SmpsoParameters instance with identical values
     */
    public SmpsoParameters copy() {
        SmpsoParameters copy = new SmpsoParameters();
        copy.swarmSize = this.swarmSize;
        copy.maxEvaluations = this.maxEvaluations;
        copy.archiveSize = this.archiveSize;
        copy.maxComputingTimeMillis = this.maxComputingTimeMillis;
        copy.seed = this.seed;
        copy.c1Min = this.c1Min;
        copy.c1Max = this.c1Max;
        copy.c2Min = this.c2Min;
        copy.c2Max = this.c2Max;
        copy.minWeight = this.minWeight;
        copy.maxWeight = this.maxWeight;
        copy.changeVelocity1 = this.changeVelocity1;
        copy.changeVelocity2 = this.changeVelocity2;
        return copy;
    }

    // Getters and setters with validation

    public int getSwarmSize() {
        return swarmSize;
    }

    public void setSwarmSize(int swarmSize) {
        if (swarmSize <= 0) {
            throw new IllegalArgumentException("Swarm size must be positive, got: " + swarmSize);
        }
        this.swarmSize = swarmSize;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    public void setMaxEvaluations(int maxEvaluations) {
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("Max evaluations must be positive, got: " + maxEvaluations);
        }
        this.maxEvaluations = maxEvaluations;
    }

    public int getArchiveSize() {
        return archiveSize;
    }

    public void setArchiveSize(int archiveSize) {
        if (archiveSize <= 0) {
            throw new IllegalArgumentException("Archive size must be positive, got: " + archiveSize);
        }
        this.archiveSize = archiveSize;
    }

    public long getMaxComputingTimeMillis() {
        return maxComputingTimeMillis;
    }

    public void setMaxComputingTimeMillis(long maxComputingTimeMillis) {
        if (maxComputingTimeMillis < 0) {
            throw new IllegalArgumentException(
                "Max computing time must be non-negative, got: " + maxComputingTimeMillis);
        }
        this.maxComputingTimeMillis = maxComputingTimeMillis;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public double getC1Min() {
        return c1Min;
    }

    public void setC1Min(double c1Min) {
        this.c1Min = requirePositiveCoefficient("c1Min", c1Min);
    }

    public double getC1Max() {
        return c1Max;
    }

    public void setC1Max(double c1Max) {
        this.c1Max = requirePositiveCoefficient("c1Max", c1Max);
    }

    public double getC2Min() {
        return c2Min;
    }

    public void setC2Min(double c2Min) {
        this.c2Min = requirePositiveCoefficient("c2Min", c2Min);
    }

    public double getC2Max() {
        return c2Max;
    }

    public void setC2Max(double c2Max) {
        this.c2Max = requirePositiveCoefficient("c2Max", c2Max);
    }

    public double getMinWeight() {
        return minWeight;
    }

    public void setMinWeight(double minWeight) {
        this.minWeight = requireUnitInterval("minWeight", minWeight);
    }

    public double getMaxWeight() {
        return maxWeight;
    }

    public void setMaxWeight(double maxWeight) {
        this.maxWeight = requireUnitInterval("maxWeight", maxWeight);
    }

    public double getChangeVelocity1() {
        return changeVelocity1;
    }

    public void setChangeVelocity1(double changeVelocity1) {
        this.changeVelocity1 = requireChangeFactor("changeVelocity1", changeVelocity1);
    }

    public double getChangeVelocity2() {
        return changeVelocity2;
    }

    public void setChangeVelocity2(double changeVelocity2) {
        this.changeVelocity2 = requireChangeFactor("changeVelocity2", changeVelocity2);
    }

    private static double requirePositiveCoefficient(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(name + " must be a positive finite number, got: " + value);
        }
        return value;
    }

    private static double requireUnitInterval(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got: " + value);
        }
        return value;
    }

    private static double requireChangeFactor(String name, double value) {
        if (!(value >= -1.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be between -1.0 and 1.0, got: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format(
            "SmpsoParameters{swarmSize=%d, maxEvaluations=%d, archiveSize=%d, " +
            "c1=[%.2f,%.2f], c2=[%.2f,%.2f], weight=[%.2f,%.2f], " +
            "changeVelocity=[%.2f,%.2f], maxComputingTimeMillis=%d, seed=%d}",
            swarmSize, maxEvaluations, archiveSize,
            c1Min, c1Max, c2Min, c2Max, minWeight, maxWeight,
            changeVelocity1, changeVelocity2, maxComputingTimeMillis, seed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SmpsoParameters that = (SmpsoParameters) o;
        return swarmSize == that.swarmSize &&
               maxEvaluations == that.maxEvaluations &&
               archiveSize == that.archiveSize &&
               maxComputingTimeMillis == that.maxComputingTimeMillis &&
               seed == that.seed &&
               Double.compare(that.c1Min, c1Min) == 0 &&
               Double.compare(that.c1Max, c1Max) == 0 &&
               Double.compare(that.c2Min, c2Min) == 0 &&
               Double.compare(that.c2Max, c2Max) == 0 &&
               Double.compare(that.minWeight, minWeight) == 0 &&
               Double.compare(that.maxWeight, maxWeight) == 0 &&
               Double.compare(that.changeVelocity1, changeVelocity1) == 0 &&
               Double.compare(that.changeVelocity2, changeVelocity2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(swarmSize, maxEvaluations, archiveSize, maxComputingTimeMillis, seed,
                            c1Min, c1Max, c2Min, c2Max, minWeight, maxWeight,
                            changeVelocity1, changeVelocity2);
    }
}
