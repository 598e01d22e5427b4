package org.puneet.smpso.algorithm;

/**
 * AlgorithmConstants.java
 *
 * Default values for every SMPSO parameter. {@link SmpsoParameters} starts
 * from these and the configuration file may override any of them.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public final class AlgorithmConstants {

    private AlgorithmConstants() {
        throw new AssertionError("Cannot instantiate AlgorithmConstants");
    }

    // ===================================================================================
    // SWARM AND BUDGET
    // ===================================================================================

    public static final int DEFAULT_SWARM_SIZE = 100;

    public static final int DEFAULT_MAX_EVALUATIONS = 25000;

    /**
     * Capacity of the leader archive.
     */
    public static final int DEFAULT_ARCHIVE_SIZE = 100;

    /**
     * Wall-clock limit in milliseconds; 0 disables it.
     */
    public static final long DEFAULT_MAX_COMPUTING_TIME_MILLIS = 0L;

    public static final long DEFAULT_RANDOM_SEED = 123456L;

    // ===================================================================================
    // VELOCITY UPDATE
    // ===================================================================================

    /**
     * Cognitive acceleration coefficient range. c1 is drawn uniformly from
     * [C1_MIN, C1_MAX] once per particle per generation.
     */
    public static final double C1_MIN = 1.5;
    public static final double C1_MAX = 2.5;

    /**
     * Social acceleration coefficient range.
     */
    public static final double C2_MIN = 1.5;
    public static final double C2_MAX = 2.5;

    /**
     * Inertia weight bounds. Equal bounds give a constant weight.
     */
    public static final double MIN_WEIGHT = 0.1;
    public static final double MAX_WEIGHT = 0.1;

    /**
     * Factors applied to a velocity component when its particle hits the
     * lower (1) or upper (2) bound. -1 reverses the component.
     */
    public static final double CHANGE_VELOCITY_1 = -1.0;
    public static final double CHANGE_VELOCITY_2 = -1.0;

    /**
     * Sum of acceleration coefficients above which constriction applies.
     */
    public static final double CONSTRICTION_THRESHOLD = 4.0;
}
