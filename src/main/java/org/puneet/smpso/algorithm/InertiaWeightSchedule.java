package org.puneet.smpso.algorithm;

/**
 * Inertia weight that decreases linearly from {@code maxWeight} at the start
 * of a run to {@code minWeight} when the evaluation budget is spent. Equal
 * bounds give a constant weight.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class InertiaWeightSchedule {

    private final double minWeight;
    private final double maxWeight;
    private final int maxEvaluations;

    /**
     * @throws IllegalArgumentException if minWeight exceeds maxWeight or the budget is not positive
     */
    public InertiaWeightSchedule(double minWeight, double maxWeight, int maxEvaluations) {
        if (minWeight > maxWeight) {
            throw new IllegalArgumentException(
                String.format("minWeight (%.4f) must not exceed maxWeight (%.4f)", minWeight, maxWeight));
        }
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("Max evaluations must be positive, got: " + maxEvaluations);
        }
        this.minWeight = minWeight;
        this.maxWeight = maxWeight;
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * @param evaluations evaluations performed so far
     * @return the inertia weight for the next velocity update
     */
    public double weightAt(int evaluations) {
        if (minWeight == maxWeight) {
            return maxWeight;
        }
        double progress = Math.min(1.0, Math.max(0.0, (double) evaluations / maxEvaluations));
        return maxWeight - (maxWeight - minWeight) * progress;
    }

    public double getMinWeight() {
        return minWeight;
    }

    public double getMaxWeight() {
        return maxWeight;
    }
}
