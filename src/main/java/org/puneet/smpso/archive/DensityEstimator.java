package org.puneet.smpso.archive;

import java.util.List;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Assigns a diversity score to every member of a solution set. Solutions in
 * sparser regions of objective space receive higher scores.
 *
 * <p>Implementations must not reorder the input list and must be
 * deterministic for a given input.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public interface DensityEstimator {

    /**
     * Computes the density score of each solution.
     *
     * @param solutions solutions sharing one objective-space dimensionality
     * @return scores aligned with the input order
     */
    double[] estimate(List<FloatSolution> solutions);
}
