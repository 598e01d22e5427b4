package org.puneet.smpso.archive;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Crowding distance density estimator.
 *
 * <p>For each objective the solutions are ordered by value; the two extremes
 * receive {@link Double#POSITIVE_INFINITY} and each interior solution
 * accumulates the normalized distance between its two neighbours:</p>
 * <pre>
 * crowding[i] += (f(next) - f(prev)) / (f(max) - f(min))
 * </pre>
 *
 * <p>Sets of one or two solutions are all extremes. An objective whose values
 * are all equal contributes nothing. Ordering uses a stable sort on an index
 * array so the caller's list is never touched and repeated calls on the same
 * set give identical scores.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class CrowdingDistance implements DensityEstimator {

    private static final Logger logger = LoggerFactory.getLogger(CrowdingDistance.class);

    @Override
    public double[] estimate(List<FloatSolution> solutions) {
        int size = solutions.size();
        double[] distance = new double[size];

        if (size == 0) {
            return distance;
        }
        if (size <= 2) {
            Arrays.fill(distance, Double.POSITIVE_INFINITY);
            return distance;
        }

        int numberOfObjectives = solutions.get(0).getNumberOfObjectives();

        for (int objective = 0; objective < numberOfObjectives; objective++) {
            final int m = objective;
            Integer[] order = new Integer[size];
            for (int i = 0; i < size; i++) {
                order[i] = i;
            }
            Arrays.sort(order, Comparator.comparingDouble(i -> solutions.get(i).getObjective(m)));

            double min = solutions.get(order[0]).getObjective(m);
            double max = solutions.get(order[size - 1]).getObjective(m);

            distance[order[0]] = Double.POSITIVE_INFINITY;
            distance[order[size - 1]] = Double.POSITIVE_INFINITY;

            double range = max - min;
            if (range <= 0.0) {
                continue;
            }

            for (int k = 1; k < size - 1; k++) {
                int index = order[k];
                double previous = solutions.get(order[k - 1]).getObjective(m);
                double next = solutions.get(order[k + 1]).getObjective(m);
                distance[index] += (next - previous) / range;
            }
        }

        logger.trace("Computed crowding distance for {} solutions", size);
        return distance;
    }
}
