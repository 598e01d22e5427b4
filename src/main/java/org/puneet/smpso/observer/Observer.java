package org.puneet.smpso.observer;

import java.util.List;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Receives progress notifications from a running optimization.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public interface Observer {

    /**
     * @param evaluations objective evaluations performed so far
     * @param population snapshot of the current swarm
     * @param computingTimeMillis elapsed run time in milliseconds
     */
    void update(int evaluations, List<FloatSolution> population, long computingTimeMillis);
}
