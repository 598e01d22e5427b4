package org.puneet.smpso.observer;

import java.util.List;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Source of progress notifications.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public interface Observable {

    void register(Observer observer);

    void deregister(Observer observer);

    /**
     * Delivers a notification to every registered observer. Must not throw
     * because of a failing observer.
     */
    void notifyAll(int evaluations, List<FloatSolution> population, long computingTimeMillis);

    int getObserverCount();
}
