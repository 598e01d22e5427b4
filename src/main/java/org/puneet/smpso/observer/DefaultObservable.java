package org.puneet.smpso.observer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observable that calls its observers synchronously in registration order.
 * An exception thrown by one observer is logged and does not prevent the
 * remaining observers, or the optimization loop, from continuing.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class DefaultObservable implements Observable {

    private static final Logger logger = LoggerFactory.getLogger(DefaultObservable.class);

    private final List<Observer> observers = new CopyOnWriteArrayList<>();

    @Override
    public void register(Observer observer) {
        observers.add(Objects.requireNonNull(observer, "Observer cannot be null"));
        logger.debug("Registered observer {}", observer.getClass().getSimpleName());
    }

    @Override
    public void deregister(Observer observer) {
        observers.remove(observer);
    }

    @Override
    public void notifyAll(int evaluations, List<FloatSolution> population, long computingTimeMillis) {
        for (Observer observer : observers) {
            try {
                observer.update(evaluations, population, computingTimeMillis);
            } catch (RuntimeException e) {
                logger.warn("Observer {} failed at {} evaluations: {}",
                    observer.getClass().getSimpleName(), evaluations, e.getMessage(), e);
            }
        }
    }

    @Override
    public int getObserverCount() {
        return observers.size();
    }
}
