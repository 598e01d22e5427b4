package org.puneet.smpso.unit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.puneet.smpso.observer.DefaultObservable;
import org.puneet.smpso.observer.Observer;
import org.puneet.smpso.observer.ProgressObserver;
import org.puneet.smpso.solution.FloatSolution;

import static org.junit.jupiter.api.Assertions.*;

class ObserverTest {

    private static List<FloatSolution> population() {
        List<FloatSolution> population = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            FloatSolution s = new FloatSolution(1, 2);
            s.setObjective(0, i);
            s.setObjective(1, 3 - i);
            population.add(s);
        }
        return population;
    }

    @Test
    void testNotifyReachesRegisteredObservers() {
        DefaultObservable observable = new DefaultObservable();
        AtomicInteger lastEvaluations = new AtomicInteger();
        observable.register((evaluations, population, time) -> lastEvaluations.set(evaluations));

        observable.notifyAll(300, population(), 10L);

        assertEquals(1, observable.getObserverCount());
        assertEquals(300, lastEvaluations.get());
    }

    @Test
    void testFailingObserverDoesNotStopOthers() {
        DefaultObservable observable = new DefaultObservable();
        AtomicInteger calls = new AtomicInteger();
        observable.register((evaluations, population, time) -> {
            throw new IllegalStateException("observer broke");
        });
        observable.register((evaluations, population, time) -> calls.incrementAndGet());

        assertDoesNotThrow(() -> observable.notifyAll(100, population(), 1L));
        assertDoesNotThrow(() -> observable.notifyAll(200, population(), 2L));
        assertEquals(2, calls.get());
    }

    @Test
    void testDeregister() {
        DefaultObservable observable = new DefaultObservable();
        AtomicInteger calls = new AtomicInteger();
        Observer observer = (evaluations, population, time) -> calls.incrementAndGet();

        observable.register(observer);
        observable.deregister(observer);
        observable.notifyAll(100, population(), 1L);

        assertEquals(0, observable.getObserverCount());
        assertEquals(0, calls.get());
    }

    @Test
    void testRegisterNullThrows() {
        assertThrows(NullPointerException.class, () -> new DefaultObservable().register(null));
    }

    @Test
    void testProgressObserverTracksProgress() {
        ProgressObserver observer = new ProgressObserver(1000, 3);
        assertEquals(0.0, observer.getProgress());

        observer.update(250, population(), 5L);
        observer.update(500, population(), 10L);
        assertEquals(50.0, observer.getProgress(), 1e-9);
        assertEquals(2, observer.getNotificationCount());

        observer.update(1200, population(), 20L);
        assertEquals(100.0, observer.getProgress(), 1e-9);
    }

    @Test
    void testProgressObserverAcceptsEmptyPopulation() {
        ProgressObserver observer = new ProgressObserver(100, 1);
        assertDoesNotThrow(() -> observer.update(100, new ArrayList<>(), 0L));
    }

    @Test
    void testProgressObserverRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ProgressObserver(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ProgressObserver(100, 0));
    }
}
