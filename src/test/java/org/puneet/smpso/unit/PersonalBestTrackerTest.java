package org.puneet.smpso.unit;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.smpso.algorithm.PersonalBestTracker;
import org.puneet.smpso.solution.FloatSolution;

import static org.junit.jupiter.api.Assertions.*;

class PersonalBestTrackerTest {

    private PersonalBestTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new PersonalBestTracker();
        tracker.initialize(List.of(solution(1.0, 1.0)));
    }

    private static FloatSolution solution(double f0, double f1) {
        FloatSolution s = new FloatSolution(1, 2);
        s.setVariable(0, f0);
        s.setObjective(0, f0);
        s.setObjective(1, f1);
        return s;
    }

    @Test
    void testInitializeStoresCopies() {
        FloatSolution particle = solution(0.5, 0.5);
        tracker.initialize(List.of(particle));
        particle.setObjective(0, 42.0);

        assertEquals(1, tracker.size());
        assertEquals(0.5, tracker.get(0).getObjective(0));
    }

    @Test
    void testDominatingParticleReplacesBest() {
        assertEquals(1, tracker.update(List.of(solution(0.5, 0.5))));
        assertEquals(0.5, tracker.get(0).getObjective(0));
    }

    @Test
    void testDominatedParticleKeepsBest() {
        assertEquals(0, tracker.update(List.of(solution(2.0, 2.0))));
        assertEquals(1.0, tracker.get(0).getObjective(0));
    }

    @Test
    void testNonDominatedParticleReplacesBest() {
        assertEquals(1, tracker.update(List.of(solution(0.5, 3.0))));
        assertEquals(0.5, tracker.get(0).getObjective(0));
    }

    @Test
    void testEqualParticleReplacesBest() {
        FloatSolution same = solution(1.0, 1.0);
        assertEquals(1, tracker.update(List.of(same)));
        assertNotSame(same, tracker.get(0));
    }

    @Test
    void testStoredBestIsIndependentOfSwarm() {
        FloatSolution particle = solution(0.2, 0.2);
        tracker.update(List.of(particle));
        particle.setVariable(0, 0.9);

        assertEquals(0.2, tracker.get(0).getVariable(0));
    }

    @Test
    void testSizeMismatchThrows() {
        assertThrows(IllegalStateException.class,
            () -> tracker.update(List.of(solution(0.1, 0.1), solution(0.2, 0.2))));
    }
}
