package org.puneet.smpso.unit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.smpso.solution.DominanceComparator;
import org.puneet.smpso.solution.FloatSolution;

import static org.junit.jupiter.api.Assertions.*;

class DominanceComparatorTest {

    private DominanceComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new DominanceComparator();
    }

    private static FloatSolution solution(double... objectives) {
        FloatSolution s = new FloatSolution(1, objectives.length);
        for (int i = 0; i < objectives.length; i++) {
            s.setObjective(i, objectives[i]);
        }
        return s;
    }

    @Test
    void testDominatingSolutionComparesLower() {
        assertEquals(-1, comparator.compare(solution(1.0, 2.0), solution(2.0, 3.0)));
        assertEquals(-1, comparator.compare(solution(1.0, 3.0), solution(2.0, 3.0)));
    }

    @Test
    void testDominatedSolutionComparesHigher() {
        assertEquals(1, comparator.compare(solution(2.0, 3.0), solution(1.0, 2.0)));
    }

    @Test
    void testTradeOffIsIncomparable() {
        assertEquals(0, comparator.compare(solution(1.0, 3.0), solution(2.0, 2.0)));
        assertEquals(0, comparator.compare(solution(2.0, 2.0), solution(1.0, 3.0)));
    }

    @Test
    void testEqualObjectivesAreIncomparable() {
        assertEquals(0, comparator.compare(solution(1.0, 1.0), solution(1.0, 1.0)));
        assertEquals(0, comparator.compare(solution(0.0, 1.0), solution(-0.0, 1.0)));
    }

    @Test
    void testDominatesIsAntisymmetric() {
        FloatSolution a = solution(0.5, 0.5, 0.5);
        FloatSolution b = solution(0.5, 0.6, 0.5);
        assertTrue(comparator.dominates(a, b));
        assertFalse(comparator.dominates(b, a));
        assertFalse(comparator.dominates(a, a));
    }

    @Test
    void testMismatchedObjectiveCountThrows() {
        assertThrows(IllegalArgumentException.class,
            () -> comparator.compare(solution(1.0, 2.0), solution(1.0, 2.0, 3.0)));
    }

    @Test
    void testNullThrows() {
        assertThrows(IllegalArgumentException.class, () -> comparator.compare(null, solution(1.0)));
        assertThrows(IllegalArgumentException.class, () -> comparator.compare(solution(1.0), null));
    }
}
