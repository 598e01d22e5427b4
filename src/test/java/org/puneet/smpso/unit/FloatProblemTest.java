package org.puneet.smpso.unit;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import org.puneet.smpso.problem.AbstractFloatProblem;
import org.puneet.smpso.problem.ConvexBiObjectiveProblem;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.problem.ZDT1;
import org.puneet.smpso.solution.FloatSolution;

import static org.junit.jupiter.api.Assertions.*;

class FloatProblemTest {

    /** Single-objective test problem with caller-supplied bounds. */
    private static class BoxProblem extends AbstractFloatProblem {
        BoxProblem(double[] lower, double[] upper) {
            super(1, lower, upper);
        }

        @Override
        public String getName() {
            return "Box";
        }

        @Override
        public void evaluate(FloatSolution solution) {
            solution.setObjective(0, solution.getVariable(0));
        }
    }

    @Test
    void testInvertedBoundsThrow() {
        assertThrows(IllegalArgumentException.class,
            () -> new BoxProblem(new double[] {0.0, 2.0}, new double[] {1.0, 1.0}));
    }

    @Test
    void testMalformedBoundsThrow() {
        assertThrows(IllegalArgumentException.class,
            () -> new BoxProblem(new double[] {0.0}, new double[] {1.0, 1.0}));
        assertThrows(IllegalArgumentException.class,
            () -> new BoxProblem(new double[0], new double[0]));
        assertThrows(IllegalArgumentException.class,
            () -> new BoxProblem(new double[] {Double.NEGATIVE_INFINITY}, new double[] {1.0}));
        assertThrows(IllegalArgumentException.class, () -> new ZDT1(0));
    }

    @Test
    void testCreateSolutionWithinBounds() {
        FloatProblem problem = new BoxProblem(new double[] {-5.0, 10.0}, new double[] {5.0, 10.0});
        RandomGenerator random = new MersenneTwister(11L);

        for (int i = 0; i < 100; i++) {
            FloatSolution s = problem.createSolution(random);
            assertEquals(2, s.getNumberOfVariables());
            assertEquals(1, s.getNumberOfObjectives());
            assertFalse(s.isEvaluated());
            assertTrue(s.getVariable(0) >= -5.0 && s.getVariable(0) <= 5.0);
            assertEquals(10.0, s.getVariable(1));
        }
    }

    @Test
    void testConvexBiObjectiveValues() {
        FloatProblem problem = new ConvexBiObjectiveProblem();
        assertEquals(2, problem.getNumberOfVariables());
        assertEquals(2, problem.getNumberOfObjectives());

        FloatSolution origin = new FloatSolution(2, 2);
        problem.evaluate(origin);
        assertEquals(0.0, origin.getObjective(0));
        assertEquals(2.0, origin.getObjective(1));

        FloatSolution corner = new FloatSolution(2, 2);
        corner.setVariable(0, 1.0);
        corner.setVariable(1, 1.0);
        problem.evaluate(corner);
        assertEquals(2.0, corner.getObjective(0));
        assertEquals(0.0, corner.getObjective(1));
        assertTrue(corner.isEvaluated());
    }

    @Test
    void testZdt1Values() {
        ZDT1 problem = new ZDT1();
        assertEquals(ZDT1.DEFAULT_NUMBER_OF_VARIABLES, problem.getNumberOfVariables());
        assertEquals("ZDT1", problem.getName());

        FloatSolution origin = new FloatSolution(30, 2);
        problem.evaluate(origin);
        assertEquals(0.0, origin.getObjective(0));
        assertEquals(1.0, origin.getObjective(1), 1e-12);

        FloatSolution edge = new FloatSolution(30, 2);
        edge.setVariable(0, 1.0);
        problem.evaluate(edge);
        assertEquals(1.0, edge.getObjective(0));
        assertEquals(0.0, edge.getObjective(1), 1e-12);

        FloatSolution worst = new FloatSolution(30, 2);
        for (int i = 0; i < 30; i++) {
            worst.setVariable(i, 1.0);
        }
        problem.evaluate(worst);
        assertEquals(10.0 * (1.0 - Math.sqrt(0.1)), worst.getObjective(1), 1e-9);
    }
}
