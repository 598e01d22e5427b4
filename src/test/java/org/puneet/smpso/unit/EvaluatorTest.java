package org.puneet.smpso.unit;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.smpso.evaluator.ParallelEvaluator;
import org.puneet.smpso.evaluator.SequentialEvaluator;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.problem.ZDT1;
import org.puneet.smpso.solution.FloatSolution;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private FloatProblem problem;
    private List<FloatSolution> swarm;

    @BeforeEach
    void setUp() {
        problem = new ZDT1(8);
        RandomGenerator random = new MersenneTwister(5L);
        swarm = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            swarm.add(problem.createSolution(random));
        }
    }

    private static List<FloatSolution> copies(List<FloatSolution> solutions) {
        List<FloatSolution> copy = new ArrayList<>();
        for (FloatSolution s : solutions) {
            copy.add(s.copy());
        }
        return copy;
    }

    @Test
    void testSequentialEvaluatesEverySolutionInPlace() {
        List<FloatSolution> result = new SequentialEvaluator().evaluate(swarm, problem);

        assertSame(swarm, result);
        for (FloatSolution s : result) {
            assertTrue(s.isEvaluated());
        }
    }

    @Test
    void testParallelMatchesSequential() {
        List<FloatSolution> sequential = new SequentialEvaluator().evaluate(copies(swarm), problem);

        List<FloatSolution> parallel;
        try (ParallelEvaluator evaluator = new ParallelEvaluator(4)) {
            assertEquals(4, evaluator.getThreadCount());
            parallel = evaluator.evaluate(copies(swarm), problem);
        }

        assertEquals(sequential.size(), parallel.size());
        for (int i = 0; i < sequential.size(); i++) {
            assertEquals(sequential.get(i), parallel.get(i), "Order or values differ at " + i);
        }
    }

    @Test
    void testParallelPropagatesRuntimeFailure() {
        FloatProblem failing = new ZDT1(8) {
            @Override
            public void evaluate(FloatSolution solution) {
                throw new IllegalStateException("evaluation failed");
            }
        };

        try (ParallelEvaluator evaluator = new ParallelEvaluator(2)) {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> evaluator.evaluate(swarm, failing));
            assertEquals("evaluation failed", e.getMessage());
        }
    }

    @Test
    void testSequentialPropagatesFailure() {
        FloatProblem failing = new ZDT1(8) {
            @Override
            public void evaluate(FloatSolution solution) {
                throw new ArithmeticException("bad objective");
            }
        };

        assertThrows(ArithmeticException.class, () -> new SequentialEvaluator().evaluate(swarm, failing));
    }

    @Test
    void testNonPositiveThreadCountThrows() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelEvaluator(0));
    }
}
