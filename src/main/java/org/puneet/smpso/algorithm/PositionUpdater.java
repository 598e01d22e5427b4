package org.puneet.smpso.algorithm;

import java.util.List;
import java.util.Objects;

import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves every particle by its velocity and repairs bound violations.
 *
 * <p>A variable that leaves its range is set to the violated bound and its
 * velocity component is multiplied by {@code changeVelocity1} (lower bound)
 * or {@code changeVelocity2} (upper bound).</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public class PositionUpdater {

    private static final Logger logger = LoggerFactory.getLogger(PositionUpdater.class);

    private final FloatProblem problem;
    private final double changeVelocity1;
    private final double changeVelocity2;

    public PositionUpdater(FloatProblem problem, double changeVelocity1, double changeVelocity2) {
        this.problem = Objects.requireNonNull(problem, "Problem cannot be null");
        this.changeVelocity1 = changeVelocity1;
        this.changeVelocity2 = changeVelocity2;
    }

    /**
     * @param swarm particles to move in place
     * @param velocity velocity matrix, adjusted in place on bound hits
     */
    public void update(List<FloatSolution> swarm, VelocityUpdater velocity) {
        int repairs = 0;

        for (int i = 0; i < swarm.size(); i++) {
            FloatSolution particle = swarm.get(i);

            for (int j = 0; j < particle.getNumberOfVariables(); j++) {
                double value = particle.getVariable(j) + velocity.getVelocity(i, j);

                if (value < problem.getLowerBound(j)) {
                    value = problem.getLowerBound(j);
                    velocity.setVelocity(i, j, velocity.getVelocity(i, j) * changeVelocity1);
                    repairs++;
                } else if (value > problem.getUpperBound(j)) {
                    value = problem.getUpperBound(j);
                    velocity.setVelocity(i, j, velocity.getVelocity(i, j) * changeVelocity2);
                    repairs++;
                }

                particle.setVariable(j, value);
            }
        }

        logger.trace("Updated positions of {} particles, {} bound repairs", swarm.size(), repairs);
    }
}
