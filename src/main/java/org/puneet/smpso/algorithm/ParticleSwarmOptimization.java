package org.puneet.smpso.algorithm;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template of a particle swarm optimizer. {@link #run()} fixes the order of
 * the steps; subclasses supply them.
 *
 * <pre>
 * swarm = createInitialSwarm()
 * swarm = evaluateSwarm(swarm)
 * initializeVelocity, initializeParticleBest, initializeGlobalBest, initProgress
 * while (!isStoppingConditionReached()):
 *     updateVelocity, updatePosition, perturbation
 *     swarm = evaluateSwarm(swarm)
 *     updateParticleBest, updateGlobalBest, updateProgress
 * </pre>
 *
 * <p>An instance runs once. It moves through
 * {@code UNINITIALIZED -> INITIALIZED -> RUNNING -> TERMINATED}.</p>
 *
 * @param <S> solution type
 * @param <R> result type
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public abstract class ParticleSwarmOptimization<S, R> {

    private static final Logger logger = LoggerFactory.getLogger(ParticleSwarmOptimization.class);

    /**
     * Lifecycle of a run.
     */
    public enum State {
        UNINITIALIZED,
        INITIALIZED,
        RUNNING,
        TERMINATED
    }

    private List<S> swarm;
    private State state = State.UNINITIALIZED;
    private long startTime;

    protected abstract List<S> createInitialSwarm();

    protected abstract List<S> evaluateSwarm(List<S> swarm);

    protected abstract void initializeVelocity(List<S> swarm);

    protected abstract void initializeParticleBest(List<S> swarm);

    protected abstract void initializeGlobalBest(List<S> swarm);

    protected abstract void initProgress();

    protected abstract boolean isStoppingConditionReached();

    protected abstract void updateVelocity(List<S> swarm);

    protected abstract void updatePosition(List<S> swarm);

    protected abstract void perturbation(List<S> swarm);

    protected abstract void updateParticleBest(List<S> swarm);

    protected abstract void updateGlobalBest(List<S> swarm);

    protected abstract void updateProgress();

    public abstract R getResult();

    public abstract String getName();

    /**
     * Runs the optimization to completion.
     *
     * @throws IllegalStateException if this instance has already been run
     */
    public void run() {
        if (state != State.UNINITIALIZED) {
            throw new IllegalStateException(getName() + " can only be run once, current state: " + state);
        }

        startTime = System.currentTimeMillis();
        logger.info("Starting {}", getName());

        swarm = createInitialSwarm();
        swarm = evaluateSwarm(swarm);
        initializeVelocity(swarm);
        initializeParticleBest(swarm);
        initializeGlobalBest(swarm);
        initProgress();
        state = State.INITIALIZED;

        while (!isStoppingConditionReached()) {
            state = State.RUNNING;
            updateVelocity(swarm);
            updatePosition(swarm);
            perturbation(swarm);
            swarm = evaluateSwarm(swarm);
            updateParticleBest(swarm);
            updateGlobalBest(swarm);
            updateProgress();
        }
        state = State.TERMINATED;

        logger.info("{} finished in {} ms", getName(), getCurrentComputingTime());
    }

    /**
     * @return milliseconds elapsed since {@link #run()} started, 0 before
     */
    public long getCurrentComputingTime() {
        return startTime == 0 ? 0 : System.currentTimeMillis() - startTime;
    }

    public State getState() {
        return state;
    }

    protected List<S> getSwarm() {
        return swarm;
    }
}
