package org.puneet.smpso.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.smpso.archive.BoundedArchive;
import org.puneet.smpso.archive.CrowdingDistance;
import org.puneet.smpso.evaluator.Evaluator;
import org.puneet.smpso.evaluator.SequentialEvaluator;
import org.puneet.smpso.observer.DefaultObservable;
import org.puneet.smpso.observer.Observable;
import org.puneet.smpso.operator.MutationOperator;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Speed-constrained Multi-objective Particle Swarm Optimization.
 *
 * <p>
 * SMPSO approximates the Pareto front of a box-bounded continuous problem
 * with a swarm whose velocities are damped by a constriction coefficient and
 * clamped to half the range of each variable. Global guides come from a
 * bounded archive of non-dominated leaders pruned by crowding distance; each
 * particle also remembers its own best position. After every move each
 * particle is perturbed by a mutation operator before re-evaluation.
 * </p>
 *
 * <p>
 * One generation:
 * velocity update, position update, mutation, evaluation, personal best
 * update, leader archive update, density recomputation, progress
 * notification. The run stops once the evaluation counter reaches
 * {@code maxEvaluations}, or when the optional wall-clock limit expires.
 * The result is the final content of the leader archive.
 * </p>
 *
 * <p>
 * All randomness comes from the injected {@link RandomGenerator}, so a run is
 * reproducible for a given seed when evaluation is sequential.
 * </p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public class SMPSO extends ParticleSwarmOptimization<FloatSolution, List<FloatSolution>> {

    private static final Logger logger = LoggerFactory.getLogger(SMPSO.class);

    private final FloatProblem problem;
    private final SmpsoParameters parameters;
    private final MutationOperator mutation;
    private final BoundedArchive leaders;
    private final Evaluator evaluator;
    private final Observable observable;
    private final RandomGenerator random;

    private final VelocityUpdater velocityUpdater;
    private final PositionUpdater positionUpdater;
    private final PersonalBestTracker personalBests;
    private final InertiaWeightSchedule inertiaWeight;

    private int evaluations;

    /**
     * Creates an SMPSO instance with a crowding distance archive sized from
     * the parameters, sequential evaluation, no observers, and a Mersenne
     * Twister seeded from the parameters.
     *
     * @param problem the problem to solve
     * @param parameters the algorithm parameters, copied
     * @param mutation the perturbation operator
     */
    public SMPSO(FloatProblem problem, SmpsoParameters parameters, MutationOperator mutation) {
        this(problem, parameters, mutation,
             new BoundedArchive(parameters.getArchiveSize(), new CrowdingDistance()),
             new SequentialEvaluator(), new DefaultObservable(),
             new MersenneTwister(parameters.getSeed()));
    }

    /**
     * Creates an SMPSO instance with explicit collaborators.
     *
     * @param problem the problem to solve
     * @param parameters the algorithm parameters, copied
     * @param mutation the perturbation operator
     * @param leaders an empty leader archive; its capacity bounds the result size
     * @param evaluator the swarm evaluator
     * @param observable receives a notification after every generation
     * @param random the random source for every stochastic step
     * @throws NullPointerException if any argument is null
     * @throws IllegalArgumentException if the parameters are inconsistent or
     *         the archive is not empty
     */
    public SMPSO(FloatProblem problem, SmpsoParameters parameters, MutationOperator mutation,
                 BoundedArchive leaders, Evaluator evaluator, Observable observable,
                 RandomGenerator random) {
        this.problem = Objects.requireNonNull(problem, "Problem cannot be null");
        this.parameters = Objects.requireNonNull(parameters, "Parameters cannot be null").copy();
        this.mutation = Objects.requireNonNull(mutation, "Mutation cannot be null");
        this.leaders = Objects.requireNonNull(leaders, "Leader archive cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.observable = Objects.requireNonNull(observable, "Observable cannot be null");
        this.random = Objects.requireNonNull(random, "Random generator cannot be null");

        this.parameters.validate();
        if (!leaders.isEmpty()) {
            throw new IllegalArgumentException("Leader archive must be empty, contains " + leaders.size());
        }

        this.velocityUpdater = new VelocityUpdater(problem, this.parameters, random);
        this.positionUpdater = new PositionUpdater(problem,
            this.parameters.getChangeVelocity1(), this.parameters.getChangeVelocity2());
        this.personalBests = new PersonalBestTracker();
        this.inertiaWeight = new InertiaWeightSchedule(
            this.parameters.getMinWeight(), this.parameters.getMaxWeight(), this.parameters.getMaxEvaluations());

        logger.info("Initialized SMPSO for {} with parameters: {}", problem.getName(), this.parameters);
    }

    @Override
    protected List<FloatSolution> createInitialSwarm() {
        List<FloatSolution> swarm = new ArrayList<>(parameters.getSwarmSize());
        for (int i = 0; i < parameters.getSwarmSize(); i++) {
            swarm.add(problem.createSolution(random));
        }
        return swarm;
    }

    @Override
    protected List<FloatSolution> evaluateSwarm(List<FloatSolution> swarm) {
        List<FloatSolution> evaluated = evaluator.evaluate(swarm, problem);
        if (evaluated.size() != swarm.size()) {
            throw new IllegalStateException(
                String.format("Evaluator returned %d solutions for a swarm of %d", evaluated.size(), swarm.size()));
        }
        return evaluated;
    }

    @Override
    protected void initializeVelocity(List<FloatSolution> swarm) {
        // VelocityUpdater starts from a zeroed matrix
    }

    @Override
    protected void initializeParticleBest(List<FloatSolution> swarm) {
        personalBests.initialize(swarm);
    }

    @Override
    protected void initializeGlobalBest(List<FloatSolution> swarm) {
        for (FloatSolution particle : swarm) {
            leaders.add(particle);
        }
    }

    @Override
    protected void initProgress() {
        evaluations = parameters.getSwarmSize();
        leaders.computeDensityEstimator();

        logger.debug("Initial swarm evaluated, {} leaders", leaders.size());
    }

    @Override
    protected boolean isStoppingConditionReached() {
        if (evaluations >= parameters.getMaxEvaluations()) {
            return true;
        }
        long limit = parameters.getMaxComputingTimeMillis();
        if (limit > 0 && getCurrentComputingTime() >= limit) {
            logger.warn("Computing time limit of {} ms reached after {} evaluations", limit, evaluations);
            return true;
        }
        return false;
    }

    @Override
    protected void updateVelocity(List<FloatSolution> swarm) {
        velocityUpdater.update(swarm, personalBests, leaders, inertiaWeight.weightAt(evaluations));
    }

    @Override
    protected void updatePosition(List<FloatSolution> swarm) {
        positionUpdater.update(swarm, velocityUpdater);
    }

    @Override
    protected void perturbation(List<FloatSolution> swarm) {
        for (FloatSolution particle : swarm) {
            mutation.execute(particle);
        }
    }

    @Override
    protected void updateParticleBest(List<FloatSolution> swarm) {
        personalBests.update(swarm);
    }

    @Override
    protected void updateGlobalBest(List<FloatSolution> swarm) {
        for (FloatSolution particle : swarm) {
            leaders.add(particle);
        }
    }

    @Override
    protected void updateProgress() {
        evaluations += parameters.getSwarmSize();
        leaders.computeDensityEstimator();

        logger.debug("Evaluations: {}, leaders: {}", evaluations, leaders.size());

        observable.notifyAll(evaluations, snapshot(getSwarm()), getCurrentComputingTime());
    }

    private static List<FloatSolution> snapshot(List<FloatSolution> swarm) {
        List<FloatSolution> copy = new ArrayList<>(swarm.size());
        for (FloatSolution particle : swarm) {
            copy.add(particle.copy());
        }
        return copy;
    }

    /**
     * Gets the Pareto front approximation.
     *
     * @return copies of the leader archive members
     */
    @Override
    public List<FloatSolution> getResult() {
        return snapshot(leaders.getSolutionList());
    }

    @Override
    public String getName() {
        return "SMPSO";
    }

    public int getEvaluations() {
        return evaluations;
    }

    public BoundedArchive getLeaders() {
        return leaders;
    }

    public Observable getObservable() {
        return observable;
    }

    /**
     * @return a copy of the parameters this instance runs with
     */
    public SmpsoParameters getParameters() {
        return parameters.copy();
    }
}
