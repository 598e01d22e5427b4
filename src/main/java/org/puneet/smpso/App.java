package org.puneet.smpso;

import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.smpso.algorithm.SMPSO;
import org.puneet.smpso.algorithm.SmpsoParameters;
import org.puneet.smpso.archive.BoundedArchive;
import org.puneet.smpso.archive.CrowdingDistance;
import org.puneet.smpso.evaluator.Evaluator;
import org.puneet.smpso.evaluator.ParallelEvaluator;
import org.puneet.smpso.evaluator.SequentialEvaluator;
import org.puneet.smpso.exceptions.SwarmOptimizationException;
import org.puneet.smpso.observer.DefaultObservable;
import org.puneet.smpso.observer.ProgressObserver;
import org.puneet.smpso.operator.PolynomialMutation;
import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;
import org.puneet.smpso.util.FrontWriter;
import org.puneet.smpso.util.SmpsoConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: runs SMPSO on the configured problem and writes
 * the resulting front to CSV.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        logger.info("Starting SMPSO runner");

        try {
            String resource = args.length > 0 ? args[0] : SmpsoConfigLoader.DEFAULT_CONFIG_FILE;
            SmpsoConfigLoader config = new SmpsoConfigLoader(resource);

            List<FloatSolution> front = run(config);
            new FrontWriter().write(front, config.getOutputFile());

        } catch (SwarmOptimizationException e) {
            logger.error("SMPSO run failed: {}", e.getMessage(), e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Critical error in application execution", e);
            System.exit(1);
        }
    }

    /**
     * Builds an SMPSO instance from the configuration and runs it.
     *
     * @return the leader archive content at termination
     * @throws SwarmOptimizationException if the configuration is invalid
     */
    public static List<FloatSolution> run(SmpsoConfigLoader config) throws SwarmOptimizationException {
        SmpsoParameters parameters = config.loadParameters();
        FloatProblem problem = config.createProblem();
        int threads = config.getEvaluatorThreads();

        RandomGenerator random = new MersenneTwister(parameters.getSeed());
        PolynomialMutation mutation = new PolynomialMutation(problem, random);

        DefaultObservable observable = new DefaultObservable();
        observable.register(new ProgressObserver(parameters.getMaxEvaluations(), config.getProgressFrequency()));

        logger.info("Solving {} with {} variables, {} evaluator thread(s)",
            problem.getName(), problem.getNumberOfVariables(), threads);

        if (threads > 1) {
            try (ParallelEvaluator evaluator = new ParallelEvaluator(threads)) {
                return execute(problem, parameters, mutation, evaluator, observable, random);
            }
        }
        return execute(problem, parameters, mutation, new SequentialEvaluator(), observable, random);
    }

    private static List<FloatSolution> execute(FloatProblem problem, SmpsoParameters parameters,
                                               PolynomialMutation mutation, Evaluator evaluator,
                                               DefaultObservable observable, RandomGenerator random) {
        SMPSO algorithm = new SMPSO(problem, parameters, mutation,
            new BoundedArchive(parameters.getArchiveSize(), new CrowdingDistance()),
            evaluator, observable, random);

        algorithm.run();

        List<FloatSolution> front = algorithm.getResult();
        logger.info("{} finished after {} evaluations in {} ms, front size: {}",
            algorithm.getName(), algorithm.getEvaluations(), algorithm.getCurrentComputingTime(), front.size());
        return front;
    }
}
