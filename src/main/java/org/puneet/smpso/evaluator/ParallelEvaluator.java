package org.puneet.smpso.evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.puneet.smpso.problem.FloatProblem;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the particles of a swarm concurrently on a fixed thread pool.
 *
 * <p>Every particle is submitted as its own task and the call returns only
 * after all of them have completed, so the caller never observes a partially
 * evaluated swarm. Solutions are evaluated in place and the input list is
 * returned, which keeps the original order.</p>
 *
 * <p>The first failure is rethrown to the caller unchanged when it is
 * unchecked; anything else is wrapped in an {@link IllegalStateException}.
 * The problem's {@code evaluate} method must be safe to call from several
 * threads on distinct solutions.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class ParallelEvaluator implements Evaluator, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ParallelEvaluator.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ExecutorService executorService;
    private final int threadCount;

    /**
     * Creates an evaluator with one thread per available processor.
     */
    public ParallelEvaluator() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param threadCount number of worker threads
     * @throws IllegalArgumentException if threadCount is not positive
     */
    public ParallelEvaluator(int threadCount) {
        if (threadCount <= 0) {
            throw new IllegalArgumentException("Thread count must be positive, got: " + threadCount);
        }
        this.threadCount = threadCount;

        AtomicInteger threadIndex = new AtomicInteger();
        this.executorService = Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "SwarmEvaluator-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("Initialized ParallelEvaluator with {} threads", threadCount);
    }

    @Override
    public List<FloatSolution> evaluate(List<FloatSolution> swarm, FloatProblem problem) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(swarm.size());

        for (FloatSolution solution : swarm) {
            futures.add(CompletableFuture.runAsync(() -> problem.evaluate(solution), executorService));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Parallel evaluation of {} solutions failed: {}", swarm.size(), cause.getMessage());
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Parallel evaluation failed", cause);
        }

        logger.trace("Evaluated {} solutions on {} threads", swarm.size(), threadCount);
        return swarm;
    }

    public int getThreadCount() {
        return threadCount;
    }

    /**
     * Shuts down the worker pool, waiting for running evaluations to finish.
     */
    @Override
    public void close() {
        logger.info("Shutting down ParallelEvaluator thread pool");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
