package org.puneet.smpso.observer;

import java.util.List;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Logs the progress of a run with a progress bar, elapsed time and the mean
 * and spread of each objective over the current swarm.
 *
 * <p>Only every {@code frequency}-th notification is logged. Output goes
 * through the {@code PROGRESS} marker so it can be routed separately.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class ProgressObserver implements Observer {

    private static final Logger logger = LoggerFactory.getLogger(ProgressObserver.class);
    private static final Marker PROGRESS_MARKER = MarkerFactory.getMarker("PROGRESS");

    private static final int BAR_LENGTH = 30;

    private final int maxEvaluations;
    private final int frequency;

    private int notifications;
    private int lastEvaluations;

    /**
     * @param maxEvaluations evaluation budget of the observed run
     * @param frequency log every n-th notification
     * @throws IllegalArgumentException if either argument is not positive
     */
    public ProgressObserver(int maxEvaluations, int frequency) {
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("Max evaluations must be positive, got: " + maxEvaluations);
        }
        if (frequency <= 0) {
            throw new IllegalArgumentException("Frequency must be positive, got: " + frequency);
        }
        this.maxEvaluations = maxEvaluations;
        this.frequency = frequency;
    }

    @Override
    public void update(int evaluations, List<FloatSolution> population, long computingTimeMillis) {
        notifications++;
        lastEvaluations = evaluations;

        if (notifications % frequency != 0 && evaluations < maxEvaluations) {
            return;
        }

        double percentage = getProgress();
        logger.info(PROGRESS_MARKER, "Progress: {}% [{}] Evaluations: {}/{} | Elapsed: {}",
            String.format("%.1f", percentage), createProgressBar(percentage),
            evaluations, maxEvaluations, formatDuration(computingTimeMillis));

        if (!population.isEmpty() && logger.isDebugEnabled()) {
            logger.debug(PROGRESS_MARKER, "  Objectives: {}", summarizeObjectives(population));
        }
    }

    /**
     * Gets the progress of the observed run.
     *
     * @return percentage of the evaluation budget consumed, capped at 100
     */
    public double getProgress() {
        return Math.min(100.0, (double) lastEvaluations / maxEvaluations * 100.0);
    }

    public int getNotificationCount() {
        return notifications;
    }

    /**
     * Formats mean and standard deviation of every objective over the population.
     */
    static String summarizeObjectives(List<FloatSolution> population) {
        int numberOfObjectives = population.get(0).getNumberOfObjectives();
        StringBuilder sb = new StringBuilder();

        for (int m = 0; m < numberOfObjectives; m++) {
            DescriptiveStatistics stats = new DescriptiveStatistics();
            for (FloatSolution solution : population) {
                stats.addValue(solution.getObjective(m));
            }
            if (m > 0) {
                sb.append(", ");
            }
            sb.append(String.format("f%d=%.4f±%.4f", m, stats.getMean(), stats.getStandardDeviation()));
        }
        return sb.toString();
    }

    private static String createProgressBar(double percentage) {
        int filledLength = (int) (BAR_LENGTH * percentage / 100);

        StringBuilder bar = new StringBuilder();
        for (int i = 0; i < BAR_LENGTH; i++) {
            bar.append(i < filledLength ? "█" : "░");
        }
        return bar.toString();
    }

    private static String formatDuration(long milliseconds) {
        long seconds = milliseconds / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds % 60);
        } else if (seconds > 0) {
            return String.format("%ds", seconds);
        } else {
            return String.format("%dms", milliseconds);
        }
    }
}
