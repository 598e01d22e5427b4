package org.puneet.smpso.archive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.smpso.solution.DominanceComparator;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity-bounded archive of mutually non-dominated solutions (the leaders
 * of the swarm).
 *
 * <p>Membership is maintained by Pareto dominance: a candidate dominated by
 * any member is rejected, and members dominated by an accepted candidate are
 * removed. When an insertion pushes the archive over capacity, the member
 * with the lowest density score (the most crowded one) is evicted; on equal
 * scores the first one in archive order goes.</p>
 *
 * <p>Density scores are kept in an array parallel to the member list. Any
 * change of membership marks the scores stale, and reading a stale score is
 * an error: callers must invoke {@link #computeDensityEstimator()} after the
 * last {@link #add} and before any density-based selection.</p>
 *
 * <p>Members are independent copies of the solutions passed to
 * {@link #add}, so later changes to swarm particles never leak into the
 * archive.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class BoundedArchive {

    private static final Logger logger = LoggerFactory.getLogger(BoundedArchive.class);

    private final int capacity;
    private final DensityEstimator densityEstimator;
    private final DominanceComparator dominanceComparator;
    private final DensityComparator densityComparator;

    private final List<FloatSolution> members;
    private double[] densityScores;
    private boolean densityStale;

    /**
     * Creates an empty archive.
     *
     * @param capacity maximum number of members
     * @param densityEstimator estimator used for eviction and selection
     * @throws IllegalArgumentException if capacity is not positive
     * @throws NullPointerException if densityEstimator is null
     */
    public BoundedArchive(int capacity, DensityEstimator densityEstimator) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Archive capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.densityEstimator = Objects.requireNonNull(densityEstimator, "Density estimator cannot be null");
        this.dominanceComparator = new DominanceComparator();
        this.densityComparator = new DensityComparator(this);
        this.members = new ArrayList<>(capacity + 1);
        this.densityScores = new double[0];
        this.densityStale = false;

        logger.debug("Created BoundedArchive with capacity {}", capacity);
    }

    /**
     * Offers a solution to the archive.
     *
     * @param solution the candidate, copied before insertion
     * @return true if the candidate is a member after the call
     */
    public boolean add(FloatSolution solution) {
        Objects.requireNonNull(solution, "Solution cannot be null");
        FloatSolution candidate = solution.copy();

        Iterator<FloatSolution> iterator = members.iterator();
        int removed = 0;
        while (iterator.hasNext()) {
            FloatSolution member = iterator.next();
            int flag = dominanceComparator.compare(candidate, member);
            if (flag > 0) {
                // A dominating member can never coexist with a member the
                // candidate dominates, so nothing has been removed yet.
                logger.trace("Candidate rejected, dominated by archive member");
                return false;
            }
            if (flag < 0) {
                iterator.remove();
                removed++;
            }
        }

        members.add(candidate);
        densityStale = true;

        if (removed > 0) {
            logger.trace("Candidate accepted, {} dominated members removed", removed);
        }

        if (members.size() > capacity) {
            FloatSolution evicted = evictMostCrowded();
            return evicted != candidate;
        }
        return true;
    }

    /**
     * Removes the member with the lowest density score.
     *
     * @return the evicted member
     */
    private FloatSolution evictMostCrowded() {
        computeDensityEstimator();

        int worst = 0;
        for (int i = 1; i < members.size(); i++) {
            if (densityScores[i] < densityScores[worst]) {
                worst = i;
            }
        }

        FloatSolution evicted = members.remove(worst);
        densityStale = true;

        logger.trace("Archive over capacity, evicted member {} with density {}", worst, densityScores[worst]);
        return evicted;
    }

    /**
     * Recomputes the density score of every member.
     */
    public void computeDensityEstimator() {
        densityScores = densityEstimator.estimate(members);
        densityStale = false;
    }

    /**
     * Gets the density score of the member at the given position.
     *
     * @param index member position
     * @return density score, higher means less crowded
     * @throws IllegalStateException if membership changed since the last computation
     */
    public double getDensity(int index) {
        if (densityStale) {
            throw new IllegalStateException(
                "Density scores are stale; call computeDensityEstimator() after adding solutions");
        }
        return densityScores[index];
    }

    /**
     * Looks a member up by reference and returns its density score. Equal
     * duplicates are distinct members with their own scores.
     */
    double densityOf(FloatSolution solution) {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i) == solution) {
                return getDensity(i);
            }
        }
        throw new IllegalArgumentException("Solution is not an archive member");
    }

    /**
     * Draws two distinct members uniformly at random without replacement.
     * An archive holding a single member returns that member in both slots.
     *
     * @param random random source
     * @return array of two members
     * @throws IllegalStateException if the archive is empty
     */
    public FloatSolution[] selectTwoForTournament(RandomGenerator random) {
        if (members.isEmpty()) {
            throw new IllegalStateException("Cannot select from an empty archive");
        }
        if (members.size() == 1) {
            return new FloatSolution[] {members.get(0), members.get(0)};
        }

        int first = random.nextInt(members.size());
        int second = random.nextInt(members.size() - 1);
        if (second >= first) {
            second++;
        }
        return new FloatSolution[] {members.get(first), members.get(second)};
    }

    /**
     * Comparator ranking members by density, less crowded first.
     */
    public DensityComparator getComparator() {
        return densityComparator;
    }

    /**
     * Read-only view of the current members in archive order.
     */
    public List<FloatSolution> getSolutionList() {
        return Collections.unmodifiableList(members);
    }

    public FloatSolution get(int index) {
        return members.get(index);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return String.format("BoundedArchive{size=%d, capacity=%d}", members.size(), capacity);
    }
}
