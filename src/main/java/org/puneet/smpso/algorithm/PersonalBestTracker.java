package org.puneet.smpso.algorithm;

import java.util.ArrayList;
import java.util.List;

import org.puneet.smpso.solution.DominanceComparator;
import org.puneet.smpso.solution.FloatSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the best position each particle has visited.
 *
 * <p>The stored best of particle i is replaced by a copy of the current
 * particle unless the current particle is dominated by it. Mutually
 * non-dominated positions therefore replace the stored one, favouring the
 * newer position.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public class PersonalBestTracker {

    private static final Logger logger = LoggerFactory.getLogger(PersonalBestTracker.class);

    private final DominanceComparator dominanceComparator;
    private final List<FloatSolution> bests;

    public PersonalBestTracker() {
        this.dominanceComparator = new DominanceComparator();
        this.bests = new ArrayList<>();
    }

    /**
     * Seeds the tracker with a copy of every particle.
     *
     * @param swarm the evaluated initial swarm
     */
    public void initialize(List<FloatSolution> swarm) {
        bests.clear();
        for (FloatSolution particle : swarm) {
            bests.add(particle.copy());
        }
    }

    /**
     * Compares every evaluated particle with its stored best.
     *
     * @param swarm the evaluated swarm, same size and order as at initialization
     * @return number of personal bests replaced
     */
    public int update(List<FloatSolution> swarm) {
        if (swarm.size() != bests.size()) {
            throw new IllegalStateException(
                String.format("Swarm size %d does not match tracked size %d", swarm.size(), bests.size()));
        }

        int replaced = 0;
        for (int i = 0; i < swarm.size(); i++) {
            int flag = dominanceComparator.compare(swarm.get(i), bests.get(i));
            if (flag != 1) {
                bests.set(i, swarm.get(i).copy());
                replaced++;
            }
        }

        logger.trace("Replaced {} of {} personal bests", replaced, swarm.size());
        return replaced;
    }

    public FloatSolution get(int index) {
        return bests.get(index);
    }

    public int size() {
        return bests.size();
    }
}
