package org.puneet.smpso.archive;

import java.util.Comparator;

import org.puneet.smpso.solution.FloatSolution;

/**
 * Orders archive members by their density score, less crowded first.
 *
 * <p>{@code compare(a, b)} is negative when {@code a} has the higher score
 * (sparser region), positive when {@code b} has, and zero on equal scores.
 * Both solutions must be member instances of the archive, as returned by
 * {@link BoundedArchive#get} or {@link BoundedArchive#selectTwoForTournament},
 * and its scores must be fresh.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class DensityComparator implements Comparator<FloatSolution> {

    private final BoundedArchive archive;

    DensityComparator(BoundedArchive archive) {
        this.archive = archive;
    }

    @Override
    public int compare(FloatSolution a, FloatSolution b) {
        double densityA = archive.densityOf(a);
        double densityB = archive.densityOf(b);
        return Double.compare(densityB, densityA);
    }
}
