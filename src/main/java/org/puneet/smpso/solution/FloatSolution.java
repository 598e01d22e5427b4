package org.puneet.smpso.solution;

import java.util.Arrays;

/**
 * FloatSolution.java
 *
 * Entity class representing a single particle position (solution candidate)
 * of a continuous multi-objective problem. Each instance holds a vector of
 * real-valued decision variables and the objective vector computed for them.
 *
 * <p>All objectives are minimized. Objective values are {@code NaN} until the
 * solution has been evaluated by a problem.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class FloatSolution {

    // ===================================================================================
    // INSTANCE VARIABLES
    // ===================================================================================

    /**
     * Decision variables. Index i is bounded by the owning problem's
     * lower and upper bound for variable i.
     */
    private final double[] variables;

    /**
     * Objective values, lower is better.
     */
    private final double[] objectives;

    // ===================================================================================
    // CONSTRUCTORS
    // ===================================================================================

    /**
     * Creates an unevaluated solution with all variables at zero.
     *
     * @param numberOfVariables number of decision variables
     * @param numberOfObjectives number of objectives
     * @throws IllegalArgumentException if either count is non-positive
     */
    public FloatSolution(int numberOfVariables, int numberOfObjectives) {
        validateDimensions(numberOfVariables, numberOfObjectives);

        this.variables = new double[numberOfVariables];
        this.objectives = new double[numberOfObjectives];
        Arrays.fill(this.objectives, Double.NaN);
    }

    /**
     * Copy constructor for creating deep copies.
     *
     * @param source the solution to copy from
     */
    public FloatSolution(FloatSolution source) {
        this.variables = source.variables.clone();
        this.objectives = source.objectives.clone();
    }

    /**
     * Creates a deep copy of this solution.
     *
     * @return a new FloatSolution with identical state
     */
    public FloatSolution copy() {
        return new FloatSolution(this);
    }

    // ===================================================================================
    // ACCESSORS
    // ===================================================================================

    public double getVariable(int index) {
        return variables[index];
    }

    public void setVariable(int index, double value) {
        variables[index] = value;
    }

    public double getObjective(int index) {
        return objectives[index];
    }

    public void setObjective(int index, double value) {
        objectives[index] = value;
    }

    public int getNumberOfVariables() {
        return variables.length;
    }

    public int getNumberOfObjectives() {
        return objectives.length;
    }

    /**
     * Gets the decision variables.
     *
     * @return defensive copy of the variables array
     */
    public double[] getVariables() {
        return variables.clone();
    }

    /**
     * Gets the objective vector.
     *
     * @return defensive copy of the objectives array
     */
    public double[] getObjectives() {
        return objectives.clone();
    }

    /**
     * Checks whether every objective has been assigned.
     *
     * @return true if no objective is NaN
     */
    public boolean isEvaluated() {
        for (double objective : objectives) {
            if (Double.isNaN(objective)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        FloatSolution that = (FloatSolution) obj;
        return Arrays.equals(variables, that.variables) &&
               Arrays.equals(objectives, that.objectives);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(variables) + Arrays.hashCode(objectives);
    }

    @Override
    public String toString() {
        return String.format("FloatSolution{variables=%s, objectives=%s}",
            Arrays.toString(variables), Arrays.toString(objectives));
    }

    private static void validateDimensions(int numberOfVariables, int numberOfObjectives) {
        if (numberOfVariables <= 0) {
            throw new IllegalArgumentException("Number of variables must be positive");
        }
        if (numberOfObjectives <= 0) {
            throw new IllegalArgumentException("Number of objectives must be positive");
        }
    }
}
