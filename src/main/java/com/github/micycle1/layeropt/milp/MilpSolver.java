package com.github.micycle1.layeropt.milp;

/**
 * <p>
 * Narrow seam to a mixed-integer linear programming back end. Implementations
 * translate a {@link MilpModel} into their own representation, solve it
 * synchronously and report one value per model variable.
 * </p>
 * <p>
 * Implementations should not throw for infeasible or unbounded models; they
 * report it through {@link MilpSolution#getState()} and leave the decision to
 * the caller.
 * </p>
 */
public interface MilpSolver {
	MilpSolution solve(MilpModel model);
}
