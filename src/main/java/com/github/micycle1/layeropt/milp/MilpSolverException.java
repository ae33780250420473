package com.github.micycle1.layeropt.milp;

/**
 * A solver returned a result that contradicts the model it was given, e.g. an
 * infeasible verdict on a model that always admits a solution.
 */
public class MilpSolverException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final MilpSolution.State state;

	public MilpSolverException(String message, MilpSolution.State state) {
		super(message);
		this.state = state;
	}

	public MilpSolution.State getState() {
		return state;
	}
}
