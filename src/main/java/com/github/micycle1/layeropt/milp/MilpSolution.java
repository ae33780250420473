package com.github.micycle1.layeropt.milp;

import java.util.Arrays;

/**
 * Result of a {@link MilpSolver} call. Values are indexed like the model's
 * variables; a variable the solver did not report holds {@code NaN}.
 */
public final class MilpSolution {

	public enum State {
		OPTIMAL, FEASIBLE, INFEASIBLE, UNBOUNDED, FAILED;

		public boolean isFeasible() {
			return this == OPTIMAL || this == FEASIBLE;
		}
	}

	private final State state;
	private final double objective;
	private final double[] values;

	public MilpSolution(State state, double objective, double[] values) {
		if (state == null) {
			throw new IllegalArgumentException("state must not be null");
		}
		this.state = state;
		this.objective = objective;
		this.values = values != null ? values.clone() : new double[0];
	}

	/** A solution without any variable values. */
	public static MilpSolution of(State state) {
		return new MilpSolution(state, Double.NaN, null);
	}

	public State getState() {
		return state;
	}

	public boolean isFeasible() {
		return state.isFeasible();
	}

	public double getObjective() {
		return objective;
	}

	public int size() {
		return values.length;
	}

	public boolean hasValue(int variable) {
		return variable >= 0 && variable < values.length && !Double.isNaN(values[variable]);
	}

	/** Solved value, or NaN when the solver did not report one. */
	public double getValue(int variable) {
		return hasValue(variable) ? values[variable] : Double.NaN;
	}

	@Override
	public String toString() {
		return "MilpSolution{" + "state=" + state + ", objective=" + objective + ", values=" + Arrays.toString(values) + "}";
	}
}
