package com.github.micycle1.layeropt.milp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Solver-neutral mixed-integer linear program. Variables and constraints are
 * addressed by the dense index returned when they are added; infinite bounds
 * mean "unbounded" on that side.
 * <p>
 * The model is a plain container: it performs no presolve and holds no solver
 * state, so one model can be handed to any {@link MilpSolver}.
 */
public final class MilpModel {

	public enum Sense {
		MINIMISE, MAXIMISE
	}

	public static final class Variable {
		public final int index;
		public final double lower;
		public final double upper;
		public final double weight; // objective coefficient
		public final boolean integer;

		Variable(int index, double lower, double upper, double weight, boolean integer) {
			this.index = index;
			this.lower = lower;
			this.upper = upper;
			this.weight = weight;
			this.integer = integer;
		}

		@Override
		public String toString() {
			return "Variable{" + "index=" + index + ", lower=" + lower + ", upper=" + upper + ", weight=" + weight + ", integer="
					+ integer + "}";
		}
	}

	/**
	 * Linear constraint {@code lower <= sum(coef[k] * x[var[k]]) <= upper}.
	 * Coefficients are appended with {@link #set(int, double)}; setting the same
	 * variable twice accumulates.
	 */
	public static final class Constraint {
		public final int index;
		public final double lower;
		public final double upper;
		private int[] vars = new int[4];
		private double[] coefs = new double[4];
		private int size;

		Constraint(int index, double lower, double upper) {
			this.index = index;
			this.lower = lower;
			this.upper = upper;
		}

		public Constraint set(int variable, double coefficient) {
			if (variable < 0) {
				throw new IllegalArgumentException("variable index must be non-negative: " + variable);
			}
			for (int k = 0; k < size; k++) {
				if (vars[k] == variable) {
					coefs[k] += coefficient;
					return this;
				}
			}
			if (size == vars.length) {
				vars = Arrays.copyOf(vars, size * 2);
				coefs = Arrays.copyOf(coefs, size * 2);
			}
			vars[size] = variable;
			coefs[size] = coefficient;
			size++;
			return this;
		}

		public int size() {
			return size;
		}

		public int variableAt(int k) {
			return vars[k];
		}

		public double coefficientAt(int k) {
			return coefs[k];
		}

		/** Left-hand side value for the given assignment. */
		public double evaluate(double[] values) {
			double sum = 0.0;
			for (int k = 0; k < size; k++) {
				sum += coefs[k] * values[vars[k]];
			}
			return sum;
		}
	}

	private final Sense sense;
	private final List<Variable> variables = new ArrayList<>();
	private final List<Constraint> constraints = new ArrayList<>();

	public MilpModel(Sense sense) {
		if (sense == null) {
			throw new IllegalArgumentException("sense must not be null");
		}
		this.sense = sense;
	}

	public Sense getSense() {
		return sense;
	}

	/** Adds a variable and returns its index. */
	public int addVariable(double lower, double upper, double weight, boolean integer) {
		if (lower > upper) {
			throw new IllegalArgumentException("empty variable domain [" + lower + ", " + upper + "]");
		}
		int index = variables.size();
		variables.add(new Variable(index, lower, upper, weight, integer));
		return index;
	}

	/** Adds a 0/1 integer variable and returns its index. */
	public int addBinaryVariable(double weight) {
		return addVariable(0.0, 1.0, weight, true);
	}

	public Constraint addConstraint(double lower, double upper) {
		if (lower > upper) {
			throw new IllegalArgumentException("empty constraint range [" + lower + ", " + upper + "]");
		}
		Constraint c = new Constraint(constraints.size(), lower, upper);
		constraints.add(c);
		return c;
	}

	public Constraint addLowerBound(double lower) {
		return addConstraint(lower, Double.POSITIVE_INFINITY);
	}

	public Constraint addUpperBound(double upper) {
		return addConstraint(Double.NEGATIVE_INFINITY, upper);
	}

	public int getVariableCount() {
		return variables.size();
	}

	public int getConstraintCount() {
		return constraints.size();
	}

	public Variable getVariable(int index) {
		return variables.get(index);
	}

	public Constraint getConstraint(int index) {
		return constraints.get(index);
	}

	public List<Variable> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	public List<Constraint> getConstraints() {
		return Collections.unmodifiableList(constraints);
	}

	/** Objective value of the given assignment (missing entries must not be NaN). */
	public double objective(double[] values) {
		double sum = 0.0;
		for (Variable v : variables) {
			sum += v.weight * values[v.index];
		}
		return sum;
	}

	@Override
	public String toString() {
		return "MilpModel{" + "sense=" + sense + ", variables=" + variables.size() + ", constraints=" + constraints.size() + "}";
	}
}
