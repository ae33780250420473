package com.github.micycle1.layeropt.milp;

import java.math.BigDecimal;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MilpSolver} backed by ojAlgo's {@link ExpressionsBasedModel} (simplex
 * relaxations with built-in branch &amp; bound for integer variables).
 * <p>
 * A fresh ojAlgo model is built per call; no state survives between calls so a
 * single instance may be shared.
 */
public final class OjAlgoMilpSolver implements MilpSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(OjAlgoMilpSolver.class);

	private static final double OBJECTIVE_TOLERANCE = 1e-6;

	@Override
	public MilpSolution solve(MilpModel model) {
		int varCount = model.getVariableCount();
		if (varCount == 0) {
			// nothing to decide; ojAlgo is not asked about empty models
			return new MilpSolution(MilpSolution.State.OPTIMAL, 0.0, new double[0]);
		}

		ExpressionsBasedModel ebm = new ExpressionsBasedModel();

		Variable[] vars = new Variable[varCount];
		for (MilpModel.Variable v : model.getVariables()) {
			Variable x = ebm.newVariable("x" + v.index);
			if (Double.isFinite(v.lower)) {
				x.lower(v.lower);
			}
			if (Double.isFinite(v.upper)) {
				x.upper(v.upper);
			}
			if (v.weight != 0.0) {
				x.weight(v.weight);
			}
			if (v.integer) {
				x.integer(true);
			}
			vars[v.index] = x;
		}

		for (MilpModel.Constraint c : model.getConstraints()) {
			Expression e = ebm.newExpression("c" + c.index);
			if (Double.isFinite(c.lower)) {
				e.lower(c.lower);
			}
			if (Double.isFinite(c.upper)) {
				e.upper(c.upper);
			}
			for (int k = 0; k < c.size(); k++) {
				e.set(vars[c.variableAt(k)], c.coefficientAt(k));
			}
		}

		LOGGER.debug("Solving ojAlgo model: {} variables, {} constraints", varCount, model.getConstraintCount());

		final Optimisation.Result result = model.getSense() == MilpModel.Sense.MINIMISE ? ebm.minimise() : ebm.maximise();
		final MilpSolution.State state = translate(result.getState());

		LOGGER.debug("ojAlgo finished with state {} (objective {})", result.getState(), result.getValue());

		if (!state.isFeasible()) {
			return MilpSolution.of(state);
		}

		double[] values = new double[varCount];
		boolean complete = true;
		for (int i = 0; i < varCount; i++) {
			BigDecimal value = result.get(i);
			values[i] = value != null ? value.doubleValue() : Double.NaN;
			complete &= value != null;
		}
		if (complete) {
			double recomputed = model.objective(values);
			if (Math.abs(recomputed - result.getValue()) > OBJECTIVE_TOLERANCE * Math.max(1.0, Math.abs(recomputed))) {
				LOGGER.warn("ojAlgo reported objective {} but the returned values give {}", result.getValue(), recomputed);
			}
		}
		return new MilpSolution(state, result.getValue(), values);
	}

	static MilpSolution.State translate(Optimisation.State state) {
		if (state == Optimisation.State.INFEASIBLE) {
			return MilpSolution.State.INFEASIBLE;
		}
		if (state == Optimisation.State.UNBOUNDED) {
			return MilpSolution.State.UNBOUNDED;
		}
		if (state.isOptimal()) {
			return MilpSolution.State.OPTIMAL;
		}
		if (state.isFeasible()) {
			return MilpSolution.State.FEASIBLE;
		}
		return MilpSolution.State.FAILED;
	}
}
