package com.github.micycle1.layeropt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.layeropt.milp.MilpSolution;
import com.github.micycle1.layeropt.milp.MilpSolver;
import com.github.micycle1.layeropt.milp.MilpSolverException;
import com.github.micycle1.layeropt.milp.OjAlgoMilpSolver;

/**
 * <p>
 * Reorders the nodes of every layer so that the total number of edge crossings
 * between adjacent layers is minimal. The problem is NP-hard; it is solved
 * exactly through {@link CrossingModel} and a {@link MilpSolver}, so run time
 * grows combinatorially with layer sizes.
 * </p>
 *
 * <p>
 * To keep callers from handing it inputs that will not finish, the operator
 * refuses layerings whose sum of squared layer sizes exceeds
 * {@link #DEFAULT_SIZE_LIMIT} unless the size guard is overridden.
 * </p>
 *
 * <p>
 * Instances are immutable; every setter returns a new configured operator:
 * </p>
 *
 * <pre>
 * OptimalDecrosser.create().overrideSizeGuard(true).decross(layering);
 * </pre>
 *
 * <p>
 * The solver call is synchronous and has no timeout.
 * </p>
 */
public final class OptimalDecrosser {

	private static final Logger LOGGER = LoggerFactory.getLogger(OptimalDecrosser.class);

	public static final int DEFAULT_SIZE_LIMIT = 2500;
	public static final int DEFAULT_FALLBACK_DIRECTION = -1;

	private final boolean overrideSizeGuard;
	private final int sizeLimit;
	private final int fallbackDirection;
	private final MilpSolver solver;

	private OptimalDecrosser(boolean overrideSizeGuard, int sizeLimit, int fallbackDirection, MilpSolver solver) {
		this.overrideSizeGuard = overrideSizeGuard;
		this.sizeLimit = sizeLimit;
		this.fallbackDirection = fallbackDirection;
		this.solver = solver;
	}

	/** Default operator: guarded at {@value #DEFAULT_SIZE_LIMIT}, solved with ojAlgo. */
	public static OptimalDecrosser create() {
		return new OptimalDecrosser(false, DEFAULT_SIZE_LIMIT, DEFAULT_FALLBACK_DIRECTION, new OjAlgoMilpSolver());
	}

	/** When true, layerings above the size limit are solved anyway. */
	public OptimalDecrosser overrideSizeGuard(boolean override) {
		return new OptimalDecrosser(override, sizeLimit, fallbackDirection, solver);
	}

	public boolean overrideSizeGuard() {
		return overrideSizeGuard;
	}

	/**
	 * Threshold on the sum of squared layer sizes.
	 *
	 * @throws IllegalArgumentException if negative
	 */
	public OptimalDecrosser sizeLimit(int limit) {
		if (limit < 0) {
			throw new IllegalArgumentException("size limit must be non-negative: " + limit);
		}
		return new OptimalDecrosser(overrideSizeGuard, limit, fallbackDirection, solver);
	}

	public int sizeLimit() {
		return sizeLimit;
	}

	/**
	 * Direction applied to a node pair whose variable has no solved value: -1
	 * swaps the pair relative to its current order, +1 keeps it.
	 *
	 * @throws IllegalArgumentException unless direction is -1 or +1
	 */
	public OptimalDecrosser fallbackDirection(int direction) {
		if (direction != -1 && direction != 1) {
			throw new IllegalArgumentException("fallback direction must be -1 or 1: " + direction);
		}
		return new OptimalDecrosser(overrideSizeGuard, sizeLimit, direction, solver);
	}

	public int fallbackDirection() {
		return fallbackDirection;
	}

	public OptimalDecrosser solver(MilpSolver milpSolver) {
		return new OptimalDecrosser(overrideSizeGuard, sizeLimit, fallbackDirection,
				Objects.requireNonNull(milpSolver, "solver must not be null"));
	}

	public MilpSolver solver() {
		return solver;
	}

	/**
	 * Solves for a crossing-minimal order without modifying the layering.
	 *
	 * @throws IllegalArgumentException if the layering is malformed
	 * @throws DecrossSizeException     if the layering exceeds the size limit and
	 *                                  the guard is not overridden
	 * @throws MilpSolverException      if the solver reports the (always
	 *                                  feasible) model as infeasible or fails
	 */
	public DecrossResult order(Layering layering) {
		final long size = layering.sizeMeasure();
		if (!overrideSizeGuard && size > sizeLimit) {
			throw new DecrossSizeException(size, sizeLimit);
		}
		layering.validate();

		final long before = layering.crossings();

		// TODO solve weakly connected components separately and concatenate their layers
		final CrossingModel cm = CrossingModel.build(layering);
		LOGGER.debug("Built {} for {} layers (size {})", cm, layering.getLayerCount(), size);

		if (cm.getPairVariableCount() == 0) {
			return new DecrossResult(layering.getLayers(), before, before, false);
		}

		final MilpSolution solution = solver.solve(cm.getModel());
		if (!solution.isFeasible()) {
			throw new MilpSolverException("solver reported " + solution.getState() + " for a crossing model, which is always feasible",
					solution.getState());
		}
		if (solution.getState() != MilpSolution.State.OPTIMAL) {
			LOGGER.warn("Solver returned a {} but not proven optimal solution; crossings may not be minimal", solution.getState());
		}

		final List<List<Integer>> orders = reconcile(cm, solution);
		final long after = new Layering(layering.getDag(), orders).crossings();
		LOGGER.debug("Crossings reduced from {} to {}", before, after);
		return new DecrossResult(orders, before, after, true);
	}

	/**
	 * Solves and rewrites the layering's layers in place.
	 *
	 * @see #order(Layering)
	 */
	public DecrossResult decross(Layering layering) {
		DecrossResult result = order(layering);
		result.applyTo(layering);
		return result;
	}

	/**
	 * Builds the solved order of every layer. A node's rank is the number of
	 * layer mates the solution places after it, ties broken by canonical key,
	 * which reproduces the solved order whenever the pair values are
	 * transitive. A layer with any missing pair value is instead sorted by
	 * canonical key scaled by the fallback direction.
	 */
	private List<List<Integer>> reconcile(CrossingModel cm, MilpSolution solution) {
		final NodeOrderingIndex index = cm.getIndex();
		final Comparator<Integer> canonical = index.comparator();
		final List<List<Integer>> orders = new ArrayList<>(cm.getLayering().getLayerCount());
		int missing = 0;
		int fallbackLayers = 0;
		for (List<Integer> layer : cm.getLayering().getLayers()) {
			final Map<Integer, Integer> wins = new HashMap<>();
			int layerMissing = 0;
			for (int a = 0; a < layer.size(); a++) {
				for (int b = a + 1; b < layer.size(); b++) {
					int n1 = layer.get(a);
					int n2 = layer.get(b);
					int k = cm.pairVariable(n1, n2);
					if (!solution.hasValue(k)) {
						layerMissing++;
						continue;
					}
					// value 1 keeps the canonical order of the pair
					boolean keep = solution.getValue(k) >= 0.5;
					int first = (index.compare(n1, n2) < 0) == keep ? n1 : n2;
					wins.merge(first, 1, Integer::sum);
				}
			}

			List<Integer> order = new ArrayList<>(layer);
			if (layerMissing > 0) {
				missing += layerMissing;
				fallbackLayers++;
				order.sort(fallbackDirection > 0 ? canonical : canonical.reversed());
			} else {
				order.sort(Comparator.<Integer>comparingInt(v -> -wins.getOrDefault(v, 0)).thenComparing(canonical));
			}
			orders.add(order);
		}
		if (missing > 0) {
			LOGGER.warn("Solution is missing {} of {} pair variables; {} layers ordered by fallback direction {}", missing,
					cm.getPairVariableCount(), fallbackLayers, fallbackDirection);
		}
		return orders;
	}

	@Override
	public String toString() {
		return "OptimalDecrosser{" + "overrideSizeGuard=" + overrideSizeGuard + ", sizeLimit=" + sizeLimit + ", fallbackDirection="
				+ fallbackDirection + ", solver=" + solver.getClass().getSimpleName() + "}";
	}
}
