package com.github.micycle1.layeropt;

import java.util.List;

import com.github.micycle1.layeropt.dag.Dag;
import com.github.micycle1.layeropt.milp.MilpModel;

/**
 * <p>
 * Integer program whose optimum is a within-layer order with the fewest edge
 * crossings (the linear-ordering formulation).
 * </p>
 *
 * <p>
 * Variables:
 * </p>
 * <ul>
 * <li>one 0/1 pair variable for every unordered pair of nodes in a layer;
 * value 1 means the node with the smaller canonical key goes first. Pair
 * variables of a layer occupy one contiguous triangular block, so
 * {@link #pairVariable(int, int)} is pure index arithmetic.</li>
 * <li>one continuous slack per (parent pair, child pair) combination between
 * adjacent layers, forced to 1 when the two pairs are ordered differently.
 * The objective is the sum of slacks.</li>
 * </ul>
 *
 * <p>
 * Constraints:
 * </p>
 * <ul>
 * <li>transitivity: {@code 0 <= x(a,b) - x(a,c) + x(b,c) <= 1} for every
 * canonical triple {@code a < b < c} of a layer, written as two rows;</li>
 * <li>crossing: with {@code s = compare(c1, c2)} and {@code f = max(s, 0)},
 * {@code x(p1,p2) + s*x(c1,c2) + slack >= f} and
 * {@code -x(p1,p2) - s*x(c1,c2) + slack >= -f}.</li>
 * </ul>
 *
 * <p>
 * The model is always feasible: every total order satisfies the transitivity
 * rows, and slack is unbounded above.
 * </p>
 */
public final class CrossingModel {

	private final Layering layering;
	private final NodeOrderingIndex index;
	private final MilpModel model;

	// first pair variable of each layer's triangular block
	private final int[] pairBase;
	private int pairCount;
	private int slackCount;
	private int transitivityCount;

	private CrossingModel(Layering layering) {
		this.layering = layering;
		this.index = NodeOrderingIndex.of(layering);
		this.model = new MilpModel(MilpModel.Sense.MINIMISE);
		this.pairBase = new int[layering.getLayerCount()];
	}

	/**
	 * Builds the model for the current order of the layering. The layering is
	 * read, never modified; it is expected to be valid (see
	 * {@link Layering#validate()}).
	 */
	public static CrossingModel build(Layering layering) {
		CrossingModel cm = new CrossingModel(layering);
		// all pair variables first so their indices form the triangular blocks
		for (int i = 0; i < layering.getLayerCount(); i++) {
			cm.addPairVariables(i);
		}
		for (int i = 0; i < layering.getLayerCount(); i++) {
			cm.addTransitivity(i);
		}
		for (int i = 0; i + 1 < layering.getLayerCount(); i++) {
			cm.addCrossings(i);
		}
		return cm;
	}

	private void addPairVariables(int layer) {
		pairBase[layer] = model.getVariableCount();
		int m = layering.getLayer(layer).size();
		for (int k = 0; k < m * (m - 1) / 2; k++) {
			model.addBinaryVariable(0.0);
			pairCount++;
		}
	}

	private void addTransitivity(int layer) {
		List<Integer> nodes = layering.getLayer(layer);
		int m = nodes.size();
		for (int a = 0; a < m - 2; a++) {
			for (int b = a + 1; b < m - 1; b++) {
				for (int c = b + 1; c < m; c++) {
					int ab = pairIndex(layer, a, b, m);
					int ac = pairIndex(layer, a, c, m);
					int bc = pairIndex(layer, b, c, m);

					model.addUpperBound(1.0).set(ab, 1.0).set(ac, -1.0).set(bc, 1.0);
					model.addLowerBound(0.0).set(ab, 1.0).set(ac, -1.0).set(bc, 1.0);
					transitivityCount += 2;
				}
			}
		}
	}

	private void addCrossings(int layer) {
		final Dag dag = layering.getDag();
		final List<Integer> nodes = layering.getLayer(layer);
		final int m = nodes.size();
		for (int a = 0; a < m - 1; a++) {
			final int p1 = nodes.get(a);
			for (int b = a + 1; b < m; b++) {
				final int p2 = nodes.get(b);
				final int pairP = pairIndex(layer, a, b, m);
				for (int c1 : dag.getChildren(p1)) {
					for (int c2 : dag.getChildren(p2)) {
						if (c1 == c2) {
							continue; // shared child, edges never cross
						}
						final int pairC = pairVariable(c1, c2);
						final int sign = index.compare(c1, c2);
						final int flip = Math.max(sign, 0);

						final int slack = model.addVariable(0.0, Double.POSITIVE_INFINITY, 1.0, false);
						slackCount++;

						model.addLowerBound(flip).set(pairP, 1.0).set(pairC, sign).set(slack, 1.0);
						model.addLowerBound(-flip).set(pairP, -1.0).set(pairC, -sign).set(slack, 1.0);
					}
				}
			}
		}
	}

	/**
	 * Index of the pair variable for two distinct nodes of the same layer, in
	 * either argument order.
	 *
	 * @throws IllegalArgumentException if the nodes are equal or in different
	 *                                  layers
	 */
	public int pairVariable(int u, int v) {
		int layer = index.layerOf(u);
		if (u == v || layer < 0 || layer != index.layerOf(v)) {
			throw new IllegalArgumentException("no pair variable for nodes " + u + " and " + v);
		}
		int i = index.positionOf(u);
		int j = index.positionOf(v);
		if (i > j) {
			int tmp = i;
			i = j;
			j = tmp;
		}
		return pairIndex(layer, i, j, layering.getLayer(layer).size());
	}

	// position i < j within a layer of size m
	private int pairIndex(int layer, int i, int j, int m) {
		return pairBase[layer] + i * (2 * m - i - 1) / 2 + (j - i - 1);
	}

	public MilpModel getModel() {
		return model;
	}

	public NodeOrderingIndex getIndex() {
		return index;
	}

	public Layering getLayering() {
		return layering;
	}

	public int getPairVariableCount() {
		return pairCount;
	}

	public int getSlackVariableCount() {
		return slackCount;
	}

	public int getTransitivityConstraintCount() {
		return transitivityCount;
	}

	@Override
	public String toString() {
		return "CrossingModel{" + "pairs=" + pairCount + ", slacks=" + slackCount + ", transitivity=" + transitivityCount + "}";
	}
}
