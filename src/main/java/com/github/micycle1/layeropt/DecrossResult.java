package com.github.micycle1.layeropt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of {@link OptimalDecrosser#order(Layering)}: the solved node order of
 * every layer, plus crossing counts before and after. Nothing is written to
 * the layering until {@link #applyTo(Layering)}.
 */
public final class DecrossResult {

	private final List<List<Integer>> orders;
	private final long crossingsBefore;
	private final long crossingsAfter;
	private final boolean solved;

	DecrossResult(List<List<Integer>> orders, long crossingsBefore, long crossingsAfter, boolean solved) {
		List<List<Integer>> copy = new ArrayList<>(orders.size());
		for (List<Integer> order : orders) {
			copy.add(Collections.unmodifiableList(new ArrayList<>(order)));
		}
		this.orders = Collections.unmodifiableList(copy);
		this.crossingsBefore = crossingsBefore;
		this.crossingsAfter = crossingsAfter;
		this.solved = solved;
	}

	public List<List<Integer>> getOrders() {
		return orders;
	}

	public List<Integer> getOrder(int layer) {
		return orders.get(layer);
	}

	public long getCrossingsBefore() {
		return crossingsBefore;
	}

	public long getCrossingsAfter() {
		return crossingsAfter;
	}

	/** False when there was nothing to decide and the solver was not called. */
	public boolean isSolved() {
		return solved;
	}

	/**
	 * Rewrites each of the layering's layer lists in place with the solved order.
	 *
	 * @throws IllegalArgumentException if a layer is not a permutation of the
	 *                                  solved order (e.g. the layering changed
	 *                                  since it was solved) or does not support
	 *                                  {@code set}; no layer is modified in
	 *                                  that case
	 */
	public void applyTo(Layering layering) {
		List<List<Integer>> layers = layering.getLayers();
		if (layers.size() != orders.size()) {
			throw new IllegalArgumentException("layering has " + layers.size() + " layers, result has " + orders.size());
		}
		for (int i = 0; i < layers.size(); i++) {
			List<Integer> layer = layers.get(i);
			List<Integer> order = orders.get(i);
			Set<Integer> expected = new HashSet<>(order);
			if (layer.size() != order.size() || !expected.equals(new HashSet<>(layer))) {
				throw new IllegalArgumentException("layer " + i + " " + layer + " is not a permutation of " + order);
			}
			if (!layer.isEmpty()) {
				try {
					layer.set(0, layer.get(0));
				} catch (UnsupportedOperationException e) {
					throw new IllegalArgumentException("layer " + i + " " + layer + " cannot be modified in place", e);
				}
			}
		}
		for (int i = 0; i < layers.size(); i++) {
			List<Integer> layer = layers.get(i);
			List<Integer> order = orders.get(i);
			for (int j = 0; j < order.size(); j++) {
				layer.set(j, order.get(j));
			}
		}
	}

	@Override
	public String toString() {
		return "DecrossResult{" + "orders=" + orders + ", crossingsBefore=" + crossingsBefore + ", crossingsAfter=" + crossingsAfter
				+ "}";
	}
}
