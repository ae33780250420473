package com.github.micycle1.layeropt;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Canonical key {@code (layer, position)} for every node of a layering,
 * captured when the index is built. Later reordering of the layers does not
 * change the keys.
 */
public final class NodeOrderingIndex {

	private final int[] layerOf;
	private final int[] positionOf;

	NodeOrderingIndex(List<List<Integer>> layers, int nodeCount) {
		layerOf = new int[nodeCount];
		positionOf = new int[nodeCount];
		Arrays.fill(layerOf, -1);
		Arrays.fill(positionOf, -1);
		for (int i = 0; i < layers.size(); i++) {
			List<Integer> layer = layers.get(i);
			for (int j = 0; j < layer.size(); j++) {
				int v = layer.get(j);
				layerOf[v] = i;
				positionOf[v] = j;
			}
		}
	}

	public static NodeOrderingIndex of(Layering layering) {
		return new NodeOrderingIndex(layering.getLayers(), layering.getDag().getNodeCount());
	}

	public int layerOf(int v) {
		return layerOf[v];
	}

	public int positionOf(int v) {
		return positionOf[v];
	}

	/** -1, 0 or +1 comparing canonical keys. */
	public int compare(int a, int b) {
		int c = Integer.compare(layerOf[a], layerOf[b]);
		if (c == 0) {
			c = Integer.compare(positionOf[a], positionOf[b]);
		}
		return Integer.signum(c);
	}

	public Comparator<Integer> comparator() {
		return this::compare;
	}
}
