package com.github.micycle1.layeropt;

import java.util.ArrayList;
import java.util.List;

import com.github.micycle1.layeropt.dag.Dag;

/**
 * Output of {@link CoffmanGrahamLayering#assign(Dag)}: one layer index per node
 * index. Nothing is written to the dag until {@link #writeBack(Dag)} is called.
 */
public final class LayerAssignment {

	private final int[] layerOf;
	private final int layerCount;
	private final int maxWidth;

	LayerAssignment(int[] layerOf, int maxWidth) {
		this.layerOf = layerOf;
		this.maxWidth = maxWidth;
		int max = -1;
		for (int l : layerOf) {
			max = Math.max(max, l);
		}
		this.layerCount = max + 1;
	}

	public int getNodeCount() {
		return layerOf.length;
	}

	public int getLayer(int v) {
		return layerOf[v];
	}

	public int getLayerCount() {
		return layerCount;
	}

	/** The effective width budget (resolved from 0 when the layering ran in auto mode). */
	public int getMaxWidth() {
		return maxWidth;
	}

	/** Nodes grouped by layer; within a layer nodes appear in increasing index order. */
	public List<List<Integer>> getLayers() {
		List<List<Integer>> layers = new ArrayList<>(layerCount);
		for (int i = 0; i < layerCount; i++) {
			layers.add(new ArrayList<>());
		}
		for (int v = 0; v < layerOf.length; v++) {
			layers.get(layerOf[v]).add(v);
		}
		return layers;
	}

	/**
	 * Writes every node's layer into the dag's layer attribute.
	 *
	 * @throws IllegalArgumentException if the dag has a different node count
	 */
	public void writeBack(Dag dag) {
		if (dag.getNodeCount() != layerOf.length) {
			throw new IllegalArgumentException("assignment covers " + layerOf.length + " nodes but dag has " + dag.getNodeCount());
		}
		for (int v = 0; v < layerOf.length; v++) {
			dag.setLayer(v, layerOf[v]);
		}
	}
}
