package com.github.micycle1.layeropt.dag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Adjacency-list {@link Dag} with a stored layer attribute. Edges keep their
 * insertion order; adding an edge twice is a no-op.
 * <p>
 * Acyclicity is not checked here. Layering rejects cyclic input.
 */
public class AdjacencyDag implements Dag {

	protected final List<List<Integer>> children;
	protected final int[] layers;

	public AdjacencyDag(int nodeCount) {
		if (nodeCount < 0) {
			throw new IllegalArgumentException("nodeCount must be non-negative: " + nodeCount);
		}
		children = new ArrayList<>(nodeCount);
		for (int v = 0; v < nodeCount; v++) {
			children.add(new ArrayList<>());
		}
		layers = new int[nodeCount];
		Arrays.fill(layers, -1);
	}

	/**
	 * Convenience: builds a dag of {@code nodeCount} nodes from {from, to} pairs.
	 */
	public static AdjacencyDag of(int nodeCount, int[]... edges) {
		AdjacencyDag dag = new AdjacencyDag(nodeCount);
		for (int[] e : edges) {
			if (e.length != 2) {
				throw new IllegalArgumentException("edge must be a {from, to} pair: " + Arrays.toString(e));
			}
			dag.addEdge(e[0], e[1]);
		}
		return dag;
	}

	public AdjacencyDag addEdge(int from, int to) {
		checkIndex(from);
		checkIndex(to);
		if (from == to) {
			throw new IllegalArgumentException("self loop on node " + from);
		}
		List<Integer> out = children.get(from);
		if (!out.contains(to)) {
			out.add(to);
		}
		return this;
	}

	@Override
	public int getNodeCount() {
		return children.size();
	}

	@Override
	public List<Integer> getChildren(int v) {
		checkIndex(v);
		return Collections.unmodifiableList(children.get(v));
	}

	@Override
	public int getLayer(int v) {
		checkIndex(v);
		return layers[v];
	}

	@Override
	public void setLayer(int v, int layer) {
		checkIndex(v);
		if (layer < 0) {
			throw new IllegalArgumentException("layer must be non-negative: " + layer);
		}
		layers[v] = layer;
	}

	@Override
	public boolean hasLayers() {
		for (int l : layers) {
			if (l < 0) {
				return false;
			}
		}
		return true;
	}

	private void checkIndex(int v) {
		if (v < 0 || v >= children.size()) {
			throw new IllegalArgumentException("node index out of range: " + v);
		}
	}
}
