package com.github.micycle1.layeropt.dag;

import java.util.ArrayList;
import java.util.List;

/**
 * Dag: the minimal directed-acyclic-graph contract required by LayerOpt.
 * <p>
 * Conventions:
 * <ul>
 * <li>Node indices are 0..n-1 (0-based).</li>
 * <li>getChildren(v) returns the outgoing edges of v as an ordered list
 * without duplicates and without v itself.</li>
 * <li>Placeholder nodes (inserted by the caller to split long edges) are
 * ordinary nodes of the same dag; LayerOpt does not distinguish them.</li>
 * </ul>
 * <p>
 * Parent lists and roots are derived from the children lists by default.
 * Storage of the per-node layer attribute is optional and defaults to
 * do-nothing implementations.
 */
public interface Dag {

	// ----------------------
	// Core structure (must be implemented)
	// ----------------------

	/** Number of nodes (n). */
	int getNodeCount();

	/** Outgoing neighbours of v, in edge order. */
	List<Integer> getChildren(int v);

	// ----------------------
	// Derived structure (defaults computed from children)
	// ----------------------

	/**
	 * Incoming neighbours of every node; parents of v are listed in increasing
	 * index order of the parent.
	 */
	default List<List<Integer>> getParents() {
		int n = getNodeCount();
		List<List<Integer>> parents = new ArrayList<>(n);
		for (int v = 0; v < n; v++) {
			parents.add(new ArrayList<>());
		}
		for (int v = 0; v < n; v++) {
			for (int c : getChildren(v)) {
				parents.get(c).add(v);
			}
		}
		return parents;
	}

	/** Nodes without parents, in increasing index order. */
	default List<Integer> getRoots() {
		int n = getNodeCount();
		boolean[] hasParent = new boolean[n];
		for (int v = 0; v < n; v++) {
			for (int c : getChildren(v)) {
				hasParent[c] = true;
			}
		}
		List<Integer> roots = new ArrayList<>();
		for (int v = 0; v < n; v++) {
			if (!hasParent[v]) {
				roots.add(v);
			}
		}
		return roots;
	}

	// ----------------------
	// Optional layer attribute (default: not stored)
	// ----------------------

	/** Layer of v, or -1 if not assigned / not stored. Default -1. */
	default int getLayer(int v) {
		return -1;
	}

	/** Set the layer of v: default no-op. */
	default void setLayer(int v, int layer) {
		/* no-op */
	}

	/** True if layers are stored and have been assigned. Default false. */
	default boolean hasLayers() {
		return false;
	}
}
