package com.github.micycle1.layeropt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.github.micycle1.layeropt.dag.Dag;

/**
 * An ordered sequence of layers over the nodes of a {@link Dag}. The layer
 * lists are owned by the caller and are reordered in place by
 * {@link DecrossResult#applyTo(Layering)}; they must therefore be mutable.
 * <p>
 * A well-formed layering covers every dag node exactly once and every edge
 * connects layer {@code i} to layer {@code i + 1}, i.e. long edges have already
 * been split with placeholder nodes. See {@link #validate()}.
 */
public final class Layering {

	private final Dag dag;
	private final List<List<Integer>> layers;

	public Layering(Dag dag, List<List<Integer>> layers) {
		this.dag = Objects.requireNonNull(dag, "dag must not be null");
		this.layers = Objects.requireNonNull(layers, "layers must not be null");
	}

	/** Fresh mutable layers built from an assignment. */
	public static Layering fromAssignment(Dag dag, LayerAssignment assignment) {
		return new Layering(dag, assignment.getLayers());
	}

	public Dag getDag() {
		return dag;
	}

	/** The caller-owned layer lists (not a copy). */
	public List<List<Integer>> getLayers() {
		return layers;
	}

	public List<Integer> getLayer(int i) {
		return layers.get(i);
	}

	public int getLayerCount() {
		return layers.size();
	}

	/** Sum over layers of (layer size)^2; grows like the pair variable count. */
	public long sizeMeasure() {
		long total = 0;
		for (List<Integer> layer : layers) {
			total += (long) layer.size() * layer.size();
		}
		return total;
	}

	/**
	 * Checks that every dag node appears exactly once and that every edge spans
	 * exactly one layer downwards.
	 *
	 * @throws IllegalArgumentException describing the first violation found
	 */
	public void validate() {
		final int n = dag.getNodeCount();
		final int[] layerOf = new int[n];
		Arrays.fill(layerOf, -1);
		int seen = 0;
		for (int i = 0; i < layers.size(); i++) {
			for (Integer v : layers.get(i)) {
				if (v == null || v < 0 || v >= n) {
					throw new IllegalArgumentException("layer " + i + " holds an unknown node: " + v);
				}
				if (layerOf[v] >= 0) {
					throw new IllegalArgumentException("node " + v + " appears more than once (layers " + layerOf[v] + " and " + i + ")");
				}
				layerOf[v] = i;
				seen++;
			}
		}
		if (seen != n) {
			throw new IllegalArgumentException("layering covers " + seen + " of " + n + " nodes");
		}
		for (int v = 0; v < n; v++) {
			for (int c : dag.getChildren(v)) {
				if (layerOf[c] != layerOf[v] + 1) {
					throw new IllegalArgumentException(
							"edge " + v + " -> " + c + " spans layers " + layerOf[v] + " -> " + layerOf[c] + "; expected adjacent layers");
				}
			}
		}
	}

	/** Total number of crossings between all adjacent layer pairs. */
	public long crossings() {
		long total = 0;
		for (int i = 0; i + 1 < layers.size(); i++) {
			total += crossings(i);
		}
		return total;
	}

	/**
	 * Number of crossings between layer i and layer i+1: pairs of edges with
	 * distinct sources and distinct targets whose orders disagree. Edges to
	 * nodes outside layer i+1 are ignored. Counted with a Fenwick tree over
	 * target positions, so dense layer pairs stay cheap.
	 */
	public long crossings(int i) {
		final List<Integer> upper = layers.get(i);
		final List<Integer> lower = layers.get(i + 1);
		final int[] pos = new int[dag.getNodeCount()];
		Arrays.fill(pos, -1);
		for (int k = 0; k < lower.size(); k++) {
			pos[lower.get(k)] = k;
		}

		final long[] tree = new long[lower.size() + 1];
		final List<Integer> targets = new ArrayList<>();
		long inserted = 0;
		long count = 0;
		for (int source : upper) {
			targets.clear();
			for (int c : dag.getChildren(source)) {
				if (pos[c] >= 0) {
					targets.add(pos[c]);
				}
			}
			// earlier sources' edges landing strictly right of each target
			for (int t : targets) {
				count += inserted - prefixCount(tree, t);
			}
			for (int t : targets) {
				for (int k = t + 1; k < tree.length; k += k & -k) {
					tree[k]++;
				}
				inserted++;
			}
		}
		return count;
	}

	// number of inserted targets at positions <= t
	private static long prefixCount(long[] tree, int t) {
		long sum = 0;
		for (int k = t + 1; k > 0; k -= k & -k) {
			sum += tree[k];
		}
		return sum;
	}

	@Override
	public String toString() {
		return "Layering" + layers;
	}
}
