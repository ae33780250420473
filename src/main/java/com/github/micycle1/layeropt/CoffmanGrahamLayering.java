package com.github.micycle1.layeropt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.layeropt.dag.Dag;

/**
 * <p>
 * Coffman-Graham style layer assignment: every node gets a layer such that each
 * edge points from a smaller to a strictly larger layer and no layer holds more
 * than a fixed number of nodes. Packing is greedy, which can produce tall
 * drawings, but it runs in O(V log V + E).
 * </p>
 *
 * <p>
 * Nodes are scheduled by a priority queue keyed on "readiness": the dequeue
 * ranks of a node's parents, sorted latest first. A node is only enqueued once
 * all its parents have been placed. The dequeued node goes on the current layer
 * if that layer still has width budget and none of its parents sit on it;
 * otherwise a new layer is opened.
 * </p>
 *
 * <p>
 * Instances are immutable. Create one with {@link #create()} and derive
 * configured copies with {@link #width(int)}:
 * </p>
 *
 * <pre>
 * LayerAssignment layers = CoffmanGrahamLayering.create().width(3).assign(dag);
 * layers.writeBack(dag);
 * </pre>
 */
public final class CoffmanGrahamLayering {

	private static final Logger LOGGER = LoggerFactory.getLogger(CoffmanGrahamLayering.class);

	/** Width value meaning "use the rounded square root of the node count". */
	public static final int AUTO_WIDTH = 0;

	private final int width;

	private CoffmanGrahamLayering(int width) {
		this.width = width;
	}

	/** Default operator with automatic width. */
	public static CoffmanGrahamLayering create() {
		return new CoffmanGrahamLayering(AUTO_WIDTH);
	}

	/**
	 * Returns an operator with the given maximum layer width; 0 selects the
	 * automatic width.
	 *
	 * @throws IllegalArgumentException if {@code maxWidth} is negative
	 */
	public CoffmanGrahamLayering width(int maxWidth) {
		if (maxWidth < 0) {
			throw new IllegalArgumentException("width must be non-negative: " + maxWidth);
		}
		return new CoffmanGrahamLayering(maxWidth);
	}

	/** Configured maximum width (0 = automatic). */
	public int width() {
		return width;
	}

	/** Effective width for a dag of n nodes. */
	static int effectiveWidth(int configured, int n) {
		return configured != AUTO_WIDTH ? configured : (int) Math.round(Math.sqrt(n));
	}

	/**
	 * Computes a layer for every node of the dag. The dag is not modified.
	 *
	 * @throws IllegalArgumentException if the graph contains a cycle
	 */
	public LayerAssignment assign(Dag dag) {
		final int n = dag.getNodeCount();
		final int maxWidth = effectiveWidth(width, n);

		final List<List<Integer>> parents = dag.getParents();
		// dequeue ranks of processed parents; sorted latest-first once complete
		final List<List<Integer>> before = new ArrayList<>(n);
		for (int v = 0; v < n; v++) {
			before.add(new ArrayList<>(parents.get(v).size()));
		}

		final int[] layerOf = new int[n];
		final PriorityQueue<Integer> queue = new PriorityQueue<>(Math.max(1, n), readinessOrder(before));
		queue.addAll(dag.getRoots());

		int rank = 0; // global dequeue index
		int layer = 0;
		int used = 0; // width used on the current layer
		while (!queue.isEmpty()) {
			final int node = queue.poll();
			if (used < maxWidth && parentsBelow(parents.get(node), layerOf, layer)) {
				layerOf[node] = layer;
				used++;
			} else {
				layerOf[node] = ++layer;
				used = 1;
			}
			for (int child : dag.getChildren(node)) {
				List<Integer> ready = before.get(child);
				ready.add(rank);
				if (ready.size() == parents.get(child).size()) {
					ready.sort(Comparator.reverseOrder());
					queue.add(child);
				}
			}
			rank++;
		}

		if (rank < n) {
			throw new IllegalArgumentException("graph contains a cycle: only " + rank + " of " + n + " nodes could be layered");
		}

		LOGGER.debug("Layered {} nodes into {} layers (max width {})", n, n == 0 ? 0 : layer + 1, maxWidth);
		return new LayerAssignment(layerOf, maxWidth);
	}

	/**
	 * Assigns layers and writes them into the dag's layer attribute.
	 */
	public LayerAssignment layer(Dag dag) {
		LayerAssignment assignment = assign(dag);
		assignment.writeBack(dag);
		return assignment;
	}

	private static boolean parentsBelow(List<Integer> parents, int[] layerOf, int layer) {
		for (int p : parents) {
			if (layerOf[p] >= layer) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Lexicographic order on readiness lists. Where one list runs out first the
	 * shorter list wins; identical lists fall back to node index.
	 */
	static Comparator<Integer> readinessOrder(List<List<Integer>> before) {
		return (a, b) -> {
			int c = compareReadiness(before.get(a), before.get(b));
			return c != 0 ? c : Integer.compare(a, b);
		};
	}

	static int compareReadiness(List<Integer> left, List<Integer> right) {
		int common = Math.min(left.size(), right.size());
		for (int i = 0; i < common; i++) {
			int c = Integer.compare(left.get(i), right.get(i));
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(left.size(), right.size());
	}

	@Override
	public String toString() {
		return "CoffmanGrahamLayering{width=" + width + "}";
	}
}
