package com.github.micycle1.layeropt.dag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class AdjacencyDagTest {

	@Test
	public void testChildrenKeepOrderWithoutDuplicates() {
		AdjacencyDag dag = AdjacencyDag.of(4, new int[] { 0, 2 }, new int[] { 0, 1 }, new int[] { 0, 2 }, new int[] { 1, 3 });
		assertEquals(List.of(2, 1), dag.getChildren(0));
		assertEquals(List.of(3), dag.getChildren(1));
		assertEquals(List.of(), dag.getChildren(3));
	}

	@Test
	public void testDerivedParentsAndRoots() {
		// square: 0 -> 1, 0 -> 2, 1 -> 3, 2 -> 3, plus isolated 4
		AdjacencyDag dag = AdjacencyDag.of(5, new int[] { 0, 1 }, new int[] { 0, 2 }, new int[] { 1, 3 }, new int[] { 2, 3 });
		List<List<Integer>> parents = dag.getParents();
		assertEquals(List.of(), parents.get(0));
		assertEquals(List.of(0), parents.get(1));
		assertEquals(List.of(1, 2), parents.get(3));
		assertEquals(List.of(0, 4), dag.getRoots());
	}

	@Test
	public void testLayerAttribute() {
		AdjacencyDag dag = AdjacencyDag.of(2, new int[] { 0, 1 });
		assertEquals(-1, dag.getLayer(0));
		assertFalse(dag.hasLayers());
		dag.setLayer(0, 0);
		dag.setLayer(1, 1);
		assertTrue(dag.hasLayers());
		assertEquals(1, dag.getLayer(1));
		assertThrows(IllegalArgumentException.class, () -> dag.setLayer(0, -2));
	}

	@Test
	public void testRejectsBadEdges() {
		AdjacencyDag dag = new AdjacencyDag(3);
		assertThrows(IllegalArgumentException.class, () -> dag.addEdge(1, 1));
		assertThrows(IllegalArgumentException.class, () -> dag.addEdge(0, 3));
		assertThrows(IllegalArgumentException.class, () -> dag.addEdge(-1, 0));
		assertThrows(IllegalArgumentException.class, () -> AdjacencyDag.of(2, new int[] { 0 }));
		assertThrows(IllegalArgumentException.class, () -> new AdjacencyDag(-1));
	}

	@Test
	public void testDefaultLayerMethodsAreNoOps() {
		Dag minimal = new Dag() {
			@Override
			public int getNodeCount() {
				return 2;
			}

			@Override
			public List<Integer> getChildren(int v) {
				return v == 0 ? List.of(1) : List.of();
			}
		};
		minimal.setLayer(0, 3);
		assertEquals(-1, minimal.getLayer(0));
		assertFalse(minimal.hasLayers());
		assertEquals(List.of(0), minimal.getRoots());
	}
}
