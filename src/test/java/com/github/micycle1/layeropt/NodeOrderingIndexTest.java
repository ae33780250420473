package com.github.micycle1.layeropt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.layeropt.dag.AdjacencyDag;

public class NodeOrderingIndexTest {

	@Test
	public void testKeysFollowLayerThenPosition() {
		AdjacencyDag dag = AdjacencyDag.of(5, new int[] { 4, 0 }, new int[] { 2, 1 });
		Layering layering = LayeringTest.layering(dag, List.of(4, 2), List.of(1, 3, 0));
		NodeOrderingIndex index = NodeOrderingIndex.of(layering);

		assertEquals(0, index.layerOf(4));
		assertEquals(1, index.positionOf(2));
		assertEquals(1, index.layerOf(0));
		assertEquals(2, index.positionOf(0));

		assertEquals(-1, index.compare(4, 2));
		assertEquals(1, index.compare(2, 4));
		assertEquals(-1, index.compare(2, 1)); // lower layer first
		assertEquals(1, index.compare(0, 3));
		assertEquals(0, index.compare(3, 3));

		List<Integer> all = new ArrayList<>(List.of(0, 1, 2, 3, 4));
		all.sort(index.comparator());
		assertEquals(List.of(4, 2, 1, 3, 0), all);
	}

	@Test
	public void testKeysAreFixedAtConstruction() {
		AdjacencyDag dag = new AdjacencyDag(2);
		Layering layering = LayeringTest.layering(dag, List.of(0, 1));
		NodeOrderingIndex index = NodeOrderingIndex.of(layering);
		layering.getLayer(0).set(0, 1);
		layering.getLayer(0).set(1, 0);
		assertEquals(-1, index.compare(0, 1));
	}
}
