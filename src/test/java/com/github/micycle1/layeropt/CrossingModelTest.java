package com.github.micycle1.layeropt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.github.micycle1.layeropt.dag.AdjacencyDag;
import com.github.micycle1.layeropt.milp.MilpModel;

public class CrossingModelTest {

	@Test
	public void testVariableAndConstraintCounts() {
		// layers [0 1 2] over [3 4]; 0->3, 1->4, 2->3
		AdjacencyDag dag = AdjacencyDag.of(5, new int[] { 0, 3 }, new int[] { 1, 4 }, new int[] { 2, 3 });
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(dag, List.of(0, 1, 2), List.of(3, 4)));

		assertEquals(3 + 1, cm.getPairVariableCount());
		assertEquals(2, cm.getTransitivityConstraintCount()); // one triple, two rows
		// (0,1): 3 vs 4; (0,2): shared child; (1,2): 4 vs 3
		assertEquals(2, cm.getSlackVariableCount());

		MilpModel model = cm.getModel();
		assertEquals(MilpModel.Sense.MINIMISE, model.getSense());
		assertEquals(6, model.getVariableCount());
		assertEquals(2 + 2 * 2, model.getConstraintCount());
		for (int k = 0; k < cm.getPairVariableCount(); k++) {
			assertTrue(model.getVariable(k).integer);
			assertEquals(0.0, model.getVariable(k).weight);
		}
		for (int k = cm.getPairVariableCount(); k < model.getVariableCount(); k++) {
			assertFalse(model.getVariable(k).integer);
			assertEquals(1.0, model.getVariable(k).weight);
		}
	}

	@Test
	public void testSmallLayersHaveNoPairVariables() {
		AdjacencyDag chain = AdjacencyDag.of(2, new int[] { 0, 1 });
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(chain, List.of(0), List.of(1)));
		assertEquals(0, cm.getPairVariableCount());
		assertEquals(0, cm.getSlackVariableCount());
		assertEquals(0, cm.getModel().getConstraintCount());

		CrossingModel empty = CrossingModel.build(LayeringTest.layering(new AdjacencyDag(0), List.of()));
		assertEquals(0, empty.getModel().getVariableCount());
	}

	@Test
	public void testUnconnectedLayersHaveNoSlack() {
		AdjacencyDag dag = new AdjacencyDag(4);
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(dag, List.of(0, 1), List.of(2, 3)));
		assertEquals(2, cm.getPairVariableCount());
		assertEquals(0, cm.getSlackVariableCount());
	}

	@Test
	public void testPairVariablesAreSymmetricAndDistinct() {
		AdjacencyDag dag = new AdjacencyDag(7);
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(dag, List.of(0, 1, 2, 3), List.of(4, 5, 6)));
		Set<Integer> seen = new HashSet<>();
		List<List<Integer>> layers = cm.getLayering().getLayers();
		for (List<Integer> layer : layers) {
			for (int a = 0; a < layer.size(); a++) {
				for (int b = a + 1; b < layer.size(); b++) {
					int k = cm.pairVariable(layer.get(a), layer.get(b));
					assertEquals(k, cm.pairVariable(layer.get(b), layer.get(a)));
					assertTrue(seen.add(k), "pair variable reused: " + k);
					assertTrue(k >= 0 && k < cm.getPairVariableCount());
				}
			}
		}
		assertEquals(6 + 3, seen.size());
		assertThrows(IllegalArgumentException.class, () -> cm.pairVariable(0, 4));
		assertThrows(IllegalArgumentException.class, () -> cm.pairVariable(2, 2));
	}

	@Test
	public void testSlackIsForcedOnlyWhenOrdersDisagree() {
		// A=0, B=1 over C=2, D=3 with A->D and B->C
		AdjacencyDag dag = AdjacencyDag.of(4, new int[] { 0, 3 }, new int[] { 1, 2 });
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(dag, List.of(0, 1), List.of(2, 3)));
		MilpModel model = cm.getModel();
		assertEquals(1, cm.getSlackVariableCount());
		int ab = cm.pairVariable(0, 1);
		int cd = cm.pairVariable(2, 3);
		int slack = 2;

		// A before B, C before D: A->D and B->C cross, slack must be 1
		assertFalse(satisfied(model, values(ab, 1, cd, 1, slack, 0)));
		assertTrue(satisfied(model, values(ab, 1, cd, 1, slack, 1)));
		// A before B, D before C: no crossing, slack may be 0
		assertTrue(satisfied(model, values(ab, 1, cd, 0, slack, 0)));
		// B before A, D before C: crossing again
		assertFalse(satisfied(model, values(ab, 0, cd, 0, slack, 0)));
		assertTrue(satisfied(model, values(ab, 0, cd, 1, slack, 0)));
	}

	@Test
	public void testTransitivityForbidsCycles() {
		AdjacencyDag dag = new AdjacencyDag(3);
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(dag, List.of(0, 1, 2)));
		MilpModel model = cm.getModel();
		int ab = cm.pairVariable(0, 1);
		int ac = cm.pairVariable(0, 2);
		int bc = cm.pairVariable(1, 2);
		// a<b, b<c, c<a
		assertFalse(satisfied(model, values(ab, 1, bc, 1, ac, 0)));
		// b<a, c<b, a<c
		assertFalse(satisfied(model, values(ab, 0, bc, 0, ac, 1)));
		// all six total orders are allowed
		int allowed = 0;
		for (int mask = 0; mask < 8; mask++) {
			if (satisfied(model, values(ab, mask & 1, ac, (mask >> 1) & 1, bc, (mask >> 2) & 1))) {
				allowed++;
			}
		}
		assertEquals(6, allowed);
	}

	@Test
	public void testPairIndicesFollowPositionsNotLabels() {
		AdjacencyDag dag = AdjacencyDag.of(4, new int[] { 3, 0 }, new int[] { 2, 1 });
		CrossingModel cm = CrossingModel.build(LayeringTest.layering(dag, List.of(3, 2), List.of(1, 0)));
		// canonical keys follow positions, not labels
		assertNotEquals(cm.pairVariable(3, 2), cm.pairVariable(1, 0));
		assertEquals(0, cm.pairVariable(2, 3));
		assertEquals(1, cm.pairVariable(0, 1));
	}

	private static double[] values(int... pairs) {
		int max = 0;
		for (int i = 0; i < pairs.length; i += 2) {
			max = Math.max(max, pairs[i]);
		}
		double[] values = new double[max + 1];
		for (int i = 0; i < pairs.length; i += 2) {
			values[pairs[i]] = pairs[i + 1];
		}
		return values;
	}

	private static boolean satisfied(MilpModel model, double[] values) {
		for (MilpModel.Constraint c : model.getConstraints()) {
			double lhs = c.evaluate(values);
			if (lhs < c.lower - 1e-9 || lhs > c.upper + 1e-9) {
				return false;
			}
		}
		return true;
	}
}
