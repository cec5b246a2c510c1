package org.ctgrain.optimize;

import static org.ctgrain.optimize.ResultMaker.result;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class RadiusSelectorTest {

	@Test
	public void testConstraintRulesFirst() {
		final List<OptimizationResult> results = Arrays.asList(result(0, 1, 1, 0), result(1, 60, 0.01, 6));
		final RadiusSelection s = RadiusSelector.select(results, SelectionConfig.DEFAULT);
		assertEquals(SelectionMethod.CONSTRAINT_BASED, s.getMethod());
		assertEquals(1, s.getRadius());
	}

	@Test
	public void testFallbackOnInvalidMetrics() {
		final List<OptimizationResult> results = Arrays.asList(result(0, 1, 1, Double.NaN),
				result(1, 60, 0.01, 6));
		final RadiusSelection s = RadiusSelector.select(results, SelectionConfig.DEFAULT);
		assertEquals(SelectionMethod.PARETO_FALLBACK, s.getMethod());
		assertEquals(SelectionReason.PARETO_FALLBACK, s.getReason());
	}

	@Test
	public void testBothStagesFail() {
		try {
			RadiusSelector.select(new ArrayList<OptimizationResult>(), SelectionConfig.DEFAULT);
			fail("Selection from no results should fail");
		} catch (final OptimizationFailureException e) {
			assertFalse(e.hasRadius());
			assertTrue(e.getCause() instanceof SelectionException);
			assertEquals(1, e.getSuppressed().length);
			assertTrue(e.getSuppressed()[0] instanceof SelectionException);
		}
	}
}
