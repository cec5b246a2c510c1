package org.ctgrain.optimize;

import static org.ctgrain.optimize.ResultMaker.result;
import static org.ctgrain.optimize.ResultMaker.sweep;
import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class ConstraintSelectorTest {

	private static final SelectionConfig CONFIG = SelectionConfig.DEFAULT;

	private static final double[] RATIOS = { 1, 0.02, 0.01, 0.01 };
	private static final int[] PEAKED = { 1, 50, 80, 60 };

	private static void assertSelected(final int radius, final SelectionReason reason, final RadiusSelection s) {
		assertEquals(radius, s.getRadius());
		assertEquals(reason, s.getReason());
		assertEquals(SelectionMethod.CONSTRAINT_BASED, s.getMethod());
	}

	@Test
	public void testPeakAndContacts() throws SelectionException {
		final RadiusSelection s = ConstraintSelector.select(sweep(PEAKED, RATIOS, new double[] { 0, 4, 6, 7 }),
				CONFIG);
		assertSelected(2, SelectionReason.PEAK_AND_CONTACTS, s);
	}

	@Test
	public void testContactsOnly() throws SelectionException {
		final RadiusSelection s = ConstraintSelector.select(sweep(PEAKED, RATIOS, new double[] { 0, 4, 10, 7 }),
				CONFIG);
		assertSelected(3, SelectionReason.CONTACTS_ONLY, s);
	}

	@Test
	public void testPeakWithoutContacts() throws SelectionException {
		final RadiusSelection s = ConstraintSelector.select(sweep(PEAKED, RATIOS, new double[] { 0, 4, 10, 12 }),
				CONFIG);
		assertSelected(2, SelectionReason.R_PEAK, s);
	}

	@Test
	public void testFlatCountsGiveRStar() throws SelectionException {
		final RadiusSelection s = ConstraintSelector
				.select(sweep(new int[] { 1, 50, 50, 50 }, RATIOS, new double[] { 0, 1, 2, 3 }), CONFIG);
		assertSelected(1, SelectionReason.R_STAR, s);
	}

	@Test
	public void testSingleEligibleRadiusGivesRStar() throws SelectionException {
		final RadiusSelection s = ConstraintSelector.select(
				sweep(new int[] { 1, 5, 40 }, new double[] { 1, 0.5, 0.02 }, new double[] { 0, 1, 2 }), CONFIG);
		assertSelected(2, SelectionReason.R_STAR, s);
	}

	@Test
	public void testNothingEligibleGivesMaxR() throws SelectionException {
		final RadiusSelection s = ConstraintSelector.select(
				sweep(new int[] { 1, 2, 3 }, new double[] { 1, 0.6, 0.4 }, new double[] { 0, 6, 6 }), CONFIG);
		assertSelected(2, SelectionReason.MAX_R, s);
	}

	@Test
	public void testEmptyRadiusIsNeverEligible() throws SelectionException {
		final RadiusSelection s = ConstraintSelector
				.select(sweep(new int[] { 0, 0 }, new double[] { 0, 0 }, new double[] { 0, 0 }), CONFIG);
		assertSelected(1, SelectionReason.MAX_R, s);
	}

	@Test
	public void testContactRangeIsInclusive() throws SelectionException {
		assertSelected(2, SelectionReason.PEAK_AND_CONTACTS,
				ConstraintSelector.select(sweep(PEAKED, RATIOS, new double[] { 0, 4, 9, 12 }), CONFIG));
		assertSelected(2, SelectionReason.PEAK_AND_CONTACTS,
				ConstraintSelector.select(sweep(PEAKED, RATIOS, new double[] { 0, 4, 5, 12 }), CONFIG));
	}

	@Test
	public void testPeakTiesGoToSmallerRadius() throws SelectionException {
		final RadiusSelection s = ConstraintSelector
				.select(sweep(new int[] { 1, 80, 80, 60 }, RATIOS, new double[] { 0, 6, 6, 6 }), CONFIG);
		assertSelected(1, SelectionReason.PEAK_AND_CONTACTS, s);
	}

	@Test
	public void testIneligibleRadiiAreSkipped() throws SelectionException {
		// r=2 has the most particles but one of them dominates
		final RadiusSelection s = ConstraintSelector.select(sweep(new int[] { 1, 50, 200, 60 },
				new double[] { 1, 0.02, 0.5, 0.01 }, new double[] { 0, 4, 6, 7 }), CONFIG);
		assertSelected(3, SelectionReason.PEAK_AND_CONTACTS, s);
	}

	@Test
	public void testSmoothingMovesThePeak() throws SelectionException {
		final int[] counts = { 10, 100, 20, 90, 95 };
		final double[] ratios = { 0.01, 0.01, 0.01, 0.01, 0.01 };
		final double[] contacts = { 6, 6, 6, 6, 6 };
		assertSelected(1, SelectionReason.PEAK_AND_CONTACTS,
				ConstraintSelector.select(sweep(counts, ratios, contacts), CONFIG));
		// trailing window of 2 gives 10, 55, 60, 55, 92.5
		final SelectionConfig smoothed = new SelectionConfig(0.03, 5, 9, 2, 6);
		assertSelected(4, SelectionReason.PEAK_AND_CONTACTS,
				ConstraintSelector.select(sweep(counts, ratios, contacts), smoothed));
	}

	@Test
	public void testDeterministic() throws SelectionException {
		final List<OptimizationResult> results = sweep(PEAKED, RATIOS, new double[] { 0, 4, 6, 7 });
		assertEquals(ConstraintSelector.select(results, CONFIG), ConstraintSelector.select(results, CONFIG));
	}

	@Test(expected = SelectionException.class)
	public void testEmpty() throws SelectionException {
		ConstraintSelector.select(new ArrayList<OptimizationResult>(), CONFIG);
	}

	@Test(expected = SelectionException.class)
	public void testNullEntry() throws SelectionException {
		ConstraintSelector.select(Arrays.asList(result(0, 1, 1, 0), null), CONFIG);
	}

	@Test(expected = SelectionException.class)
	public void testDescendingRadii() throws SelectionException {
		ConstraintSelector.select(Arrays.asList(result(2, 10, 0.1, 6), result(1, 10, 0.1, 6)), CONFIG);
	}

	@Test(expected = SelectionException.class)
	public void testNonFiniteContacts() throws SelectionException {
		ConstraintSelector.select(Arrays.asList(result(0, 10, 0.01, Double.NaN)), CONFIG);
	}
}
