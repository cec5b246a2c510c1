package org.ctgrain.metrics;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.ctgrain.volume.InvalidInputException;
import org.junit.Test;

public class KneePointTest {

	private static final double[] X = { 0, 1, 2, 3, 4 };

	@Test
	public void testSaturatingCurve() {
		assertEquals(1, KneePoint.detect(X, new double[] { 0, 8, 9, 9.5, 10 }));
	}

	@Test
	public void testDegenerateCurves() {
		assertEquals(0, KneePoint.detect(X, new double[] { 3, 3, 3, 3, 3 }));
		assertEquals(0, KneePoint.detect(new double[] { 0, 1 }, new double[] { 0, 5 }));
		assertEquals(0, KneePoint.detect(new double[0], new double[0]));
	}

	@Test(expected = InvalidInputException.class)
	public void testLengthMismatch() {
		KneePoint.detect(X, new double[] { 1, 2 });
	}

	@Test
	public void testSmooth() {
		final double[] v = { 1, 2, 3, 4 };
		assertArrayEquals(new double[] { 1, 1.5, 2.5, 3.5 }, KneePoint.smooth(v, 2), 1e-12);
		assertArrayEquals(new double[] { 1, 1.5, 2, 3 }, KneePoint.smooth(v, 3), 1e-12);
		assertArrayEquals(v, KneePoint.smooth(v, 0), 0);
		assertArrayEquals(v, KneePoint.smooth(v, 1), 0);
		// input untouched
		assertArrayEquals(new double[] { 1, 2, 3, 4 }, v, 0);
	}

	@Test(expected = InvalidInputException.class)
	public void testNegativeWindow() {
		KneePoint.smooth(X, -1);
	}
}
