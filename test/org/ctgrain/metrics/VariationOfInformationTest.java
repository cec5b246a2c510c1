package org.ctgrain.metrics;

import static org.junit.Assert.assertEquals;

import org.ctgrain.volume.InvalidInputException;
import org.ctgrain.volume.LabelVolume;
import org.junit.Test;

public class VariationOfInformationTest {

	private static LabelVolume row(final int... labels) {
		return LabelVolume.fromArray(new int[][][] { { labels } });
	}

	@Test
	public void testSamePartitionIsZero() {
		assertEquals(0, VariationOfInformation.compute(row(1, 1, 2, 2, 0), row(2, 2, 1, 1, 0)), 1e-12);
	}

	@Test
	public void testSplitCostsOneBit() {
		assertEquals(1.0, VariationOfInformation.compute(row(1, 1, 2, 2, 0, 0), row(1, 1, 1, 1, 0, 0)), 1e-12);
	}

	@Test
	public void testSymmetric() {
		final LabelVolume a = row(1, 1, 2, 3, 3, 0);
		final LabelVolume b = row(1, 2, 2, 2, 3, 3);
		assertEquals(VariationOfInformation.compute(a, b), VariationOfInformation.compute(b, a), 1e-12);
	}

	@Test
	public void testBackgroundAsCluster() {
		// H(A) - H(B) = log2(3) - (log2(3) - 2/3)
		assertEquals(2.0 / 3, VariationOfInformation.compute(row(1, 1, 2, 2, 0, 0), row(1, 1, 1, 1, 0, 0), false),
				1e-12);
	}

	@Test
	public void testEmptyLabellings() {
		assertEquals(0, VariationOfInformation.compute(row(0, 0), row(0, 0)), 0);
	}

	@Test(expected = InvalidInputException.class)
	public void testShapeMismatch() {
		VariationOfInformation.compute(row(1, 1), row(1, 1, 1));
	}
}
