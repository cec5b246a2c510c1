package org.ctgrain.split;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.ctgrain.volume.TestDataMaker;
import org.ctgrain.volume.Volume;
import org.junit.Test;

public class DistanceTransformTest {

	/**
	 * Squared distance to the nearest background voxel by exhaustive search
	 */
	private static int bruteForce(final Volume v, final int x, final int y, final int z,
			final boolean outsideIsBackground) {
		int min = Integer.MAX_VALUE;
		final int pad = outsideIsBackground ? 1 : 0;
		for (int k = -pad; k < v.getDepth() + pad; k++)
			for (int j = -pad; j < v.getHeight() + pad; j++)
				for (int i = -pad; i < v.getWidth() + pad; i++) {
					if (v.isForeground(i, j, k))
						continue;
					final int d = (i - x) * (i - x) + (j - y) * (j - y) + (k - z) * (k - z);
					min = Math.min(min, d);
				}
		return min;
	}

	@Test
	public void testMatchesBruteForce() {
		final Volume v = TestDataMaker.neckedPair();
		for (final boolean outside : new boolean[] { true, false }) {
			final int[][] s = DistanceTransform.squaredDistances(v, outside);
			for (int z = 0; z < v.getDepth(); z++)
				for (int y = 0; y < v.getHeight(); y++)
					for (int x = 0; x < v.getWidth(); x++) {
						final int expected = v.get(x, y, z) ? bruteForce(v, x, y, z, outside) : 0;
						assertEquals("(" + x + ", " + y + ", " + z + ") outside=" + outside, expected,
								s[z][y * v.getWidth() + x]);
					}
		}
	}

	@Test
	public void testStackEdgeCountsAsBackground() {
		final Volume cube = TestDataMaker.cube(5);
		final int[][] s = DistanceTransform.squaredDistances(cube, true);
		// corner voxel is 1 from the outside, centre 3
		assertEquals(1, s[0][0]);
		assertEquals(9, s[2][2 * 5 + 2]);
	}

	@Test
	public void testNoBackgroundInsideStack() {
		final Volume cube = TestDataMaker.cube(5);
		final int[][] s = DistanceTransform.squaredDistances(cube, false);
		// larger than any real distance and the same everywhere
		assertTrue(s[0][0] > 3 * 5 * 5);
		assertEquals(s[0][0], s[4][24]);
	}

	@Test
	public void testErodeZeroKeepsForeground() {
		final Volume v = TestDataMaker.neckedPair();
		final boolean[][] e = DistanceTransform.erode(v, 0);
		for (int z = 0; z < v.getDepth(); z++)
			for (int y = 0; y < v.getHeight(); y++)
				for (int x = 0; x < v.getWidth(); x++)
					assertEquals(v.get(x, y, z), e[z][y * v.getWidth() + x]);
	}

	@Test
	public void testErodeMatchesBallFit() {
		final Volume v = TestDataMaker.neckedPair();
		final int r = 2;
		final boolean[][] e = DistanceTransform.erode(v, r);
		for (int z = 0; z < v.getDepth(); z++)
			for (int y = 0; y < v.getHeight(); y++)
				for (int x = 0; x < v.getWidth(); x++) {
					boolean fits = true;
					for (int k = -r; k <= r && fits; k++)
						for (int j = -r; j <= r && fits; j++)
							for (int i = -r; i <= r && fits; i++)
								if (i * i + j * j + k * k <= r * r && !v.isForeground(x + i, y + j, z + k))
									fits = false;
					assertEquals("(" + x + ", " + y + ", " + z + ")", fits, e[z][y * v.getWidth() + x]);
				}
	}

	@Test
	public void testErodeCutsNeck() {
		final Volume v = TestDataMaker.neckedPair();
		final boolean[][] e = DistanceTransform.erode(v, 1);
		assertFalse(e[7][7 * 31 + 15]);
		assertTrue(e[7][7 * 31 + 8]);
		assertTrue(e[7][7 * 31 + 22]);
	}
}
