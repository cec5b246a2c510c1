package org.ctgrain.split;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.Volume;
import org.junit.Test;

public class SeededWatershedTest {

	@Test
	public void testBasinsMeetBetweenSeeds() {
		// a 1-voxel thick bar of 7 voxels with seeds at both ends
		final boolean[][][] bar = { { { true, true, true, true, true, true, true } } };
		final Volume v = Volume.fromArray(bar);
		final int[][] flat = new int[1][7];
		final int[][] seeds = { { 1, 0, 0, 0, 0, 0, 2 } };
		final int[][] labels = SeededWatershed.flood(flat, seeds, v, Connectivity.SIX);
		assertArrayEquals(new int[] { 1, 1, 1, 1, 2, 2, 2 }, labels[0]);
		// seeds are not modified
		assertArrayEquals(new int[] { 1, 0, 0, 0, 0, 0, 2 }, seeds[0]);
	}

	@Test
	public void testDeepBasinFloodsFirst() {
		final boolean[][][] bar = { { { true, true, true, true, true } } };
		final Volume v = Volume.fromArray(bar);
		// distances rise towards the right, so seed 2's basin takes the middle
		final int[][] distances = { { 1, 1, 1, 9, 9 } };
		final int[][] seeds = { { 1, 0, 0, 0, 2 } };
		final int[][] labels = SeededWatershed.flood(distances, seeds, v, Connectivity.SIX);
		assertArrayEquals(new int[] { 1, 1, 2, 2, 2 }, labels[0]);
	}

	@Test
	public void testUnreachableForegroundStaysZero() {
		final boolean[][][] gap = { { { true, true, false, true } } };
		final Volume v = Volume.fromArray(gap);
		final int[][] seeds = { { 1, 0, 0, 0 } };
		final int[][] labels = SeededWatershed.flood(new int[1][4], seeds, v, Connectivity.TWENTY_SIX);
		assertArrayEquals(new int[] { 1, 1, 0, 0 }, labels[0]);
	}

	@Test
	public void testNoSeeds() {
		final Volume v = Volume.fromArray(new boolean[][][] { { { true, true } } });
		final int[][] labels = SeededWatershed.flood(new int[1][2], new int[1][2], v, Connectivity.SIX);
		assertEquals(0, labels[0][0] + labels[0][1]);
	}
}
