package org.ctgrain.split;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.ctgrain.volume.Connectivity;
import org.junit.Test;

public class ParticleLabellerTest {

	/** two voxels touching only at a corner, in a 2 x 2 x 2 stack */
	private static boolean[][] diagonalPair() {
		final boolean[][] mask = new boolean[2][4];
		mask[0][0] = true;
		mask[1][3] = true;
		return mask;
	}

	@Test
	public void testConnectivityDecidesJoining() {
		assertEquals(1, max(ParticleLabeller.label(diagonalPair(), 2, 2, Connectivity.TWENTY_SIX)));
		assertEquals(2, max(ParticleLabeller.label(diagonalPair(), 2, 2, Connectivity.EIGHTEEN)));
		assertEquals(2, max(ParticleLabeller.label(diagonalPair(), 2, 2, Connectivity.SIX)));
	}

	@Test
	public void testUShapeMergesIntoOneLabel() {
		// the arms get different provisional labels that meet on the last row
		final boolean[][] mask = { { true, false, true, true, false, true, true, true, true } };
		final int[][] labels = ParticleLabeller.label(mask, 3, 3, Connectivity.SIX);
		assertArrayEquals(new int[] { 1, 0, 1, 1, 0, 1, 1, 1, 1 }, labels[0]);
	}

	@Test
	public void testLabelsFollowRasterOrder() {
		final boolean[][] mask = { { false, true, false, true, false, true } };
		final int[][] labels = ParticleLabeller.label(mask, 6, 1, Connectivity.SIX);
		assertArrayEquals(new int[] { 0, 1, 0, 2, 0, 3 }, labels[0]);
	}

	@Test
	public void testMinimiseLabels() {
		final int[][] labels = { { 0, 7, 7, 3 }, { 9, 3, 0, 0 } };
		assertEquals(3, ParticleLabeller.minimiseLabels(labels, 9));
		assertArrayEquals(new int[] { 0, 1, 1, 2 }, labels[0]);
		assertArrayEquals(new int[] { 3, 2, 0, 0 }, labels[1]);
	}

	private static int max(final int[][] labels) {
		int max = 0;
		for (final int[] s : labels)
			for (final int p : s)
				max = Math.max(max, p);
		return max;
	}
}
