package org.ctgrain.volume;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class LabelVolumeTest {

	private static LabelVolume threeParticles() {
		// 4 x 3 x 2, labels 1, 2 and 5; 3 and 4 unused
		return LabelVolume.fromArray(new int[][][] { { { 1, 1, 0, 0 }, { 0, 0, 0, 2 }, { 0, 0, 0, 2 } },
				{ { 1, 0, 0, 0 }, { 0, 5, 0, 0 }, { 0, 0, 0, 0 } } });
	}

	@Test
	public void testCounts() {
		final LabelVolume l = threeParticles();
		assertEquals(5, l.getMaxLabel());
		assertEquals(3, l.getParticleCount());
		assertArrayEquals(new long[] { 18, 3, 2, 0, 0, 1 }, l.getParticleSizes());
		assertArrayEquals(new int[] { 1, 2, 5 }, l.getParticleIds());
		assertEquals(0, l.getParticleSize(3));
		assertEquals(0, l.getParticleSize(42));
	}

	@Test
	public void testParticleLimits() {
		final int[][] limits = threeParticles().getParticleLimits();
		assertArrayEquals(new int[] { 0, 1, 0, 0, 0, 1 }, limits[1]);
		assertArrayEquals(new int[] { 3, 3, 1, 2, 0, 0 }, limits[2]);
		assertArrayEquals(new int[] { 1, 1, 1, 1, 1, 1 }, limits[5]);
		assertEquals(-1, limits[3][1]);
	}

	@Test
	public void testEmptyVolume() {
		final LabelVolume l = new LabelVolume(new int[2][6], 3, 2);
		assertEquals(0, l.getMaxLabel());
		assertEquals(0, l.getParticleCount());
		assertEquals(0, l.getParticleIds().length);
	}

	@Test
	public void testSamePartition() {
		final LabelVolume a = LabelVolume.fromArray(new int[][][] { { { 1, 1, 2, 0 } } });
		final LabelVolume b = LabelVolume.fromArray(new int[][][] { { { 7, 7, 3, 0 } } });
		final LabelVolume c = LabelVolume.fromArray(new int[][][] { { { 1, 2, 2, 0 } } });
		final LabelVolume d = LabelVolume.fromArray(new int[][][] { { { 1, 1, 1, 0 } } });
		final LabelVolume e = LabelVolume.fromArray(new int[][][] { { { 1, 1, 2, 3 } } });
		assertTrue(a.samePartition(b));
		assertTrue(b.samePartition(a));
		assertFalse(a.samePartition(c));
		assertFalse(a.samePartition(d));
		assertFalse(d.samePartition(a));
		assertFalse(a.samePartition(e));
	}

	@Test
	public void testCallerArraysAreNotShared() {
		final int[][] slices = { { 1, 1, 0, 2 } };
		final LabelVolume l = new LabelVolume(slices, 4, 1);
		slices[0][2] = 3;
		assertEquals(0, l.get(2, 0, 0));
		assertEquals(2, l.getParticleCount());
		l.getSlice(0)[0] = 9;
		assertEquals(1, l.get(0, 0, 0));
		assertArrayEquals(new long[] { 1, 2, 1 }, l.getParticleSizes());
	}

	@Test(expected = InvalidInputException.class)
	public void testNegativeLabel() {
		new LabelVolume(new int[][] { { 0, -1 } }, 2, 1);
	}
}
