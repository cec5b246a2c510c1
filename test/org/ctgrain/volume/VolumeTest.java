package org.ctgrain.volume;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class VolumeTest {

	@Test
	public void testFromArray() {
		final boolean[][][] a = new boolean[2][3][4];
		a[1][2][3] = true;
		a[0][0][1] = true;
		final Volume v = Volume.fromArray(a);
		assertEquals(4, v.getWidth());
		assertEquals(3, v.getHeight());
		assertEquals(2, v.getDepth());
		assertEquals(24, v.getVoxelCount());
		assertEquals(2, v.getForegroundCount());
		assertTrue(v.get(3, 2, 1));
		assertTrue(v.get(1, 0, 0));
		assertFalse(v.get(0, 0, 0));
	}

	@Test
	public void testInputIsCopied() {
		final boolean[][] slices = new boolean[1][4];
		final Volume v = new Volume(slices, 2, 2);
		slices[0][0] = true;
		assertFalse(v.get(0, 0, 0));
		v.getSlice(0)[1] = true;
		assertFalse(v.get(1, 0, 0));
	}

	@Test
	public void testIsForegroundOutsideStack() {
		final Volume v = TestDataMaker.cube(3);
		assertTrue(v.isForeground(0, 0, 0));
		assertFalse(v.isForeground(-1, 0, 0));
		assertFalse(v.isForeground(0, 3, 0));
		assertFalse(v.isForeground(0, 0, 3));
	}

	@Test(expected = InvalidInputException.class)
	public void testWrongSliceLength() {
		new Volume(new boolean[][] { new boolean[5] }, 2, 2);
	}

	@Test(expected = InvalidInputException.class)
	public void testEmpty() {
		Volume.fromArray(new boolean[0][][]);
	}

	@Test(expected = InvalidInputException.class)
	public void testRagged() {
		Volume.fromArray(new boolean[][][] { { new boolean[3], new boolean[2] } });
	}
}
