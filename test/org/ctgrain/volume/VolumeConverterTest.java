package org.ctgrain.volume;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.Test;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

public class VolumeConverterTest {

	@Test
	public void testIsBinaryReturnsFalseIfImageIsNull() {
		assertFalse(VolumeConverter.isBinary(null));
	}

	@Test
	public void testIsBinaryReturnsFalseIfNot8Bit() {
		final ImagePlus imp = mock(ImagePlus.class);
		when(imp.getType()).thenReturn(ImagePlus.GRAY16);
		assertFalse(VolumeConverter.isBinary(imp));
	}

	@Test
	public void testIsBinaryChecksEverySlice() {
		final ImageStack stack = new ImageStack(2, 2);
		final ByteProcessor first = new ByteProcessor(2, 2);
		first.set(0, 0, 255);
		final ByteProcessor second = new ByteProcessor(2, 2);
		second.set(1, 1, 128);
		stack.addSlice("", first);
		stack.addSlice("", second);
		assertFalse(VolumeConverter.isBinary(new ImagePlus("grey", stack)));
		second.set(1, 1, 255);
		assertTrue(VolumeConverter.isBinary(new ImagePlus("binary", stack)));
	}

	@Test
	public void testToVolume() {
		final Volume original = TestDataMaker.brick(3, 2, 4, 1);
		final Volume read = VolumeConverter.toVolume(TestDataMaker.toImage(original));
		assertEquals(original.getWidth(), read.getWidth());
		assertEquals(original.getDepth(), read.getDepth());
		assertEquals(24, read.getForegroundCount());
		assertTrue(read.get(1, 1, 1));
		assertFalse(read.get(0, 0, 0));
	}

	@Test(expected = InvalidInputException.class)
	public void testToVolumeRejectsGreyImage() {
		final ImageStack stack = new ImageStack(2, 2);
		stack.addSlice("", new FloatProcessor(2, 2));
		VolumeConverter.toVolume(new ImagePlus("float", stack));
	}

	@Test
	public void testBinaryImageOfVolume() {
		final Volume v = TestDataMaker.brick(2, 2, 2, 1);
		final ImagePlus imp = VolumeConverter.toImagePlus(v, "brick");
		assertTrue(VolumeConverter.isBinary(imp));
		assertEquals(4, imp.getStackSize());
		assertEquals(8, VolumeConverter.toVolume(imp).getForegroundCount());
	}

	@Test
	public void testLabelImage() {
		final LabelVolume labels = LabelVolume
				.fromArray(new int[][][] { { { 0, 1 }, { 2, 2 } }, { { 3, 0 }, { 0, 0 } } });
		final ImagePlus imp = VolumeConverter.toImagePlus(labels, "labels");
		assertEquals(ImagePlus.GRAY32, imp.getType());
		assertEquals(2, imp.getStackSize());
		assertEquals(3, imp.getProcessor().getMax(), 0);
		final LabelVolume read = VolumeConverter.toLabelVolume(imp);
		assertEquals(3, read.getParticleCount());
		assertEquals(2, read.get(0, 1, 0));
		assertEquals(3, read.get(0, 0, 1));
	}

	@Test(expected = InvalidInputException.class)
	public void testLabelImageRejectsFractions() {
		final FloatProcessor fp = new FloatProcessor(2, 1);
		fp.setf(0, 1.5f);
		VolumeConverter.toLabelVolume(new ImagePlus("fraction", fp));
	}
}
