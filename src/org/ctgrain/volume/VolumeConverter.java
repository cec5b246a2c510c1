package org.ctgrain.volume;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;

/**
 * Moves volumes in and out of ImageJ stacks.
 *
 * <p>
 * Binary stacks follow ImageJ's convention: 8-bit, 0 for background and 255
 * for foreground. Label volumes come out as 32-bit stacks so that particle ids
 * can be inspected with the usual ImageJ tools.
 * </p>
 */
public class VolumeConverter {

	/** labels above this value lose precision in a float stack */
	private static final double MAX_EXACT_FLOAT = Math.pow(2, 24);

	/**
	 * Check that every slice of an image is 8-bit and holds only 0 and 255
	 *
	 * @param imp
	 *            image to check, may be null
	 * @return true if the whole stack is binary
	 */
	public static boolean isBinary(final ImagePlus imp) {
		if (imp == null)
			return false;
		if (imp.getType() != ImagePlus.GRAY8)
			return false;
		final ImageStack stack = imp.getImageStack();
		final int n = stack.getSize();
		for (int z = 1; z <= n; z++) {
			final byte[] pixels = (byte[]) stack.getPixels(z);
			for (final byte b : pixels) {
				final int v = b & 0xff;
				if (v != 0 && v != 255)
					return false;
			}
		}
		return true;
	}

	/**
	 * Read the foreground of a binary stack
	 *
	 * @param imp
	 *            8-bit binary image
	 * @return volume where 255 is foreground
	 * @throws InvalidInputException
	 *             if the image is missing or not binary
	 */
	public static Volume toVolume(final ImagePlus imp) {
		if (imp == null)
			throw new InvalidInputException("No image");
		if (!isBinary(imp))
			throw new InvalidInputException(imp.getTitle() + " is not an 8-bit binary image");
		final int w = imp.getWidth();
		final int h = imp.getHeight();
		final int wh = w * h;
		final ImageStack stack = imp.getImageStack();
		final int d = stack.getSize();
		final boolean[][] slices = new boolean[d][wh];
		for (int z = 0; z < d; z++) {
			final byte[] pixels = (byte[]) stack.getPixels(z + 1);
			for (int i = 0; i < wh; i++)
				slices[z][i] = (pixels[i] & 0xff) == 255;
		}
		return new Volume(slices, w, h);
	}

	/**
	 * Render a volume as an 8-bit binary stack
	 */
	public static ImagePlus toImagePlus(final Volume volume, final String title) {
		final int w = volume.getWidth();
		final int h = volume.getHeight();
		final int wh = w * h;
		final ImageStack stack = new ImageStack(w, h);
		for (int z = 0; z < volume.getDepth(); z++) {
			final boolean[] slice = volume.sliceRef(z);
			final byte[] pixels = new byte[wh];
			for (int i = 0; i < wh; i++)
				if (slice[i])
					pixels[i] = (byte) 255;
			stack.addSlice("" + (z + 1), pixels);
		}
		return new ImagePlus(title, stack);
	}

	/**
	 * Render particle labels as a 32-bit stack, display range 0 to the
	 * largest label.
	 *
	 * @param labels
	 *            label volume
	 * @param title
	 *            image title
	 * @return new 32-bit image
	 */
	public static ImagePlus toImagePlus(final LabelVolume labels, final String title) {
		final int w = labels.getWidth();
		final int h = labels.getHeight();
		final int wh = w * h;
		final ImageStack stack = new ImageStack(w, h);
		for (int z = 0; z < labels.getDepth(); z++) {
			final int[] slice = labels.sliceRef(z);
			final float[] slicePixels = new float[wh];
			for (int i = 0; i < wh; i++)
				slicePixels[i] = slice[i];
			stack.addSlice("" + (z + 1), slicePixels);
		}
		final ImagePlus impParticles = new ImagePlus(title, stack);
		final int max = labels.getMaxLabel();
		impParticles.getProcessor().setMinAndMax(0, max);
		if (max > MAX_EXACT_FLOAT)
			IJ.log("Warning: more than 16777216 (2^24) particles, label values in " + title
					+ " are inaccurate above this number.");
		return impParticles;
	}

	/**
	 * Read particle labels back from a 32-bit stack written by
	 * {@link #toImagePlus(LabelVolume, String)}
	 */
	public static LabelVolume toLabelVolume(final ImagePlus imp) {
		if (imp == null)
			throw new InvalidInputException("No image");
		if (imp.getType() != ImagePlus.GRAY32)
			throw new InvalidInputException(imp.getTitle() + " is not a 32-bit label image");
		final int w = imp.getWidth();
		final int h = imp.getHeight();
		final int wh = w * h;
		final ImageStack stack = imp.getImageStack();
		final int d = stack.getSize();
		final int[][] labels = new int[d][wh];
		for (int z = 0; z < d; z++) {
			final float[] pixels = (float[]) stack.getPixels(z + 1);
			for (int i = 0; i < wh; i++) {
				final float v = pixels[i];
				if (v < 0 || v != Math.rint(v))
					throw new InvalidInputException("Non-integer label " + v + " in slice " + (z + 1));
				labels[z][i] = (int) v;
			}
		}
		return new LabelVolume(labels, w, h);
	}
}
