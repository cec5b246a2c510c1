package org.ctgrain.volume;

/**
 * Binary foreground of a CT stack.
 *
 * <p>
 * Stored slice by slice like an ImageJ stack: <code>slices[z][y * w + x]</code>.
 * Instances are immutable; the constructor copies its input and no method
 * exposes the backing arrays.
 * </p>
 */
public final class Volume {

	private final int w, h, d;
	private final boolean[][] slices;
	private final long foreground;

	/**
	 * @param slices
	 *            one packed <code>boolean[w * h]</code> per slice, copied
	 * @param width
	 *            stack width (x)
	 * @param height
	 *            stack height (y)
	 */
	public Volume(final boolean[][] slices, final int width, final int height) {
		if (slices == null || slices.length == 0 || width <= 0 || height <= 0)
			throw new InvalidInputException("Volume must have at least one voxel");
		this.w = width;
		this.h = height;
		this.d = slices.length;
		final int wh = w * h;
		this.slices = new boolean[d][];
		long count = 0;
		for (int z = 0; z < d; z++) {
			if (slices[z] == null || slices[z].length != wh)
				throw new InvalidInputException("Slice " + z + " does not hold " + wh + " voxels");
			this.slices[z] = slices[z].clone();
			for (int i = 0; i < wh; i++)
				if (this.slices[z][i])
					count++;
		}
		this.foreground = count;
	}

	/**
	 * Build a volume from a <code>[z][y][x]</code> array
	 *
	 * @param zyx
	 *            rectangular boolean array
	 * @return volume with the same content
	 */
	public static Volume fromArray(final boolean[][][] zyx) {
		if (zyx == null || zyx.length == 0 || zyx[0].length == 0 || zyx[0][0].length == 0)
			throw new InvalidInputException("Volume must have at least one voxel");
		final int depth = zyx.length;
		final int height = zyx[0].length;
		final int width = zyx[0][0].length;
		final boolean[][] packed = new boolean[depth][width * height];
		for (int z = 0; z < depth; z++) {
			if (zyx[z].length != height)
				throw new InvalidInputException("Ragged array at slice " + z);
			for (int y = 0; y < height; y++) {
				if (zyx[z][y].length != width)
					throw new InvalidInputException("Ragged array at slice " + z + ", row " + y);
				System.arraycopy(zyx[z][y], 0, packed[z], y * width, width);
			}
		}
		return new Volume(packed, width, height);
	}

	public int getWidth() {
		return w;
	}

	public int getHeight() {
		return h;
	}

	public int getDepth() {
		return d;
	}

	public long getVoxelCount() {
		return (long) w * h * d;
	}

	public long getForegroundCount() {
		return foreground;
	}

	public boolean get(final int x, final int y, final int z) {
		return slices[z][y * w + x];
	}

	/**
	 * Foreground test with everything outside the stack treated as
	 * background
	 */
	public boolean isForeground(final int x, final int y, final int z) {
		if (x < 0 || x >= w || y < 0 || y >= h || z < 0 || z >= d)
			return false;
		return slices[z][y * w + x];
	}

	/**
	 * @param z
	 *            slice index, 0-based
	 * @return a copy of the packed slice
	 */
	public boolean[] getSlice(final int z) {
		return slices[z].clone();
	}

	/**
	 * Package-private read access for the converters; callers must not write.
	 */
	boolean[] sliceRef(final int z) {
		return slices[z];
	}

	public boolean sameShape(final LabelVolume labels) {
		return labels.getWidth() == w && labels.getHeight() == h && labels.getDepth() == d;
	}
}
