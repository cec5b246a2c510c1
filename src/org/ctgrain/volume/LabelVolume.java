package org.ctgrain.volume;

import java.util.Arrays;

/**
 * Particle labels of a stack: 0 is background, each positive value is one
 * particle.
 *
 * <p>
 * Laid out like {@link Volume}, <code>labels[z][y * w + x]</code>. The
 * constructor takes ownership of the arrays it is given: whoever built them
 * must not write to them afterwards. After construction the volume is only
 * read, so it may be shared between threads.
 * </p>
 */
public final class LabelVolume {

	private final int w, h, d;
	private final int[][] labels;

	/** voxel count of each label, index 0 holds the background */
	private final long[] particleSizes;

	private final int particleCount;

	/**
	 * @param labels
	 *            packed label slices, copied
	 * @param width
	 *            stack width (x)
	 * @param height
	 *            stack height (y)
	 */
	public LabelVolume(final int[][] labels, final int width, final int height) {
		this(copy(labels), width, height, true);
	}

	/** takes ownership of <code>labels</code> */
	private LabelVolume(final int[][] labels, final int width, final int height, final boolean owned) {
		if (labels == null || labels.length == 0 || width <= 0 || height <= 0)
			throw new InvalidInputException("Label volume must have at least one voxel");
		this.w = width;
		this.h = height;
		this.d = labels.length;
		this.labels = labels;
		final int wh = w * h;
		int maxParticle = 0;
		for (int z = 0; z < d; z++) {
			final int[] slice = labels[z];
			if (slice == null || slice.length != wh)
				throw new InvalidInputException("Label slice " + z + " does not hold " + wh + " voxels");
			for (int i = 0; i < wh; i++) {
				if (slice[i] < 0)
					throw new InvalidInputException("Negative label at slice " + z + ", index " + i);
				maxParticle = Math.max(maxParticle, slice[i]);
			}
		}
		final long[] sizes = new long[maxParticle + 1];
		for (int z = 0; z < d; z++) {
			final int[] slice = labels[z];
			for (int i = 0; i < wh; i++)
				sizes[slice[i]]++;
		}
		int count = 0;
		for (int p = 1; p < sizes.length; p++)
			if (sizes[p] > 0)
				count++;
		this.particleSizes = sizes;
		this.particleCount = count;
	}

	/**
	 * Build a label volume from a <code>[z][y][x]</code> array
	 */
	public static LabelVolume fromArray(final int[][][] zyx) {
		if (zyx == null || zyx.length == 0 || zyx[0].length == 0 || zyx[0][0].length == 0)
			throw new InvalidInputException("Label volume must have at least one voxel");
		final int depth = zyx.length;
		final int height = zyx[0].length;
		final int width = zyx[0][0].length;
		final int[][] packed = new int[depth][width * height];
		for (int z = 0; z < depth; z++) {
			for (int y = 0; y < height; y++) {
				if (zyx[z][y].length != width)
					throw new InvalidInputException("Ragged array at slice " + z + ", row " + y);
				System.arraycopy(zyx[z][y], 0, packed[z], y * width, width);
			}
		}
		return new LabelVolume(packed, width, height, true);
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

	public int get(final int x, final int y, final int z) {
		return labels[z][y * w + x];
	}

	/**
	 * @return a copy of the packed label slice
	 */
	public int[] getSlice(final int z) {
		return labels[z].clone();
	}

	/**
	 * Direct read access for the converters in this package
	 */
	int[] sliceRef(final int z) {
		return labels[z];
	}

	/**
	 * @return largest label value present, 0 for an empty volume
	 */
	public int getMaxLabel() {
		return particleSizes.length - 1;
	}

	/**
	 * @return number of distinct non-zero labels
	 */
	public int getParticleCount() {
		return particleCount;
	}

	/**
	 * @return voxel counts indexed by label, index 0 is the background
	 */
	public long[] getParticleSizes() {
		return particleSizes.clone();
	}

	public long getParticleSize(final int label) {
		if (label <= 0 || label >= particleSizes.length)
			return 0;
		return particleSizes[label];
	}

	/**
	 * @return ids of all labels with at least one voxel, ascending
	 */
	public int[] getParticleIds() {
		final int[] ids = new int[particleCount];
		int n = 0;
		for (int p = 1; p < particleSizes.length; p++)
			if (particleSizes[p] > 0)
				ids[n++] = p;
		return ids;
	}

	/**
	 * Bounding boxes of every label.
	 *
	 * @return int[maxLabel + 1][6] holding x min, x max, y min, y max, z min
	 *         and z max; rows of absent labels keep min = Integer.MAX_VALUE and
	 *         max = -1
	 */
	public int[][] getParticleLimits() {
		final int nLabels = particleSizes.length;
		final int[][] limits = new int[nLabels][6];
		for (int i = 0; i < nLabels; i++) {
			limits[i][0] = Integer.MAX_VALUE; // x min
			limits[i][1] = -1; // x max
			limits[i][2] = Integer.MAX_VALUE; // y min
			limits[i][3] = -1; // y max
			limits[i][4] = Integer.MAX_VALUE; // z min
			limits[i][5] = -1; // z max
		}
		for (int z = 0; z < d; z++) {
			final int[] slice = labels[z];
			for (int y = 0; y < h; y++) {
				final int index = y * w;
				for (int x = 0; x < w; x++) {
					final int i = slice[index + x];
					if (i == 0)
						continue;
					final int[] l = limits[i];
					l[0] = Math.min(l[0], x);
					l[1] = Math.max(l[1], x);
					l[2] = Math.min(l[2], y);
					l[3] = Math.max(l[3], y);
					l[4] = Math.min(l[4], z);
					l[5] = Math.max(l[5], z);
				}
			}
		}
		return limits;
	}

	/**
	 * Two label volumes describe the same partition if a one-to-one mapping
	 * between their labels turns one into the other.
	 *
	 * @return true if the voxel partitions are identical up to label renaming
	 */
	public boolean samePartition(final LabelVolume other) {
		if (other.w != w || other.h != h || other.d != d)
			return false;
		final int[] forward = new int[particleSizes.length];
		final int[] backward = new int[other.particleSizes.length];
		Arrays.fill(forward, -1);
		Arrays.fill(backward, -1);
		final int wh = w * h;
		for (int z = 0; z < d; z++) {
			final int[] a = labels[z];
			final int[] b = other.labels[z];
			for (int i = 0; i < wh; i++) {
				final int la = a[i];
				final int lb = b[i];
				if (forward[la] == -1 && backward[lb] == -1) {
					forward[la] = lb;
					backward[lb] = la;
				} else if (forward[la] != lb || backward[lb] != la) {
					return false;
				}
			}
		}
		return forward[0] <= 0 && backward[0] <= 0;
	}

	private static int[][] copy(final int[][] labels) {
		if (labels == null)
			return null;
		final int[][] out = new int[labels.length][];
		for (int z = 0; z < labels.length; z++)
			out[z] = labels[z] == null ? null : labels[z].clone();
		return out;
	}
}
