package org.ctgrain.split;

import java.util.Arrays;

import org.ctgrain.volume.Connectivity;

import ij.IJ;

/**
 * Connected component labelling of a binary mask.
 *
 * <p>
 * A first raster pass gives each voxel the smallest label among its already
 * visited neighbours, or a new label, and records every pair of labels that
 * meet in a union-find lookup table. A second pass replaces each label with
 * its root, and a final pass renumbers the roots 1..n in the order they first
 * appear in the stack.
 * </p>
 *
 * @author Michael Doube
 */
public class ParticleLabeller {

	/**
	 * Label the connected structures of a mask
	 *
	 * @param mask
	 *            packed slices, true for voxels to label
	 * @param w
	 *            stack width
	 * @param h
	 *            stack height
	 * @param connectivity
	 *            neighbourhood joining voxels into one structure
	 * @return new label array, 0 where the mask is false
	 */
	public static int[][] label(final boolean[][] mask, final int w, final int h, final Connectivity connectivity) {
		final int d = mask.length;
		final int wh = w * h;
		final int[][] offsets = connectivity.getBackwardOffsets();
		final int[][] particleLabels = new int[d][wh];
		int[] lut = new int[1024];
		int nextID = 1;

		IJ.showStatus("Labelling seeds...");
		for (int z = 0; z < d; z++) {
			final boolean[] mz = mask[z];
			final int[] lz = particleLabels[z];
			for (int y = 0; y < h; y++) {
				final int rowIndex = y * w;
				for (int x = 0; x < w; x++) {
					final int arrayIndex = rowIndex + x;
					if (!mz[arrayIndex])
						continue;
					int minTag = 0;
					for (final int[] o : offsets) {
						final int vX = x + o[0];
						final int vY = y + o[1];
						final int vZ = z + o[2];
						if (vX < 0 || vX >= w || vY < 0 || vY >= h || vZ < 0)
							continue;
						final int tagv = particleLabels[vZ][vY * w + vX];
						if (tagv == 0)
							continue;
						if (minTag == 0) {
							minTag = tagv;
						} else if (tagv != minTag) {
							minTag = join(lut, minTag, tagv);
						}
					}
					if (minTag == 0) {
						if (nextID == lut.length)
							lut = Arrays.copyOf(lut, lut.length * 2);
						lut[nextID] = nextID;
						minTag = nextID++;
					}
					lz[arrayIndex] = minTag;
				}
			}
		}

		// resolve every label to its root, roots are numbered in raster order
		final int[] newLabel = new int[nextID];
		int n = 0;
		for (int z = 0; z < d; z++) {
			final int[] lz = particleLabels[z];
			for (int i = 0; i < wh; i++) {
				final int p = lz[i];
				if (p == 0)
					continue;
				final int root = find(lut, p);
				if (newLabel[root] == 0)
					newLabel[root] = ++n;
				lz[i] = newLabel[root];
			}
		}
		return particleLabels;
	}

	/**
	 * Renumber labels in place so that they run 1..n in the raster order of
	 * their first voxel
	 *
	 * @param particleLabels
	 *            label slices, modified
	 * @param maxLabel
	 *            largest label present
	 * @return number of distinct labels
	 */
	public static int minimiseLabels(final int[][] particleLabels, final int maxLabel) {
		final int[] newLabel = new int[maxLabel + 1];
		int n = 0;
		for (final int[] slice : particleLabels) {
			for (int i = 0; i < slice.length; i++) {
				final int p = slice[i];
				if (p == 0)
					continue;
				if (newLabel[p] == 0)
					newLabel[p] = ++n;
				slice[i] = newLabel[p];
			}
		}
		return n;
	}

	/** merge the trees of a and b, returning the surviving (smaller) root */
	private static int join(final int[] lut, final int a, final int b) {
		final int ra = find(lut, a);
		final int rb = find(lut, b);
		if (ra == rb)
			return ra;
		if (ra < rb) {
			lut[rb] = ra;
			return ra;
		}
		lut[ra] = rb;
		return rb;
	}

	private static int find(final int[] lut, int p) {
		int root = p;
		while (lut[root] != root)
			root = lut[root];
		// compress
		while (lut[p] != root) {
			final int next = lut[p];
			lut[p] = root;
			p = next;
		}
		return root;
	}
}
