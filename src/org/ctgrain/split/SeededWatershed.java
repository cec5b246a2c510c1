package org.ctgrain.split;

import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.Volume;

import ij.IJ;

/**
 * Marker-controlled watershed by priority flooding.
 *
 * <p>
 * Seed voxels enter a priority queue keyed by their height. The lowest voxel
 * is taken from the queue and hands its label to every unlabelled foreground
 * neighbour, which then joins the queue at its own height. Basins stop where
 * they meet another label. Foreground that no seed can reach through the
 * foreground stays 0.
 * </p>
 *
 * <p>
 * Meyer F (1994) Topographic distance and watershed lines. Signal Processing
 * 38: 113-125.
 * </p>
 */
public class SeededWatershed {

	/**
	 * Flood the negated distance map from the seeds
	 *
	 * @param squaredDistances
	 *            squared distance from each foreground voxel to the
	 *            background; voxels far from the background are the basin
	 *            floors
	 * @param seeds
	 *            seed labels, 0 where there is no seed; not modified
	 * @param mask
	 *            foreground to flood
	 * @param connectivity
	 *            flooding neighbourhood
	 * @return new label slices
	 */
	public static int[][] flood(final int[][] squaredDistances, final int[][] seeds, final Volume mask,
			final Connectivity connectivity) {
		final int w = mask.getWidth();
		final int h = mask.getHeight();
		final int d = mask.getDepth();
		final int wh = w * h;
		final int[][] offsets = connectivity.getOffsets();

		final int[][] labels = new int[d][];
		int nSeeds = 0;
		for (int z = 0; z < d; z++) {
			labels[z] = seeds[z].clone();
			for (int i = 0; i < wh; i++)
				if (labels[z][i] != 0)
					nSeeds++;
		}
		IJ.showStatus("Flooding from seeds...");
		if (nSeeds == 0)
			return labels;

		final FloodQueue queue = new FloodQueue(nSeeds);
		for (int z = 0; z < d; z++) {
			final int[] lz = labels[z];
			for (int i = 0; i < wh; i++) {
				if (lz[i] != 0) {
					if (!mask.get(i % w, i / w, z))
						throw new IllegalArgumentException("Seed outside the foreground at slice " + z);
					queue.add(-squaredDistances[z][i], (long) z * wh + i);
				}
			}
		}

		while (!queue.isEmpty()) {
			final long voxel = queue.poll();
			final int z = (int) (voxel / wh);
			final int i = (int) (voxel % wh);
			final int x = i % w;
			final int y = i / w;
			final int label = labels[z][i];
			for (final int[] o : offsets) {
				final int nX = x + o[0];
				final int nY = y + o[1];
				final int nZ = z + o[2];
				if (nX < 0 || nX >= w || nY < 0 || nY >= h || nZ < 0 || nZ >= d)
					continue;
				final int nI = nY * w + nX;
				if (labels[nZ][nI] != 0 || !mask.get(nX, nY, nZ))
					continue;
				labels[nZ][nI] = label;
				queue.add(-squaredDistances[nZ][nI], (long) nZ * wh + nI);
			}
		}
		return labels;
	}
}
