package org.ctgrain.volume;

import java.util.ArrayList;
import java.util.List;

/**
 * Voxel neighbourhoods used for labelling, flooding and contact counting.
 */
public enum Connectivity {
	/** Face neighbours only */
	SIX(6, 1),
	/** Face and edge neighbours */
	EIGHTEEN(18, 2),
	/** Face, edge and corner neighbours */
	TWENTY_SIX(26, 3);

	private final int neighbours;

	/** {dx, dy, dz} of every neighbour */
	private final int[][] offsets;

	/**
	 * Offsets that precede the centre voxel in raster order (z, then y, then
	 * x). Scanning only these visits each voxel pair exactly once.
	 */
	private final int[][] backwardOffsets;

	private Connectivity(final int neighbours, final int maxManhattan) {
		this.neighbours = neighbours;
		final List<int[]> all = new ArrayList<int[]>();
		final List<int[]> backward = new ArrayList<int[]>();
		for (int dz = -1; dz <= 1; dz++) {
			for (int dy = -1; dy <= 1; dy++) {
				for (int dx = -1; dx <= 1; dx++) {
					final int m = Math.abs(dx) + Math.abs(dy) + Math.abs(dz);
					if (m == 0 || m > maxManhattan)
						continue;
					final int[] o = { dx, dy, dz };
					all.add(o);
					if (dz < 0 || (dz == 0 && dy < 0) || (dz == 0 && dy == 0 && dx < 0))
						backward.add(o);
				}
			}
		}
		this.offsets = all.toArray(new int[all.size()][]);
		this.backwardOffsets = backward.toArray(new int[backward.size()][]);
	}

	public int getNeighbours() {
		return neighbours;
	}

	/**
	 * @return a copy of the {dx, dy, dz} offsets of the whole neighbourhood
	 */
	public int[][] getOffsets() {
		return copy(offsets);
	}

	/**
	 * @return a copy of the offsets preceding the centre in raster order;
	 *         half of the neighbourhood
	 */
	public int[][] getBackwardOffsets() {
		return copy(backwardOffsets);
	}

	/**
	 * Look up a neighbourhood by its neighbour count
	 *
	 * @param neighbours
	 *            6, 18 or 26
	 * @return matching connectivity
	 * @throws InvalidInputException
	 *             for any other value
	 */
	public static Connectivity of(final int neighbours) {
		for (final Connectivity c : values())
			if (c.neighbours == neighbours)
				return c;
		throw new InvalidInputException("Connectivity must be 6, 18 or 26, not " + neighbours);
	}

	private static int[][] copy(final int[][] o) {
		final int[][] c = new int[o.length][];
		for (int i = 0; i < o.length; i++)
			c[i] = o[i].clone();
		return c;
	}
}
