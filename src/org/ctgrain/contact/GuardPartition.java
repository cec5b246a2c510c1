package org.ctgrain.contact;

/**
 * Interior box of a stack and the particles inside it.
 *
 * <p>
 * The box is [margin, dim - margin) on every axis. Interior particles lie
 * wholly within it, boundary particles reach into the margin band. The
 * partition only decides which particles count towards contact statistics.
 * </p>
 */
public final class GuardPartition {

	private final int margin;
	private final int width, height, depth;
	private final int[] interiorIds;
	private final int[] boundaryIds;

	GuardPartition(final int margin, final int width, final int height, final int depth, final int[] interiorIds,
			final int[] boundaryIds) {
		this.margin = margin;
		this.width = width;
		this.height = height;
		this.depth = depth;
		this.interiorIds = interiorIds;
		this.boundaryIds = boundaryIds;
	}

	public int getMargin() {
		return margin;
	}

	/**
	 * @return true if the voxel lies in the interior box
	 */
	public boolean isInside(final int x, final int y, final int z) {
		return x >= margin && x < width - margin && y >= margin && y < height - margin && z >= margin
				&& z < depth - margin;
	}

	/**
	 * @return ids of particles wholly inside the interior box, ascending
	 */
	public int[] getInteriorIds() {
		return interiorIds.clone();
	}

	/**
	 * @return ids of particles reaching into the margin, ascending
	 */
	public int[] getBoundaryIds() {
		return boundaryIds.clone();
	}

	public int getInteriorCount() {
		return interiorIds.length;
	}

	public int getBoundaryCount() {
		return boundaryIds.length;
	}
}
