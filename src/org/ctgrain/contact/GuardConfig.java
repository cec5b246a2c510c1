package org.ctgrain.contact;

import org.ctgrain.volume.InvalidInputException;

/**
 * Settings of the guard margin, immutable.
 *
 * <p>
 * margin = max(ceil(largest equivalent radius &times; scale), floor), then
 * capped at floor(capFraction &times; smallest stack dimension).
 * </p>
 */
public final class GuardConfig {

	public static final double DEFAULT_SCALE = 0.3;
	public static final int DEFAULT_FLOOR_VOXELS = 10;
	public static final double DEFAULT_CAP_FRACTION = 0.06;

	public static final GuardConfig DEFAULT = new GuardConfig(DEFAULT_SCALE, DEFAULT_FLOOR_VOXELS,
			DEFAULT_CAP_FRACTION);

	private final double scale;
	private final int floorVoxels;
	private final double capFraction;

	/**
	 * @param scale
	 *            multiplier of the largest equivalent radius, &ge; 0
	 * @param floorVoxels
	 *            smallest margin before capping, &ge; 0
	 * @param capFraction
	 *            largest margin as a fraction of the smallest dimension, in
	 *            (0, 0.5)
	 * @throws InvalidInputException
	 *             if any value is out of range
	 */
	public GuardConfig(final double scale, final int floorVoxels, final double capFraction) {
		if (!(scale >= 0) || Double.isInfinite(scale))
			throw new InvalidInputException("Guard scale must be a finite value >= 0: " + scale);
		if (floorVoxels < 0)
			throw new InvalidInputException("Guard floor must be >= 0: " + floorVoxels);
		if (!(capFraction > 0 && capFraction < 0.5))
			throw new InvalidInputException("Guard cap fraction must lie in (0, 0.5): " + capFraction);
		this.scale = scale;
		this.floorVoxels = floorVoxels;
		this.capFraction = capFraction;
	}

	public double getScale() {
		return scale;
	}

	public int getFloorVoxels() {
		return floorVoxels;
	}

	public double getCapFraction() {
		return capFraction;
	}

	@Override
	public String toString() {
		return "GuardConfig[scale=" + scale + ", floor=" + floorVoxels + ", cap=" + capFraction + "]";
	}
}
