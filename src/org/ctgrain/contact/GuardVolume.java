package org.ctgrain.contact;

import org.ctgrain.metrics.ParticleVolumes;
import org.ctgrain.volume.InvalidInputException;
import org.ctgrain.volume.LabelVolume;

import ij.IJ;

/**
 * Guard band against field-of-view truncation.
 *
 * <p>
 * Particles cut by the stack edges are missing the neighbours that lie
 * outside the scan, so their contact counts are too low. Particles that reach
 * into a band along the six faces are left out of contact statistics. They
 * stay in the label volume and still count as neighbours of interior
 * particles.
 * </p>
 */
public class GuardVolume {

	/**
	 * Width of the guard band in voxels.
	 *
	 * @param labels
	 *            particle labels
	 * @param config
	 *            guard settings
	 * @return margin, &ge; 0 and less than half of every stack dimension
	 */
	public static int computeMargin(final LabelVolume labels, final GuardConfig config) {
		final double maxRadius = new ParticleVolumes(labels).getMaxEquivalentRadius();
		final int minDim = Math.min(labels.getWidth(), Math.min(labels.getHeight(), labels.getDepth()));
		return computeMargin(maxRadius, minDim, config);
	}

	/**
	 * @param maxEquivalentRadius
	 *            equivalent radius of the largest particle
	 * @param minDimension
	 *            smallest stack dimension
	 * @param config
	 *            guard settings
	 * @return capped margin
	 */
	public static int computeMargin(final double maxEquivalentRadius, final int minDimension,
			final GuardConfig config) {
		if (config == null)
			throw new InvalidInputException("No guard settings");
		final double scaled = Math.ceil(maxEquivalentRadius * config.getScale());
		long margin = Math.max((long) Math.min(scaled, Integer.MAX_VALUE), config.getFloorVoxels());
		final int cap = (int) Math.floor(config.getCapFraction() * minDimension);
		if (margin > cap) {
			if (IJ.debugMode)
				IJ.log("Guard margin " + margin + " capped at " + cap + " voxels");
			margin = cap;
		}
		return (int) Math.max(0, margin);
	}

	/**
	 * Sort particles into interior and boundary sets by their bounding boxes
	 *
	 * @param labels
	 *            particle labels
	 * @param margin
	 *            guard band width, &ge; 0
	 * @return partition of the particle ids
	 */
	public static GuardPartition filterInterior(final LabelVolume labels, final int margin) {
		if (margin < 0)
			throw new InvalidInputException("Guard margin must be >= 0: " + margin);
		final int w = labels.getWidth();
		final int h = labels.getHeight();
		final int d = labels.getDepth();
		final int[][] limits = labels.getParticleLimits();
		final int[] ids = labels.getParticleIds();
		int nInterior = 0;
		final boolean[] interior = new boolean[ids.length];
		for (int i = 0; i < ids.length; i++) {
			final int[] l = limits[ids[i]];
			interior[i] = l[0] >= margin && l[1] < w - margin && l[2] >= margin && l[3] < h - margin
					&& l[4] >= margin && l[5] < d - margin;
			if (interior[i])
				nInterior++;
		}
		final int[] interiorIds = new int[nInterior];
		final int[] boundaryIds = new int[ids.length - nInterior];
		int a = 0, b = 0;
		for (int i = 0; i < ids.length; i++) {
			if (interior[i])
				interiorIds[a++] = ids[i];
			else
				boundaryIds[b++] = ids[i];
		}
		return new GuardPartition(margin, w, h, d, interiorIds, boundaryIds);
	}
}
