package org.ctgrain.metrics;

import org.ctgrain.volume.LabelVolume;

/**
 * Voxel counts of the particles in a label volume and the statistics derived
 * from them.
 */
public final class ParticleVolumes {

	/** indexed by label, 0 is the background */
	private final long[] sizes;
	private final int particleCount;
	private final long totalVolume;
	private final long largestVolume;

	public ParticleVolumes(final LabelVolume labels) {
		this(labels.getParticleSizes());
	}

	/**
	 * @param particleSizes
	 *            voxel counts indexed by label, entry 0 ignored
	 */
	public ParticleVolumes(final long[] particleSizes) {
		this.sizes = particleSizes.clone();
		if (sizes.length > 0)
			sizes[0] = 0;
		int count = 0;
		long total = 0;
		long largest = 0;
		for (int i = 1; i < sizes.length; i++) {
			final long s = sizes[i];
			if (s <= 0)
				continue;
			count++;
			total += s;
			largest = Math.max(largest, s);
		}
		this.particleCount = count;
		this.totalVolume = total;
		this.largestVolume = largest;
	}

	public int getParticleCount() {
		return particleCount;
	}

	/**
	 * @return voxels in all particles together
	 */
	public long getTotalVolume() {
		return totalVolume;
	}

	public long getLargestVolume() {
		return largestVolume;
	}

	/**
	 * Fraction of the particle volume held by the largest particle
	 *
	 * @return largest / total, 0 when there are no particles
	 */
	public double getLargestRatio() {
		if (totalVolume == 0)
			return 0;
		return (double) largestVolume / totalVolume;
	}

	/**
	 * @return volumes of the particles present, in label order
	 */
	public long[] getVolumes() {
		final long[] v = new long[particleCount];
		int n = 0;
		for (int i = 1; i < sizes.length; i++)
			if (sizes[i] > 0)
				v[n++] = sizes[i];
		return v;
	}

	/**
	 * Radius of the sphere with the same volume as the largest particle
	 */
	public double getMaxEquivalentRadius() {
		return equivalentRadius(largestVolume);
	}

	/**
	 * Radius of a sphere of the given volume, (3V / 4&pi;)^(1/3)
	 */
	public static double equivalentRadius(final double volume) {
		if (volume <= 0)
			return 0;
		return Math.cbrt(3 * volume / (4 * Math.PI));
	}
}
