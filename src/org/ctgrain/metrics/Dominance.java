package org.ctgrain.metrics;

import java.util.Arrays;

import org.ctgrain.volume.InvalidInputException;

/**
 * Inequality of particle volumes. High values mean a few particles hold most
 * of the material, the signature of an under-split volume.
 *
 * <p>
 * Every method returns 0 when there are no particles.
 * </p>
 */
public class Dominance {

	/**
	 * Herfindahl-Hirschman index, the sum of squared volume shares
	 *
	 * @return value in (0, 1], 1 for a single particle
	 */
	public static double hhi(final long[] volumes) {
		final double total = total(volumes);
		if (total == 0)
			return 0;
		double hhi = 0;
		for (final long v : volumes) {
			final double s = v / total;
			hhi += s * s;
		}
		return hhi;
	}

	public static double hhi(final ParticleVolumes volumes) {
		return hhi(volumes.getVolumes());
	}

	/**
	 * Share of the total volume held by the k largest particles
	 *
	 * @param volumes
	 *            particle volumes
	 * @param k
	 *            number of particles, &ge; 1; larger than the particle count
	 *            means all of them
	 * @return cumulative share in [0, 1]
	 */
	public static double topShare(final long[] volumes, final int k) {
		if (k < 1)
			throw new InvalidInputException("k must be >= 1: " + k);
		final double total = total(volumes);
		if (total == 0)
			return 0;
		final long[] sorted = volumes.clone();
		Arrays.sort(sorted);
		final int n = Math.min(k, sorted.length);
		double top = 0;
		for (int i = sorted.length - n; i < sorted.length; i++)
			top += sorted[i];
		return top / total;
	}

	public static double topShare(final ParticleVolumes volumes, final int k) {
		return topShare(volumes.getVolumes(), k);
	}

	/**
	 * Gini coefficient of the volume distribution
	 *
	 * @return 0 for equal volumes, towards 1 for extreme inequality
	 */
	public static double gini(final long[] volumes) {
		final int n = volumes.length;
		if (n < 2)
			return 0;
		final double total = total(volumes);
		if (total == 0)
			return 0;
		final long[] x = volumes.clone();
		Arrays.sort(x);
		double weighted = 0;
		for (int i = 0; i < n; i++)
			weighted += (double) (n - i) * x[i];
		final double g = (n + 1 - 2.0 * weighted / total) / n;
		return Math.max(0, Math.min(1, g));
	}

	public static double gini(final ParticleVolumes volumes) {
		return gini(volumes.getVolumes());
	}

	private static double total(final long[] volumes) {
		double total = 0;
		for (final long v : volumes)
			total += v;
		return total;
	}
}
