package org.ctgrain.contact;

import java.util.Arrays;

/**
 * Distribution of contact counts over a set of particles. All values are 0
 * for an empty set.
 */
public final class ContactStatistics {

	public static final ContactStatistics EMPTY = new ContactStatistics(0, 0, 0, 0, 0, 0, 0, 0);

	private final int particles;
	private final double mean;
	private final double median;
	private final double standardDeviation;
	private final int min;
	private final int max;
	private final double lowerQuartile;
	private final double upperQuartile;

	private ContactStatistics(final int particles, final double mean, final double median,
			final double standardDeviation, final int min, final int max, final double lowerQuartile,
			final double upperQuartile) {
		this.particles = particles;
		this.mean = mean;
		this.median = median;
		this.standardDeviation = standardDeviation;
		this.min = min;
		this.max = max;
		this.lowerQuartile = lowerQuartile;
		this.upperQuartile = upperQuartile;
	}

	/**
	 * Summarise the contact counts of the given particles
	 *
	 * @param record
	 *            contacts of a label volume
	 * @param ids
	 *            particles to include, usually the interior ones
	 * @return statistics of their contact counts
	 */
	public static ContactStatistics of(final ContactRecord record, final int[] ids) {
		final int[] counts = new int[ids.length];
		for (int i = 0; i < ids.length; i++)
			counts[i] = record.getContactCount(ids[i]);
		return of(counts);
	}

	public static ContactStatistics of(final int[] contactCounts) {
		final int n = contactCounts.length;
		if (n == 0)
			return EMPTY;
		final int[] sorted = contactCounts.clone();
		Arrays.sort(sorted);
		double sum = 0;
		for (final int c : sorted)
			sum += c;
		final double mean = sum / n;
		double sumSquares = 0;
		for (final int c : sorted)
			sumSquares += (c - mean) * (c - mean);
		// population standard deviation
		final double sd = Math.sqrt(sumSquares / n);
		return new ContactStatistics(n, mean, percentile(sorted, 50), sd, sorted[0], sorted[n - 1],
				percentile(sorted, 25), percentile(sorted, 75));
	}

	/**
	 * Percentile with linear interpolation between closest ranks
	 */
	static double percentile(final int[] sorted, final double p) {
		final double rank = p / 100 * (sorted.length - 1);
		final int lo = (int) Math.floor(rank);
		final int hi = (int) Math.ceil(rank);
		return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
	}

	public int getParticleCount() {
		return particles;
	}

	public double getMean() {
		return mean;
	}

	public double getMedian() {
		return median;
	}

	public double getStandardDeviation() {
		return standardDeviation;
	}

	public int getMin() {
		return min;
	}

	public int getMax() {
		return max;
	}

	public double getLowerQuartile() {
		return lowerQuartile;
	}

	public double getUpperQuartile() {
		return upperQuartile;
	}

	@Override
	public String toString() {
		return String.format("n=%d, mean=%.2f, median=%.1f, sd=%.2f, min=%d, max=%d, q25=%.1f, q75=%.1f", particles,
				mean, median, standardDeviation, min, max, lowerQuartile, upperQuartile);
	}
}
