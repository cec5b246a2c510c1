package org.ctgrain.optimize;

import org.ctgrain.contact.ContactStatistics;
import org.ctgrain.volume.InvalidInputException;

/**
 * Metrics of one tested radius. Immutable.
 *
 * <p>
 * Geometry statistics (particle count, volumes, dominance) cover every
 * particle. Contact statistics cover interior particles only. The largest
 * particle ratio is always largest / total volume, 0 when there are no
 * particles, and interior + excluded always equals the particle count.
 * </p>
 */
public final class OptimizationResult {

	private final int radius;
	private final int particleCount;
	private final double meanContacts;
	private final int interiorParticleCount;
	private final int excludedParticleCount;
	private final long totalVolume;
	private final long largestParticleVolume;
	private final double processingTime;
	private final int guardMargin;
	private final double hhi;
	private final double topShare;
	private final double gini;
	private final double viToPrevious;
	private final ContactStatistics contactStatistics;

	private OptimizationResult(final Builder b) {
		if (b.radius < 0)
			throw new InvalidInputException("Radius must be >= 0: " + b.radius);
		if (b.particleCount < 0 || b.interiorParticleCount < 0 || b.excludedParticleCount < 0)
			throw new InvalidInputException("Particle counts must be >= 0");
		if (b.interiorParticleCount + b.excludedParticleCount != b.particleCount)
			throw new InvalidInputException("Interior (" + b.interiorParticleCount + ") and excluded ("
					+ b.excludedParticleCount + ") particles do not add up to " + b.particleCount);
		if (b.largestParticleVolume < 0 || b.largestParticleVolume > b.totalVolume)
			throw new InvalidInputException(
					"Largest particle volume " + b.largestParticleVolume + " outside [0, " + b.totalVolume + "]");
		this.radius = b.radius;
		this.particleCount = b.particleCount;
		this.meanContacts = b.meanContacts;
		this.interiorParticleCount = b.interiorParticleCount;
		this.excludedParticleCount = b.excludedParticleCount;
		this.totalVolume = b.totalVolume;
		this.largestParticleVolume = b.largestParticleVolume;
		this.processingTime = b.processingTime;
		this.guardMargin = b.guardMargin;
		this.hhi = b.hhi;
		this.topShare = b.topShare;
		this.gini = b.gini;
		this.viToPrevious = b.viToPrevious;
		this.contactStatistics = b.contactStatistics == null ? ContactStatistics.EMPTY : b.contactStatistics;
	}

	public int getRadius() {
		return radius;
	}

	public int getParticleCount() {
		return particleCount;
	}

	/**
	 * @return largest particle volume / total particle volume, 0 without
	 *         particles
	 */
	public double getLargestParticleRatio() {
		if (totalVolume == 0)
			return 0;
		return (double) largestParticleVolume / totalVolume;
	}

	/**
	 * @return mean contact number of the interior particles
	 */
	public double getMeanContacts() {
		return meanContacts;
	}

	public int getInteriorParticleCount() {
		return interiorParticleCount;
	}

	public int getExcludedParticleCount() {
		return excludedParticleCount;
	}

	public long getTotalVolume() {
		return totalVolume;
	}

	public long getLargestParticleVolume() {
		return largestParticleVolume;
	}

	/**
	 * @return seconds spent on this radius
	 */
	public double getProcessingTime() {
		return processingTime;
	}

	public int getGuardMargin() {
		return guardMargin;
	}

	/**
	 * @return Herfindahl-Hirschman index of the particle volumes
	 */
	public double getHhi() {
		return hhi;
	}

	/**
	 * @return volume share of the largest few particles
	 */
	public double getTopShare() {
		return topShare;
	}

	/**
	 * @return Gini coefficient of the particle volumes
	 */
	public double getGini() {
		return gini;
	}

	/**
	 * @return variation of information to the labels of the previous radius,
	 *         NaN for the first radius of a sweep
	 */
	public double getViToPrevious() {
		return viToPrevious;
	}

	public boolean hasViToPrevious() {
		return !Double.isNaN(viToPrevious);
	}

	public ContactStatistics getContactStatistics() {
		return contactStatistics;
	}

	@Override
	public String toString() {
		return String.format("r=%d: %d particles, largest %.4f, mean contacts %.2f (interior %d, excluded %d)",
				radius, particleCount, getLargestParticleRatio(), meanContacts, interiorParticleCount,
				excludedParticleCount);
	}

	public static class Builder {
		private int radius;
		private int particleCount;
		private double meanContacts;
		private int interiorParticleCount;
		private int excludedParticleCount;
		private long totalVolume;
		private long largestParticleVolume;
		private double processingTime;
		private int guardMargin;
		private double hhi;
		private double topShare;
		private double gini;
		private double viToPrevious = Double.NaN;
		private ContactStatistics contactStatistics;

		public Builder(final int radius) {
			this.radius = radius;
		}

		public Builder particles(final int count, final int interior, final int excluded) {
			this.particleCount = count;
			this.interiorParticleCount = interior;
			this.excludedParticleCount = excluded;
			return this;
		}

		public Builder volumes(final long total, final long largest) {
			this.totalVolume = total;
			this.largestParticleVolume = largest;
			return this;
		}

		public Builder meanContacts(final double mean) {
			this.meanContacts = mean;
			return this;
		}

		public Builder contactStatistics(final ContactStatistics stats) {
			this.contactStatistics = stats;
			return this;
		}

		public Builder processingTime(final double seconds) {
			this.processingTime = seconds;
			return this;
		}

		public Builder guardMargin(final int margin) {
			this.guardMargin = margin;
			return this;
		}

		public Builder dominance(final double hhi, final double topShare) {
			this.hhi = hhi;
			this.topShare = topShare;
			return this;
		}

		public Builder gini(final double gini) {
			this.gini = gini;
			return this;
		}

		public Builder viToPrevious(final double vi) {
			this.viToPrevious = vi;
			return this;
		}

		public OptimizationResult build() {
			return new OptimizationResult(this);
		}
	}
}
