package org.ctgrain.optimize;

import java.util.Locale;

/**
 * Sent after each radius of a sweep completes. Immutable.
 */
public final class ProgressEvent {

	private final int radius;
	private final int particleCount;
	private final double meanContacts;
	private final double largestParticleRatio;
	private final double percentComplete;

	public ProgressEvent(final int radius, final int particleCount, final double meanContacts,
			final double largestParticleRatio, final double percentComplete) {
		this.radius = radius;
		this.particleCount = particleCount;
		this.meanContacts = meanContacts;
		this.largestParticleRatio = largestParticleRatio;
		this.percentComplete = percentComplete;
	}

	static ProgressEvent of(final OptimizationResult result, final double percentComplete) {
		return new ProgressEvent(result.getRadius(), result.getParticleCount(), result.getMeanContacts(),
				result.getLargestParticleRatio(), percentComplete);
	}

	public int getRadius() {
		return radius;
	}

	public int getParticleCount() {
		return particleCount;
	}

	public double getMeanContacts() {
		return meanContacts;
	}

	public double getLargestParticleRatio() {
		return largestParticleRatio;
	}

	/**
	 * @return 0 to 90 during the sweep; the rest is left for selection
	 */
	public double getPercentComplete() {
		return percentComplete;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "%.0f%% r=%d: %d particles, ratio %.4f, contacts %.2f", percentComplete,
				radius, particleCount, largestParticleRatio, meanContacts);
	}
}
