package org.ctgrain.optimize;

import org.ctgrain.contact.GuardConfig;
import org.ctgrain.split.ParticleSplitter;
import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.InvalidInputException;

/**
 * Everything a radius sweep needs apart from the volume and the radii.
 * Immutable; use {@link Builder} to change the defaults.
 */
public final class OptimizerConfig {

	public static final Connectivity DEFAULT_SEED_CONNECTIVITY = Connectivity.TWENTY_SIX;
	public static final Connectivity DEFAULT_CONTACT_CONNECTIVITY = Connectivity.SIX;
	public static final int DEFAULT_MAX_RADIUS = 15;
	public static final int DEFAULT_MIN_PARTICLES = 100;
	public static final int DEFAULT_MAX_PARTICLES = 5000;
	public static final int DEFAULT_TOP_K = 3;

	public static final OptimizerConfig DEFAULT = new Builder().build();

	private final Connectivity seedConnectivity;
	private final Connectivity contactConnectivity;
	private final Connectivity floodConnectivity;
	private final SelectionConfig selection;
	private final GuardConfig guard;
	private final int maxRadius;
	private final int minParticles;
	private final int maxParticles;
	private final int topK;
	private final boolean keepBestLabels;

	private OptimizerConfig(final Builder b) {
		if (b.seedConnectivity == null || b.contactConnectivity == null || b.floodConnectivity == null)
			throw new InvalidInputException("Connectivity must be set");
		if (b.selection == null)
			throw new InvalidInputException("Selection policy must be set");
		if (b.guard == null)
			throw new InvalidInputException("Guard settings must be set");
		if (b.maxRadius < 0)
			throw new InvalidInputException("Maximum radius must be >= 0: " + b.maxRadius);
		if (b.minParticles < 0 || b.minParticles > b.maxParticles)
			throw new InvalidInputException(
					"Expected particle range [" + b.minParticles + ", " + b.maxParticles + "] is invalid");
		if (b.topK < 1)
			throw new InvalidInputException("Top-k must be >= 1: " + b.topK);
		this.seedConnectivity = b.seedConnectivity;
		this.contactConnectivity = b.contactConnectivity;
		this.floodConnectivity = b.floodConnectivity;
		this.selection = b.selection;
		this.guard = b.guard;
		this.maxRadius = b.maxRadius;
		this.minParticles = b.minParticles;
		this.maxParticles = b.maxParticles;
		this.topK = b.topK;
		this.keepBestLabels = b.keepBestLabels;
	}

	/** neighbourhood joining eroded voxels into seeds */
	public Connectivity getSeedConnectivity() {
		return seedConnectivity;
	}

	/** neighbourhood in which two particles touch */
	public Connectivity getContactConnectivity() {
		return contactConnectivity;
	}

	/** neighbourhood used to grow seeds back */
	public Connectivity getFloodConnectivity() {
		return floodConnectivity;
	}

	public SelectionConfig getSelection() {
		return selection;
	}

	public GuardConfig getGuard() {
		return guard;
	}

	public int getMaxRadius() {
		return maxRadius;
	}

	public int getMinParticles() {
		return minParticles;
	}

	public int getMaxParticles() {
		return maxParticles;
	}

	public int getTopK() {
		return topK;
	}

	public boolean isKeepBestLabels() {
		return keepBestLabels;
	}

	public Builder toBuilder() {
		return new Builder().seedConnectivity(seedConnectivity).contactConnectivity(contactConnectivity)
				.floodConnectivity(floodConnectivity).selection(selection).guard(guard).maxRadius(maxRadius)
				.expectedParticles(minParticles, maxParticles).topK(topK).keepBestLabels(keepBestLabels);
	}

	@Override
	public String toString() {
		return "seed=" + seedConnectivity.getNeighbours() + ", contact=" + contactConnectivity.getNeighbours()
				+ ", flood=" + floodConnectivity.getNeighbours() + ", " + selection + ", " + guard + ", maxRadius="
				+ maxRadius;
	}

	public static class Builder {
		private Connectivity seedConnectivity = DEFAULT_SEED_CONNECTIVITY;
		private Connectivity contactConnectivity = DEFAULT_CONTACT_CONNECTIVITY;
		private Connectivity floodConnectivity = ParticleSplitter.DEFAULT_FLOOD_CONNECTIVITY;
		private SelectionConfig selection = SelectionConfig.DEFAULT;
		private GuardConfig guard = GuardConfig.DEFAULT;
		private int maxRadius = DEFAULT_MAX_RADIUS;
		private int minParticles = DEFAULT_MIN_PARTICLES;
		private int maxParticles = DEFAULT_MAX_PARTICLES;
		private int topK = DEFAULT_TOP_K;
		private boolean keepBestLabels = true;

		public Builder seedConnectivity(final Connectivity c) {
			this.seedConnectivity = c;
			return this;
		}

		public Builder contactConnectivity(final Connectivity c) {
			this.contactConnectivity = c;
			return this;
		}

		public Builder floodConnectivity(final Connectivity c) {
			this.floodConnectivity = c;
			return this;
		}

		public Builder selection(final SelectionConfig s) {
			this.selection = s;
			return this;
		}

		public Builder guard(final GuardConfig g) {
			this.guard = g;
			return this;
		}

		public Builder maxRadius(final int r) {
			this.maxRadius = r;
			return this;
		}

		public Builder expectedParticles(final int min, final int max) {
			this.minParticles = min;
			this.maxParticles = max;
			return this;
		}

		public Builder topK(final int k) {
			this.topK = k;
			return this;
		}

		public Builder keepBestLabels(final boolean keep) {
			this.keepBestLabels = keep;
			return this;
		}

		public OptimizerConfig build() {
			return new OptimizerConfig(this);
		}
	}
}
