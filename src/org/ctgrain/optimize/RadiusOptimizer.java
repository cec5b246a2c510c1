package org.ctgrain.optimize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.ctgrain.contact.ContactCounter;
import org.ctgrain.contact.ContactRecord;
import org.ctgrain.contact.ContactStatistics;
import org.ctgrain.contact.GuardPartition;
import org.ctgrain.contact.GuardVolume;
import org.ctgrain.metrics.Dominance;
import org.ctgrain.metrics.ParticleVolumes;
import org.ctgrain.metrics.VariationOfInformation;
import org.ctgrain.split.ParticleSplitter;
import org.ctgrain.volume.Connectivity;
import org.ctgrain.volume.InvalidInputException;
import org.ctgrain.volume.LabelVolume;
import org.ctgrain.volume.Volume;

import ij.IJ;

/**
 * Sweeps erosion radii over a volume and picks the one giving the most
 * plausible particles.
 *
 * <p>
 * Radii are processed one after another in ascending order. For each radius
 * the volume is split, the particle volumes, guard margin, interior contacts,
 * dominance and stability to the previous radius are measured, and a progress
 * event is sent. Only the labels of the previous radius are held between
 * iterations. Once every radius is done the {@link RadiusSelector} chooses.
 * </p>
 *
 * <p>
 * Cancellation is checked before each radius and before selection. A failure
 * while processing a radius stops the whole run, since a gap in the sweep
 * would mislead the selector.
 * </p>
 */
public class RadiusOptimizer {

	/** share of progress given to the sweep, the rest is selection */
	private static final double SWEEP_PERCENT = 90;

	private final OptimizerConfig config;

	public RadiusOptimizer() {
		this(OptimizerConfig.DEFAULT);
	}

	public RadiusOptimizer(final OptimizerConfig config) {
		if (config == null)
			throw new InvalidInputException("No optimiser settings");
		this.config = config;
	}

	public OptimizerConfig getConfig() {
		return config;
	}

	/**
	 * Run a sweep with default guard and limit settings, without progress or
	 * cancellation
	 *
	 * @param volume
	 *            binary foreground
	 * @param radii
	 *            radii to test
	 * @param seedConnectivity
	 *            neighbourhood joining eroded voxels into seeds
	 * @param contactConnectivity
	 *            neighbourhood in which particles touch
	 * @param selection
	 *            selection policy
	 * @return summary of the sweep
	 */
	public static OptimizationSummary optimize(final Volume volume, final int[] radii,
			final Connectivity seedConnectivity, final Connectivity contactConnectivity,
			final SelectionConfig selection) {
		final OptimizerConfig c = new OptimizerConfig.Builder().seedConnectivity(seedConnectivity)
				.contactConnectivity(contactConnectivity).selection(selection).build();
		try {
			return new RadiusOptimizer(c).optimize(volume, radii, null, null);
		} catch (final OptimizationCancelledException e) {
			// no cancellation handle was given out
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Run a sweep
	 *
	 * @param volume
	 *            binary foreground
	 * @param radii
	 *            radii to test, any order; duplicates are ignored
	 * @param listener
	 *            receives an event after each radius, may be null
	 * @param cancellation
	 *            checked between radii, may be null
	 * @return summary of the sweep
	 * @throws InvalidInputException
	 *             if the volume or radii are unusable; nothing has been
	 *             computed
	 * @throws OptimizationCancelledException
	 *             if cancellation was requested
	 * @throws OptimizationFailureException
	 *             if a radius could not be processed or selection failed
	 */
	public OptimizationSummary optimize(final Volume volume, final int[] radii, final ProgressListener listener,
			final Cancellation cancellation) throws OptimizationCancelledException {
		final int[] sweep = validate(volume, radii);
		final long start = System.nanoTime();
		IJ.log("Starting radius optimisation for radii " + Arrays.toString(sweep) + " (" + config + ")");

		final ParticleSplitter splitter = new ParticleSplitter(volume, config.getFloodConnectivity());
		final List<OptimizationResult> results = new ArrayList<OptimizationResult>();
		LabelVolume previous = null;
		for (int i = 0; i < sweep.length; i++) {
			if (cancellation != null)
				cancellation.check(i);
			final int r = sweep[i];
			IJ.showStatus("Processing radius " + r + " (" + (i + 1) + "/" + sweep.length + ")...");
			final LabelVolume labels;
			final OptimizationResult result;
			try {
				final long t0 = System.nanoTime();
				labels = splitter.split(r, config.getSeedConnectivity());
				result = measure(r, labels, previous, (System.nanoTime() - t0));
			} catch (final RuntimeException e) {
				throw radiusFailed(r, e);
			} catch (final Error e) {
				// usually OutOfMemoryError on a large stack
				throw radiusFailed(r, e);
			}
			results.add(result);
			previous = labels;
			IJ.log(result.toString());
			final double percent = SWEEP_PERCENT * (i + 1) / sweep.length;
			IJ.showProgress(percent / 100);
			if (listener != null)
				listener.radiusCompleted(ProgressEvent.of(result, percent));
		}

		if (cancellation != null)
			cancellation.check(sweep.length);
		IJ.showStatus("Selecting radius...");
		IJ.showProgress(0.95);
		final RadiusSelection selection = RadiusSelector.select(results, config.getSelection());
		IJ.log("Selected r=" + selection.getRadius() + " (" + selection.getMethod() + ", " + selection.getReason()
				+ "): " + selection.getExplanation());

		final OptimizationResult best = findResult(results, selection.getRadius());
		warnParticleCount(best);

		LabelVolume bestLabels = null;
		if (config.isKeepBestLabels()) {
			if (sweep[sweep.length - 1] == selection.getRadius()) {
				bestLabels = previous;
			} else {
				try {
					bestLabels = splitter.split(selection.getRadius(), config.getSeedConnectivity());
				} catch (final RuntimeException e) {
					throw radiusFailed(selection.getRadius(), e);
				} catch (final Error e) {
					throw radiusFailed(selection.getRadius(), e);
				}
			}
		}
		final double total = (System.nanoTime() - start) / 1e9;
		IJ.log(String.format(Locale.US, "Radius optimisation completed in %.1f s", total));
		IJ.showProgress(1.0);
		IJ.showStatus("Radius optimisation complete");
		return new OptimizationSummary(results, selection, total, bestLabels);
	}

	/**
	 * Run a sweep and report its outcome to a listener instead of returning
	 * it. Exactly one of completed, cancelled or failed is called.
	 */
	public void run(final Volume volume, final int[] radii, final ProgressListener progress,
			final Cancellation cancellation, final OptimizationListener outcome) {
		final OptimizationSummary summary;
		try {
			summary = optimize(volume, radii, progress, cancellation);
		} catch (final OptimizationCancelledException e) {
			IJ.log(e.getMessage());
			outcome.cancelled();
			return;
		} catch (final RuntimeException e) {
			outcome.failed(e);
			return;
		} catch (final Error e) {
			IJ.log("Radius optimisation failed: " + e);
			outcome.failed(e);
			return;
		}
		outcome.completed(summary);
	}

	/**
	 * Check the inputs and put the radii in sweep order
	 *
	 * @return sorted radii without duplicates
	 */
	int[] validate(final Volume volume, final int[] radii) {
		if (volume == null)
			throw new InvalidInputException("No volume");
		if (volume.getForegroundCount() == 0)
			throw new InvalidInputException("Volume has no foreground");
		if (radii == null || radii.length == 0)
			throw new InvalidInputException("No radii to test");
		for (final int r : radii) {
			if (r < 0)
				throw new InvalidInputException("Radius must not be negative: " + r);
			if (r > config.getMaxRadius())
				throw new InvalidInputException("Radius " + r + " exceeds the limit of " + config.getMaxRadius());
		}
		final int[] sorted = radii.clone();
		Arrays.sort(sorted);
		int n = 0;
		for (int i = 0; i < sorted.length; i++)
			if (i == 0 || sorted[i] != sorted[i - 1])
				sorted[n++] = sorted[i];
		final int[] sweep = Arrays.copyOf(sorted, n);
		if (!Arrays.equals(sweep, radii))
			IJ.log("Radii " + Arrays.toString(radii) + " will be tested as " + Arrays.toString(sweep));
		return sweep;
	}

	/**
	 * Measure one label volume
	 */
	OptimizationResult measure(final int radius, final LabelVolume labels, final LabelVolume previous,
			final long elapsedNanos) {
		final long t0 = System.nanoTime();
		final ParticleVolumes volumes = new ParticleVolumes(labels);
		final int margin = GuardVolume.computeMargin(labels, config.getGuard());
		final GuardPartition partition = GuardVolume.filterInterior(labels, margin);
		final ContactRecord contacts = ContactCounter.count(labels, config.getContactConnectivity());
		final ContactStatistics stats = ContactStatistics.of(contacts, partition.getInteriorIds());
		final double vi = previous == null ? Double.NaN : VariationOfInformation.compute(previous, labels);
		final long[] v = volumes.getVolumes();
		if (IJ.debugMode)
			IJ.log("r=" + radius + ": margin " + margin + ", " + contacts.getPairCount() + " contact pairs, " + stats);
		final double seconds = (elapsedNanos + System.nanoTime() - t0) / 1e9;
		return new OptimizationResult.Builder(radius)
				.particles(volumes.getParticleCount(), partition.getInteriorCount(), partition.getBoundaryCount())
				.volumes(volumes.getTotalVolume(), volumes.getLargestVolume()).meanContacts(stats.getMean())
				.contactStatistics(stats).guardMargin(margin)
				.dominance(Dominance.hhi(v), Dominance.topShare(v, config.getTopK())).gini(Dominance.gini(v))
				.viToPrevious(vi)
				.processingTime(seconds).build();
	}

	private static OptimizationFailureException radiusFailed(final int radius, final Throwable cause) {
		IJ.log("Radius " + radius + " failed: " + cause);
		return new OptimizationFailureException(radius, cause);
	}

	private void warnParticleCount(final OptimizationResult best) {
		if (best == null)
			return;
		final int n = best.getParticleCount();
		if (n < config.getMinParticles())
			IJ.log("Warning: only " + n + " particles at r=" + best.getRadius() + ", expected at least "
					+ config.getMinParticles() + ". The volume may be under-segmented.");
		else if (n > config.getMaxParticles())
			IJ.log("Warning: " + n + " particles at r=" + best.getRadius() + ", expected at most "
					+ config.getMaxParticles() + ". The volume may be over-segmented.");
	}

	private static OptimizationResult findResult(final List<OptimizationResult> results, final int radius) {
		for (final OptimizationResult r : results)
			if (r.getRadius() == radius)
				return r;
		return null;
	}
}
