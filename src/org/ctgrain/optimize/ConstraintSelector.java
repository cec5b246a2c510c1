package org.ctgrain.optimize;

import java.util.List;
import java.util.Locale;

import org.ctgrain.metrics.KneePoint;

/**
 * Rule-based radius choice from a finished sweep.
 *
 * <p>
 * A radius is eligible when it has particles and its largest particle holds
 * no more than tau of the particle volume. r* is the smallest eligible
 * radius. R_peak is the eligible radius from r* on with the most particles
 * (after optional smoothing), the smallest one on ties; it exists only when
 * the counts of the eligible radii are not all equal. The rules, first match
 * wins:
 * </p>
 * <ol>
 * <li>R_peak with mean contacts in range: peak_and_contacts</li>
 * <li>the first eligible radius from r* on with mean contacts in range:
 * contacts_only</li>
 * <li>R_peak: r_peak</li>
 * <li>r*: r_star</li>
 * <li>the largest tested radius: max_r</li>
 * </ol>
 */
public class ConstraintSelector {

	/**
	 * @param results
	 *            sweep results in ascending radius order
	 * @param config
	 *            selection policy
	 * @return selected radius and reason
	 * @throws SelectionException
	 *             if the results are empty, out of order or hold non-finite
	 *             metrics
	 */
	public static RadiusSelection select(final List<OptimizationResult> results, final SelectionConfig config)
			throws SelectionException {
		validate(results);
		final int n = results.size();
		final double tau = config.getTauRatio();

		final boolean[] eligible = new boolean[n];
		int rStar = -1;
		for (int i = 0; i < n; i++) {
			final OptimizationResult r = results.get(i);
			eligible[i] = r.getParticleCount() > 0 && r.getLargestParticleRatio() <= tau;
			if (eligible[i] && rStar < 0)
				rStar = i;
		}
		if (rStar < 0) {
			final OptimizationResult last = results.get(n - 1);
			return choose(last, SelectionReason.MAX_R, String.format(Locale.US,
					"No radius reached a largest particle ratio <= %.3f; using the largest tested radius r=%d",
					tau, last.getRadius()));
		}

		final double[] counts = new double[n];
		for (int i = 0; i < n; i++)
			counts[i] = results.get(i).getParticleCount();
		final double[] curve = KneePoint.smooth(counts, config.getSmoothingWindow());

		int peak = -1;
		boolean varies = false;
		for (int i = rStar; i < n; i++) {
			if (!eligible[i])
				continue;
			if (peak < 0) {
				peak = i;
				continue;
			}
			if (curve[i] != curve[peak])
				varies = true;
			if (curve[i] > curve[peak])
				peak = i;
		}
		if (!varies)
			peak = -1;

		if (peak >= 0) {
			final OptimizationResult p = results.get(peak);
			if (config.contactsInRange(p.getMeanContacts()))
				return choose(p, SelectionReason.PEAK_AND_CONTACTS,
						String.format(Locale.US,
								"Particle count peaks at r=%d (%d particles) with mean contacts %.2f in [%s, %s]",
								p.getRadius(), p.getParticleCount(), p.getMeanContacts(),
								fmt(config.getContactMin()), fmt(config.getContactMax())));
		}

		for (int i = rStar; i < n; i++) {
			if (!eligible[i])
				continue;
			final OptimizationResult r = results.get(i);
			if (config.contactsInRange(r.getMeanContacts()))
				return choose(r, SelectionReason.CONTACTS_ONLY,
						String.format(Locale.US, "First radius from r*=%d with mean contacts in [%s, %s]: r=%d (%.2f)",
								results.get(rStar).getRadius(), fmt(config.getContactMin()),
								fmt(config.getContactMax()), r.getRadius(), r.getMeanContacts()));
		}

		if (peak >= 0) {
			final OptimizationResult p = results.get(peak);
			return choose(p, SelectionReason.R_PEAK,
					String.format(Locale.US,
							"Particle count peaks at r=%d (%d particles); no radius has mean contacts in range",
							p.getRadius(), p.getParticleCount()));
		}

		final OptimizationResult s = results.get(rStar);
		return choose(s, SelectionReason.R_STAR,
				String.format(Locale.US,
						"Smallest radius with largest particle ratio <= %.3f: r=%d (%.4f); no count peak, contacts out of range",
						tau, s.getRadius(), s.getLargestParticleRatio()));
	}

	private static RadiusSelection choose(final OptimizationResult r, final SelectionReason reason,
			final String explanation) {
		return new RadiusSelection(r.getRadius(), SelectionMethod.CONSTRAINT_BASED, reason, explanation);
	}

	static void validate(final List<OptimizationResult> results) throws SelectionException {
		if (results == null || results.isEmpty())
			throw new SelectionException("No results to select from");
		int previous = -1;
		for (final OptimizationResult r : results) {
			if (r == null)
				throw new SelectionException("Missing result after radius " + previous);
			if (r.getRadius() <= previous)
				throw new SelectionException(
						"Radii are not in ascending order: " + r.getRadius() + " after " + previous);
			previous = r.getRadius();
			final double ratio = r.getLargestParticleRatio();
			final double contacts = r.getMeanContacts();
			if (Double.isNaN(ratio) || Double.isInfinite(ratio))
				throw new SelectionException("Largest particle ratio is not finite at r=" + r.getRadius());
			if (Double.isNaN(contacts) || Double.isInfinite(contacts))
				throw new SelectionException("Mean contacts is not finite at r=" + r.getRadius());
		}
	}

	private static String fmt(final double v) {
		if (v == Math.rint(v))
			return Long.toString((long) v);
		return Double.toString(v);
	}
}
