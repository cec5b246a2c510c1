package org.ctgrain.optimize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.ctgrain.metrics.KneePoint;

/**
 * Multi-objective radius choice, used when the constraint rules cannot run.
 *
 * <p>
 * Three objectives are minimised for every radius: dominance (HHI of the
 * particle volumes), distance in sweep positions from the knee of the
 * particle count curve, and instability (mean variation of information to
 * the neighbouring radii). Each objective is scaled to [0, 1] on its own;
 * among the radii no other radius dominates, the one closest to the origin
 * wins. Remaining ties go to the smaller radius, then the lower HHI, then
 * the mean contacts nearest the target.
 * </p>
 */
public class ParetoSelector {

	/** HHI assumed for a radius whose HHI is unknown */
	private static final double WORST_HHI = 1.0;

	/**
	 * @param results
	 *            sweep results in ascending radius order
	 * @param targetContacts
	 *            preferred mean contact number for the last tie-break
	 * @return selected radius
	 * @throws SelectionException
	 *             if there are no results
	 */
	public static RadiusSelection select(final List<OptimizationResult> results, final double targetContacts)
			throws SelectionException {
		if (results == null || results.isEmpty())
			throw new SelectionException("No results for the Pareto fallback");
		final int n = results.size();
		for (final OptimizationResult r : results)
			if (r == null)
				throw new SelectionException("Missing result in the Pareto fallback");

		final double[] radii = new double[n];
		final double[] counts = new double[n];
		for (int i = 0; i < n; i++) {
			radii[i] = results.get(i).getRadius();
			counts[i] = results.get(i).getParticleCount();
		}
		final int knee = KneePoint.detect(radii, counts);

		final double[] hhi = new double[n];
		final double[] kneeDistance = new double[n];
		final double[] instability = new double[n];
		for (int i = 0; i < n; i++) {
			final OptimizationResult r = results.get(i);
			hhi[i] = isFinite(r.getHhi()) ? r.getHhi() : WORST_HHI;
			kneeDistance[i] = Math.abs(i - knee);
			double sum = 0;
			int terms = 0;
			// VI to the previous radius is stored on this result, to the next on the next one
			if (i > 0 && isFinite(r.getViToPrevious())) {
				sum += r.getViToPrevious();
				terms++;
			}
			if (i + 1 < n && isFinite(results.get(i + 1).getViToPrevious())) {
				sum += results.get(i + 1).getViToPrevious();
				terms++;
			}
			instability[i] = terms == 0 ? 0 : sum / terms;
		}

		final double[][] objectives = { normalise(hhi), normalise(kneeDistance), normalise(instability) };

		final List<Integer> candidates = new ArrayList<Integer>();
		for (int i = 0; i < n; i++) {
			boolean dominated = false;
			for (int j = 0; j < n && !dominated; j++)
				if (j != i && dominates(objectives, j, i))
					dominated = true;
			if (!dominated)
				candidates.add(i);
		}
		// every finite set has a non-dominated point
		int best = candidates.get(0);
		for (final int c : candidates)
			if (better(c, best, objectives, hhi, results, targetContacts))
				best = c;

		final OptimizationResult b = results.get(best);
		final String explanation = String.format(Locale.US,
				"Pareto+distance selection: r=%d; knee@r=%d, HHI=%.3f, knee_dist=%.0f, instabVI=%.3f", b.getRadius(),
				results.get(knee).getRadius(), hhi[best], kneeDistance[best], instability[best]);
		return new RadiusSelection(b.getRadius(), SelectionMethod.PARETO_FALLBACK, SelectionReason.PARETO_FALLBACK,
				explanation);
	}

	/**
	 * Scale values to [0, 1]; a constant objective becomes all zeros
	 */
	static double[] normalise(final double[] values) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : values) {
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		final double[] out = new double[values.length];
		if (!(max > min))
			return out;
		for (int i = 0; i < values.length; i++)
			out[i] = (values[i] - min) / (max - min);
		return out;
	}

	private static boolean dominates(final double[][] objectives, final int a, final int b) {
		boolean strictly = false;
		for (final double[] o : objectives) {
			if (o[a] > o[b])
				return false;
			if (o[a] < o[b])
				strictly = true;
		}
		return strictly;
	}

	private static double distance(final double[][] objectives, final int i) {
		double sum = 0;
		for (final double[] o : objectives)
			sum += o[i] * o[i];
		return Math.sqrt(sum);
	}

	private static boolean better(final int a, final int b, final double[][] objectives, final double[] hhi,
			final List<OptimizationResult> results, final double targetContacts) {
		final double da = distance(objectives, a);
		final double db = distance(objectives, b);
		if (da != db)
			return da < db;
		final int ra = results.get(a).getRadius();
		final int rb = results.get(b).getRadius();
		if (ra != rb)
			return ra < rb;
		if (hhi[a] != hhi[b])
			return hhi[a] < hhi[b];
		return contactGap(results.get(a), targetContacts) < contactGap(results.get(b), targetContacts);
	}

	private static double contactGap(final OptimizationResult r, final double target) {
		final double c = r.getMeanContacts();
		return Math.abs((isFinite(c) ? c : 0) - target);
	}

	private static boolean isFinite(final double v) {
		return !Double.isNaN(v) && !Double.isInfinite(v);
	}
}
