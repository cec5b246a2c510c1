package org.ctgrain.metrics;

import org.ctgrain.volume.InvalidInputException;

/**
 * Knee detection and smoothing of particle count curves.
 */
public class KneePoint {

	/**
	 * Index of the knee of a curve: both axes are scaled to [0, 1] and the
	 * point lying furthest above the diagonal wins, the first one on ties.
	 *
	 * <p>
	 * Satopaa V, Albrecht J, Irwin D, Raghavan B (2011) Finding a "kneedle" in
	 * a haystack: detecting knee points in system behavior. ICDCS Workshops:
	 * 166-171.
	 * </p>
	 *
	 * @param x
	 *            abscissae, usually radii
	 * @param y
	 *            ordinates, usually particle counts
	 * @return knee index; 0 for fewer than 3 points or when either axis is
	 *         flat
	 */
	public static int detect(final double[] x, final double[] y) {
		if (x.length != y.length)
			throw new InvalidInputException("Curve has " + x.length + " x values and " + y.length + " y values");
		final int n = x.length;
		if (n < 3)
			return 0;
		double xMin = Double.POSITIVE_INFINITY, xMax = Double.NEGATIVE_INFINITY;
		double yMin = Double.POSITIVE_INFINITY, yMax = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < n; i++) {
			xMin = Math.min(xMin, x[i]);
			xMax = Math.max(xMax, x[i]);
			yMin = Math.min(yMin, y[i]);
			yMax = Math.max(yMax, y[i]);
		}
		final double xRange = xMax - xMin;
		final double yRange = yMax - yMin;
		if (!(xRange > 0) || !(yRange > 0))
			return 0;
		int knee = 0;
		double best = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < n; i++) {
			final double diff = (y[i] - yMin) / yRange - (x[i] - xMin) / xRange;
			if (diff > best) {
				best = diff;
				knee = i;
			}
		}
		return knee;
	}

	/**
	 * Trailing moving average: each value becomes the mean of itself and the
	 * <code>window - 1</code> values before it, fewer at the start.
	 *
	 * @param values
	 *            curve to smooth, not modified
	 * @param window
	 *            averaging window; 0 or 1 returns a copy
	 * @return smoothed copy
	 */
	public static double[] smooth(final double[] values, final int window) {
		if (window < 0)
			throw new InvalidInputException("Smoothing window must be >= 0: " + window);
		if (window <= 1)
			return values.clone();
		final double[] out = new double[values.length];
		double sum = 0;
		for (int i = 0; i < values.length; i++) {
			sum += values[i];
			if (i >= window)
				sum -= values[i - window];
			out[i] = sum / Math.min(i + 1, window);
		}
		return out;
	}
}
