package org.ctgrain.io;

import org.ctgrain.contact.ContactStatistics;
import org.ctgrain.optimize.OptimizationResult;
import org.ctgrain.optimize.OptimizationSummary;

import ij.measure.ResultsTable;

/**
 * Puts the outcome of a radius sweep into ImageJ results tables, from where
 * it can be shown or saved as CSV with ImageJ's own writers.
 */
public class SummaryTable {

	public static final String RADIUS = "Radius";
	public static final String PARTICLES = "Particles";
	public static final String LARGEST_RATIO = "Largest ratio";
	public static final String MEAN_CONTACTS = "Mean contacts";
	public static final String INTERIOR = "Interior";
	public static final String EXCLUDED = "Excluded";
	public static final String TOTAL_VOLUME = "Total volume (vox)";
	public static final String LARGEST_VOLUME = "Largest volume (vox)";
	public static final String MARGIN = "Guard margin (vox)";
	public static final String HHI = "HHI";
	public static final String TOP_SHARE = "Top-k share";
	public static final String GINI = "Gini";
	public static final String VI = "VI to previous (bits)";
	public static final String MEDIAN_CONTACTS = "Median contacts";
	public static final String SD_CONTACTS = "SD contacts";
	public static final String MIN_CONTACTS = "Min contacts";
	public static final String MAX_CONTACTS = "Max contacts";
	public static final String TIME = "Time (s)";
	public static final String SELECTED = "Selected";

	/**
	 * One row per tested radius, labelled "r=<i>radius</i>"
	 *
	 * @param summary
	 *            finished sweep
	 * @return new table
	 */
	public static ResultsTable perRadius(final OptimizationSummary summary) {
		final ResultsTable rt = new ResultsTable();
		rt.setNaNEmptyCells(true);
		for (final OptimizationResult r : summary.getResults()) {
			final ContactStatistics c = r.getContactStatistics();
			rt.incrementCounter();
			rt.addLabel("r=" + r.getRadius());
			rt.addValue(RADIUS, r.getRadius());
			rt.addValue(PARTICLES, r.getParticleCount());
			rt.addValue(LARGEST_RATIO, r.getLargestParticleRatio());
			rt.addValue(MEAN_CONTACTS, r.getMeanContacts());
			rt.addValue(INTERIOR, r.getInteriorParticleCount());
			rt.addValue(EXCLUDED, r.getExcludedParticleCount());
			rt.addValue(TOTAL_VOLUME, r.getTotalVolume());
			rt.addValue(LARGEST_VOLUME, r.getLargestParticleVolume());
			rt.addValue(MARGIN, r.getGuardMargin());
			rt.addValue(HHI, r.getHhi());
			rt.addValue(TOP_SHARE, r.getTopShare());
			rt.addValue(GINI, r.getGini());
			rt.addValue(VI, r.getViToPrevious());
			rt.addValue(MEDIAN_CONTACTS, c.getMedian());
			rt.addValue(SD_CONTACTS, c.getStandardDeviation());
			rt.addValue(MIN_CONTACTS, c.getMin());
			rt.addValue(MAX_CONTACTS, c.getMax());
			rt.addValue(TIME, r.getProcessingTime());
			rt.addValue(SELECTED, r.getRadius() == summary.getBestRadius() ? 1 : 0);
		}
		return rt;
	}

	/**
	 * A single row describing the decision
	 *
	 * @param summary
	 *            finished sweep
	 * @param title
	 *            row label, usually the image title
	 * @return new table
	 */
	public static ResultsTable selection(final OptimizationSummary summary, final String title) {
		final ResultsTable rt = new ResultsTable();
		rt.incrementCounter();
		rt.addLabel(title);
		rt.addValue("Best radius", summary.getBestRadius());
		rt.addValue("Method", summary.getMethod().getCode());
		rt.addValue("Reason", summary.getReason().getCode());
		final OptimizationResult best = summary.getBestResult();
		if (best != null) {
			rt.addValue(PARTICLES, best.getParticleCount());
			rt.addValue(LARGEST_RATIO, best.getLargestParticleRatio());
			rt.addValue(MEAN_CONTACTS, best.getMeanContacts());
		}
		rt.addValue("Total time (s)", summary.getTotalProcessingTime());
		rt.addValue("Explanation", summary.getExplanation());
		return rt;
	}
}
