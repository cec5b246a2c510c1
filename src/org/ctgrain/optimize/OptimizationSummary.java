package org.ctgrain.optimize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ctgrain.volume.LabelVolume;

/**
 * Final outcome of a radius sweep: every per-radius result in ascending
 * radius order, the selected radius and how it was chosen.
 */
public final class OptimizationSummary {

	private final List<OptimizationResult> results;
	private final RadiusSelection selection;
	private final double totalProcessingTime;
	private final LabelVolume bestLabels;

	/**
	 * @param results
	 *            per-radius results, ascending radius; copied
	 * @param selection
	 *            selector outcome
	 * @param totalProcessingTime
	 *            seconds for the whole run
	 * @param bestLabels
	 *            labels of the selected radius, or null if they were not kept
	 */
	public OptimizationSummary(final List<OptimizationResult> results, final RadiusSelection selection,
			final double totalProcessingTime, final LabelVolume bestLabels) {
		this.results = Collections.unmodifiableList(new ArrayList<OptimizationResult>(results));
		this.selection = selection;
		this.totalProcessingTime = totalProcessingTime;
		this.bestLabels = bestLabels;
	}

	public int getBestRadius() {
		return selection.getRadius();
	}

	/**
	 * @return read-only list of results, ascending radius
	 */
	public List<OptimizationResult> getResults() {
		return results;
	}

	/**
	 * @return the result of the given radius, or null if it was not tested
	 */
	public OptimizationResult getResult(final int radius) {
		for (final OptimizationResult r : results)
			if (r.getRadius() == radius)
				return r;
		return null;
	}

	public OptimizationResult getBestResult() {
		return getResult(getBestRadius());
	}

	public SelectionMethod getMethod() {
		return selection.getMethod();
	}

	public SelectionReason getReason() {
		return selection.getReason();
	}

	public String getExplanation() {
		return selection.getExplanation();
	}

	public RadiusSelection getSelection() {
		return selection;
	}

	public double getTotalProcessingTime() {
		return totalProcessingTime;
	}

	public boolean hasBestLabels() {
		return bestLabels != null;
	}

	/**
	 * @return labels of the selected radius, null unless the optimiser was
	 *         asked to keep them
	 */
	public LabelVolume getBestLabels() {
		return bestLabels;
	}
}
