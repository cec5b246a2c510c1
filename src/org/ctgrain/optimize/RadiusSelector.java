package org.ctgrain.optimize;

import java.util.List;

import ij.IJ;

/**
 * Two-stage radius choice: the constraint rules, and the Pareto search when
 * the rules reject their input.
 */
public class RadiusSelector {

	/**
	 * @param results
	 *            sweep results in ascending radius order
	 * @param config
	 *            selection policy
	 * @return selected radius, method and reason
	 * @throws OptimizationFailureException
	 *             if both stages fail; the constraint failure is the cause
	 *             and the fallback failure is suppressed
	 */
	public static RadiusSelection select(final List<OptimizationResult> results, final SelectionConfig config) {
		try {
			return ConstraintSelector.select(results, config);
		} catch (final SelectionException constraintFailure) {
			IJ.log("Constraint-based selection failed (" + constraintFailure.getMessage()
					+ "), falling back to Pareto selection");
			try {
				return ParetoSelector.select(results, config.getTargetContacts());
			} catch (final SelectionException fallbackFailure) {
				throw new OptimizationFailureException(constraintFailure, fallbackFailure);
			}
		}
	}
}
