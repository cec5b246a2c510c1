package org.ctgrain.optimize;

/**
 * The run was stopped on request before a summary was produced. This is not
 * a failure; no partial summary exists.
 */
public class OptimizationCancelledException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int radiiCompleted;

	public OptimizationCancelledException(final int radiiCompleted) {
		super("Radius optimisation cancelled after " + radiiCompleted + " radii");
		this.radiiCompleted = radiiCompleted;
	}

	/**
	 * @return number of radii fully processed before the run stopped
	 */
	public int getRadiiCompleted() {
		return radiiCompleted;
	}
}
