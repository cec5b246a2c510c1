package org.ctgrain.optimize;

/**
 * A run that could not produce a summary.
 *
 * <p>
 * Either processing one radius failed, in which case the radius is known and
 * the sweep stopped there, or both the constraint selector and the Pareto
 * fallback failed. In the second case the cause is the constraint failure
 * and the fallback failure is attached as a suppressed exception.
 * </p>
 */
public class OptimizationFailureException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** radius value when no single radius is to blame */
	public static final int NO_RADIUS = -1;

	private final int radius;

	/**
	 * Failure while processing one radius
	 */
	public OptimizationFailureException(final int radius, final Throwable cause) {
		super("Processing failed at radius " + radius + ": " + cause.getMessage(), cause);
		this.radius = radius;
	}

	/**
	 * Failure of both selection stages
	 *
	 * @param constraintFailure
	 *            why the constraint selector gave up
	 * @param fallbackFailure
	 *            why the Pareto fallback gave up
	 */
	public OptimizationFailureException(final SelectionException constraintFailure,
			final SelectionException fallbackFailure) {
		super("Radius selection failed: " + constraintFailure.getMessage() + "; fallback: "
				+ fallbackFailure.getMessage(), constraintFailure);
		addSuppressed(fallbackFailure);
		this.radius = NO_RADIUS;
	}

	public int getRadius() {
		return radius;
	}

	public boolean hasRadius() {
		return radius != NO_RADIUS;
	}
}
