package org.ctgrain.optimize;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between the caller and a running optimisation.
 * The optimiser looks at it between radii, never in the middle of one.
 */
public class Cancellation {

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	/**
	 * Ask the run to stop at the next radius boundary. May be called from any
	 * thread, any number of times.
	 */
	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	void check(final int radiiCompleted) throws OptimizationCancelledException {
		if (cancelled.get())
			throw new OptimizationCancelledException(radiiCompleted);
	}
}
