package org.ctgrain.optimize;

/**
 * Terminal outcome of a run. Exactly one method is called, once.
 */
public interface OptimizationListener {

	void completed(OptimizationSummary summary);

	void cancelled();

	void failed(Throwable cause);
}
