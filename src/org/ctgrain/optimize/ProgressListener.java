package org.ctgrain.optimize;

/**
 * Receives progress of a radius sweep on the optimiser's own thread.
 * Implementations must return quickly; slow consumers should sit behind a
 * {@link QueuedProgressListener}.
 */
public interface ProgressListener {

	void radiusCompleted(ProgressEvent event);
}
