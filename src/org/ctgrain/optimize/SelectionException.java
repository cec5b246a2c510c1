package org.ctgrain.optimize;

/**
 * Raised by a radius selector that cannot work with the results it was
 * given, for example an empty sweep or a non-finite metric.
 */
public class SelectionException extends Exception {

	private static final long serialVersionUID = 1L;

	public SelectionException(final String message) {
		super(message);
	}
}
