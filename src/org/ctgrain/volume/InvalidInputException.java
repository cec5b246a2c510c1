package org.ctgrain.volume;

/**
 * Thrown before any processing starts when a volume, radius list or setting
 * cannot be used. Nothing has been computed when this is thrown.
 */
public class InvalidInputException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidInputException(final String message) {
		super(message);
	}
}
