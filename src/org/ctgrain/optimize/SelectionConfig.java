package org.ctgrain.optimize;

import org.ctgrain.volume.InvalidInputException;

/**
 * Policy of the radius selector, immutable.
 */
public final class SelectionConfig {

	public static final double DEFAULT_TAU_RATIO = 0.03;
	public static final double DEFAULT_CONTACT_MIN = 5;
	public static final double DEFAULT_CONTACT_MAX = 9;
	public static final int DEFAULT_SMOOTHING_WINDOW = 0;
	public static final double DEFAULT_TARGET_CONTACTS = 6.0;

	public static final SelectionConfig DEFAULT = new SelectionConfig(DEFAULT_TAU_RATIO, DEFAULT_CONTACT_MIN,
			DEFAULT_CONTACT_MAX, DEFAULT_SMOOTHING_WINDOW, DEFAULT_TARGET_CONTACTS);

	private final double tauRatio;
	private final double contactMin;
	private final double contactMax;
	private final int smoothingWindow;
	private final double targetContacts;

	/**
	 * @param tauRatio
	 *            largest acceptable share of the biggest particle, in [0, 1]
	 * @param contactMin
	 *            lower end of the acceptable mean contact range
	 * @param contactMax
	 *            upper end, inclusive
	 * @param smoothingWindow
	 *            moving-average window applied to particle counts; 0 or 1
	 *            for none
	 * @param targetContacts
	 *            contact number preferred by the Pareto tie-break
	 * @throws InvalidInputException
	 *             if a value is out of range or contactMin > contactMax
	 */
	public SelectionConfig(final double tauRatio, final double contactMin, final double contactMax,
			final int smoothingWindow, final double targetContacts) {
		if (!(tauRatio >= 0 && tauRatio <= 1))
			throw new InvalidInputException("tau ratio must lie in [0, 1]: " + tauRatio);
		if (!isFinite(contactMin) || !isFinite(contactMax))
			throw new InvalidInputException("Contact range must be finite: [" + contactMin + ", " + contactMax + "]");
		if (contactMin > contactMax)
			throw new InvalidInputException("Contact range minimum " + contactMin + " exceeds maximum " + contactMax);
		if (smoothingWindow < 0)
			throw new InvalidInputException("Smoothing window must be >= 0: " + smoothingWindow);
		if (!isFinite(targetContacts))
			throw new InvalidInputException("Target contacts must be finite: " + targetContacts);
		this.tauRatio = tauRatio;
		this.contactMin = contactMin;
		this.contactMax = contactMax;
		this.smoothingWindow = smoothingWindow;
		this.targetContacts = targetContacts;
	}

	public SelectionConfig(final double tauRatio, final double contactMin, final double contactMax) {
		this(tauRatio, contactMin, contactMax, DEFAULT_SMOOTHING_WINDOW, DEFAULT_TARGET_CONTACTS);
	}

	private static boolean isFinite(final double v) {
		return !Double.isNaN(v) && !Double.isInfinite(v);
	}

	public double getTauRatio() {
		return tauRatio;
	}

	public double getContactMin() {
		return contactMin;
	}

	public double getContactMax() {
		return contactMax;
	}

	/**
	 * @return true if the mean contact number lies in [min, max]
	 */
	public boolean contactsInRange(final double meanContacts) {
		return meanContacts >= contactMin && meanContacts <= contactMax;
	}

	public int getSmoothingWindow() {
		return smoothingWindow;
	}

	public boolean isSmoothing() {
		return smoothingWindow > 1;
	}

	public double getTargetContacts() {
		return targetContacts;
	}

	@Override
	public String toString() {
		return "tau=" + tauRatio + ", contacts=[" + contactMin + ", " + contactMax + "], smoothing="
				+ (isSmoothing() ? smoothingWindow : "none");
	}
}
