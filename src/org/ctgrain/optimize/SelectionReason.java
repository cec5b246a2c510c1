package org.ctgrain.optimize;

/**
 * Why a radius was selected. The constraint reasons are listed in priority
 * order.
 */
public enum SelectionReason {
	/** the count peak also has mean contacts in range */
	PEAK_AND_CONTACTS("peak_and_contacts"),
	/** first radius from r* on with mean contacts in range */
	CONTACTS_ONLY("contacts_only"),
	/** the count peak, contacts out of range */
	R_PEAK("r_peak"),
	/** smallest radius meeting the dominance limit */
	R_STAR("r_star"),
	/** no radius met the dominance limit, the largest tested radius */
	MAX_R("max_r"),
	/** chosen by the Pareto fallback */
	PARETO_FALLBACK("pareto-fallback");

	private final String code;

	private SelectionReason(final String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}
}
