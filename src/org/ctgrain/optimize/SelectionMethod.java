package org.ctgrain.optimize;

/**
 * Which stage of the radius selector made the decision
 */
public enum SelectionMethod {
	CONSTRAINT_BASED("constraint-based"), PARETO_FALLBACK("pareto-fallback");

	private final String code;

	private SelectionMethod(final String code) {
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
