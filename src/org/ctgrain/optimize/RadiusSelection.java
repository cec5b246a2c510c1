package org.ctgrain.optimize;

/**
 * Outcome of a radius selector
 */
public final class RadiusSelection {

	private final int radius;
	private final SelectionMethod method;
	private final SelectionReason reason;
	private final String explanation;

	public RadiusSelection(final int radius, final SelectionMethod method, final SelectionReason reason,
			final String explanation) {
		this.radius = radius;
		this.method = method;
		this.reason = reason;
		this.explanation = explanation;
	}

	public int getRadius() {
		return radius;
	}

	public SelectionMethod getMethod() {
		return method;
	}

	public SelectionReason getReason() {
		return reason;
	}

	public String getExplanation() {
		return explanation;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o)
			return true;
		if (!(o instanceof RadiusSelection))
			return false;
		final RadiusSelection s = (RadiusSelection) o;
		return radius == s.radius && method == s.method && reason == s.reason && explanation.equals(s.explanation);
	}

	@Override
	public int hashCode() {
		return ((radius * 31 + method.hashCode()) * 31 + reason.hashCode()) * 31 + explanation.hashCode();
	}

	@Override
	public String toString() {
		return "r=" + radius + " (" + method + ", " + reason + ")";
	}
}
