package my.finresolver.app.resolve;

/**
 * Matching strategies of the head cascade, most specific first.
 */
public enum CascadeStep {
	EXACT_WITH_INDUSTRY(true, true),
	EXACT_ANY_INDUSTRY(true, false),
	CONTAINS_WITH_INDUSTRY(false, true),
	CONTAINS_ANY_INDUSTRY(false, false);

	private final boolean exact;
	private final boolean industryFiltered;

	CascadeStep(boolean exact, boolean industryFiltered) {
		this.exact = exact;
		this.industryFiltered = industryFiltered;
	}

	public boolean exact() {
		return exact;
	}

	public boolean industryFiltered() {
		return industryFiltered;
	}
}
