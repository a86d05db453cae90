package works.spectest.harness;

public enum TrialKind {
	/**
	 * Valid inputs must produce valid outputs.
	 */
	CONFORMANCE("conformance"),

	/**
	 * Two implementations of equivalent signatures must agree on valid inputs.
	 */
	COMPARISON("comparison"),

	/**
	 * Invalid inputs must be rejected.
	 */
	ROBUSTNESS("robustness"),

	/**
	 * A record-transforming function must cope with the record's own definition.
	 */
	RECORD_CONSISTENCY("record consistency");

	private final String displayName;

	TrialKind(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
