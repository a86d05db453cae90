package works.spectest.harness;

/**
 * The outcome of one trial.
 */
public sealed interface TrialResult {
	TrialKind kind();

	String subject();

	/**
	 * @return the number of draws that passed before the trial ended
	 */
	int successes();

	default boolean passed() {
		return this instanceof Passed;
	}

	record Passed(TrialKind kind, String subject, int successes) implements TrialResult {
	}

	record Failed(TrialKind kind, String subject, int successes, FailureRecord failure) implements TrialResult {
	}
}
