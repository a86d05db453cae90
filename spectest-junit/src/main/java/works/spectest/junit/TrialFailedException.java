package works.spectest.junit;

import org.opentest4j.AssertionFailedError;
import works.spectest.harness.FailureRecord;
import works.spectest.harness.TrialResult;

/**
 * Reports a failed trial to the test framework.
 * When the failure has both an expected descriptor and outputs,
 * IDEs show the descriptor against the actual outputs.
 */
public class TrialFailedException extends AssertionFailedError {
	private final transient TrialResult.Failed result;

	public TrialResult.Failed result() {
		return this.result;
	}

	public FailureRecord failure() {
		return result.failure();
	}

	private TrialFailedException(TrialResult.Failed result) {
		super(fullMessage(result), result.failure().cause());
		this.result = result;
	}

	private TrialFailedException(TrialResult.Failed result, String expected, String actual) {
		super(fullMessage(result), expected, actual, result.failure().cause());
		this.result = result;
	}

	public static TrialFailedException of(TrialResult.Failed result) {
		FailureRecord failure = result.failure();
		if (failure.expectedDescriptor() == null || failure.outputs().isEmpty()) {
			return new TrialFailedException(result);
		}
		return new TrialFailedException(result, failure.expectedDescriptor().toString(), failure.outputs().toString());
	}

	private static String fullMessage(TrialResult.Failed result) {
		return result.kind().displayName() + " trial of " + result.subject()
			+ " failed after " + result.successes() + " successful runs ["
			+ result.failure().kind() + "]: " + result.failure().message();
	}
}
