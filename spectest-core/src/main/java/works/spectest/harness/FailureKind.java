package works.spectest.harness;

public enum FailureKind {
	/**
	 * No signature could be found for the function.
	 */
	SPEC_NOT_FOUND,

	/**
	 * Two functions being compared have non-equivalent signatures.
	 */
	SPEC_MISMATCH,

	/**
	 * An output didn't satisfy the declared return type.
	 */
	VALIDATION_FAILURE,

	/**
	 * Two implementations produced different outputs for the same input,
	 * or exactly one of them produced an invalid output.
	 */
	RESULT_DIVERGENCE,

	/**
	 * An implementation returned normally from an invalid input.
	 */
	INVALID_INPUT_ACCEPTED,

	/**
	 * An implementation threw an exception on a valid input.
	 */
	IMPLEMENTATION_ERROR,

	/**
	 * A function's signature disagrees with the record definition it operates on,
	 * and the function's behaviour exposes the disagreement.
	 */
	TYPE_INCONSISTENCY,
}
