package works.spectest.exceptions;

import works.spectest.source.FunctionRef;

/**
 * A {@link works.spectest.source.SignatureSource} has no signature for the requested function.
 */
public class SpecNotFoundException extends Exception {
	private final FunctionRef function;

	public FunctionRef function() {
		return this.function;
	}

	public SpecNotFoundException(FunctionRef function, String message) {
		super(fullMessage(function, message));
		this.function = function;
	}

	public SpecNotFoundException(FunctionRef function, String message, Throwable cause) {
		super(fullMessage(function, message), cause);
		this.function = function;
	}

	private static String fullMessage(FunctionRef function, String message) {
		return "No signature for " + function + ": " + message;
	}
}
