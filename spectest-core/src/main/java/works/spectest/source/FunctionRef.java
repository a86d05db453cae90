package works.spectest.source;

import static java.util.Objects.requireNonNull;

/**
 * Names a function by its owner (for reflection, the class's binary name) and its own name.
 */
public record FunctionRef(String owner, String name) {
	public FunctionRef {
		requireNonNull(owner);
		requireNonNull(name);
	}

	public static FunctionRef of(Class<?> owner, String name) {
		return new FunctionRef(owner.getName(), name);
	}

	@Override
	public String toString() {
		return owner + "::" + name;
	}
}
