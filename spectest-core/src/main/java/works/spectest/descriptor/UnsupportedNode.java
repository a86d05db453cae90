package works.spectest.descriptor;

import static java.util.Objects.requireNonNull;

/**
 * A type the signature source could not translate, such as a function type.
 * The engine treats it as "any value" and logs a warning.
 */
public record UnsupportedNode(
	String description,
	SourceLocation location
) implements TypeDescriptor {
	public UnsupportedNode {
		requireNonNull(description);
		requireNonNull(location);
	}

	public UnsupportedNode(String description) {
		this(description, SourceLocation.UNKNOWN);
	}

	@Override
	public String toString() {
		return "unsupported<" + description + ">";
	}
}
