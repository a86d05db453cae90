package works.spectest.descriptor;

import works.spectest.values.Atom;

import static java.util.Objects.requireNonNull;

/**
 * A list of {@code (key, value)} tuples in which the given key is paired with
 * a value matching {@link #value}.
 */
public record KeywordListNode(
	Atom key,
	TypeDescriptor value,
	SourceLocation location
) implements TypeDescriptor {
	public KeywordListNode {
		requireNonNull(key);
		requireNonNull(value);
		requireNonNull(location);
	}

	public KeywordListNode(Atom key, TypeDescriptor value) {
		this(key, value, SourceLocation.UNKNOWN);
	}

	@Override
	public String toString() {
		return "keywords<" + key.name() + ": " + value + ">";
	}
}
