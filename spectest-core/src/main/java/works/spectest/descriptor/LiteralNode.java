package works.spectest.descriptor;

import java.math.BigInteger;
import works.spectest.values.Atom;
import works.spectest.values.Values;

import static java.util.Objects.requireNonNull;

/**
 * Exactly one value: an {@link Atom} or an integer.
 */
public record LiteralNode(
	Object value,
	SourceLocation location
) implements TypeDescriptor {
	public LiteralNode {
		requireNonNull(value);
		requireNonNull(location);
		if (!(value instanceof Atom
			|| value instanceof Integer
			|| value instanceof Long
			|| value instanceof Short
			|| value instanceof Byte
			|| value instanceof BigInteger)) {
			throw new IllegalArgumentException("Literal must be an atom or an integer; got " + value.getClass().getSimpleName());
		}
	}

	public LiteralNode(Object value) {
		this(value, SourceLocation.UNKNOWN);
	}

	public static LiteralNode atom(String name) {
		return new LiteralNode(Atom.of(name));
	}

	/**
	 * The payload is an {@link Integer} when the value fits, matching generated integers.
	 */
	public static LiteralNode integer(long value) {
		return new LiteralNode(Values.narrow(value));
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
