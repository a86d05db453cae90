package works.spectest.descriptor;

import static java.util.Objects.requireNonNull;

/**
 * Where a descriptor came from. Carried for diagnostics only;
 * {@link Equivalence} ignores it.
 */
public record SourceLocation(String origin, int line) {
	public static final SourceLocation UNKNOWN = new SourceLocation("unknown", 0);

	public SourceLocation {
		requireNonNull(origin);
	}

	public static SourceLocation of(String origin) {
		return new SourceLocation(origin, 0);
	}

	@Override
	public String toString() {
		return line == 0 ? origin : origin + ":" + line;
	}
}
