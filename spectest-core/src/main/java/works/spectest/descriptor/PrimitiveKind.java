package works.spectest.descriptor;

import java.util.Locale;

public enum PrimitiveKind {
	INTEGER,
	FLOAT,
	BOOLEAN,
	ATOM,

	/**
	 * A bitstring whose length is a whole number of bytes.
	 */
	BINARY,
	BITSTRING,

	/**
	 * Text, represented as {@link String}.
	 */
	STRING,

	/**
	 * Text as a list of integer code points.
	 */
	CHARLIST,
	ANY,
	TERM,
	NULL;

	public String notation() {
		return name().toLowerCase(Locale.ROOT);
	}
}
