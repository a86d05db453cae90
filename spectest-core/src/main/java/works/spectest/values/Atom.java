package works.spectest.values;

import static java.util.Objects.requireNonNull;

/**
 * An interned-style symbolic constant, compared by name.
 */
public record Atom(String name) implements Comparable<Atom> {
	public Atom {
		requireNonNull(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Atom name can't be empty");
		}
	}

	public static Atom of(String name) {
		return new Atom(name);
	}

	@Override
	public int compareTo(Atom other) {
		return name.compareTo(other.name);
	}

	@Override
	public String toString() {
		return ":" + name;
	}
}
