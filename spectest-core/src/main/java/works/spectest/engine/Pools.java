package works.spectest.engine;

import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import works.spectest.values.Atom;
import works.spectest.values.Bitstring;
import works.spectest.values.Tuple;

/**
 * Canonical arbitraries for each kind of value,
 * shared by the valid and invalid generator synthesizers.
 */
final class Pools {
	static final int MAX_COLLECTION_SIZE = 6;
	static final int MAX_CODE_POINT = 1_114_111;
	static final int TERM_DEPTH = 2;

	private Pools() {}

	static Arbitrary<Object> integers() {
		return widen(Arbitraries.integers());
	}

	static Arbitrary<Object> floats() {
		return widen(Arbitraries.doubles());
	}

	static Arbitrary<Object> booleans() {
		return widen(Arbitraries.of(Boolean.TRUE, Boolean.FALSE));
	}

	static Arbitrary<Object> atoms() {
		return widen(atomValues());
	}

	static Arbitrary<Atom> atomValues() {
		return Arbitraries.strings()
			.alpha()
			.numeric()
			.withChars('_')
			.ofMinLength(1)
			.ofMaxLength(12)
			.map(Atom::of);
	}

	static Arbitrary<Object> strings() {
		return widen(Arbitraries.strings().withCharRange(' ', '~').ofMaxLength(20));
	}

	static Arbitrary<Object> binaries() {
		return widen(byteArrays().map(Bitstring::binary));
	}

	static Arbitrary<Object> bitstrings() {
		return widen(Combinators.combine(byteArrays(), Arbitraries.integers().between(0, 7))
			.as((bytes, trim) -> Bitstring.of(bytes, Math.max(0, bytes.length * 8 - trim))));
	}

	static Arbitrary<Object> charlists() {
		return widen(Arbitraries.integers().between(0, MAX_CODE_POINT).list().ofMaxSize(MAX_COLLECTION_SIZE));
	}

	static Arbitrary<Object> listsOf(Arbitrary<?> elements) {
		return widen(elements.list().ofMaxSize(MAX_COLLECTION_SIZE));
	}

	static Arbitrary<Object> tuplesOf(Arbitrary<Object> elements) {
		return widen(elements.list().ofMaxSize(4).map(Tuple::new));
	}

	/**
	 * Maps from atoms to arbitrary terms.
	 */
	static Arbitrary<Object> maps() {
		return widen(Arbitraries.maps(atomValues(), term(TERM_DEPTH - 1)).ofMaxSize(4));
	}

	/**
	 * Any value at all, nested at most {@link #TERM_DEPTH} levels.
	 */
	static Arbitrary<Object> term() {
		return term(TERM_DEPTH);
	}

	private static Arbitrary<Object> term(int depth) {
		List<Arbitrary<Object>> choices = new ArrayList<>(List.of(
			integers(), floats(), booleans(), atoms(), strings(), binaries()));
		if (depth > 0) {
			Arbitrary<Object> inner = term(depth - 1);
			choices.add(listsOf(inner));
			choices.add(tuplesOf(inner));
			choices.add(widen(Arbitraries.maps(atomValues(), inner).ofMaxSize(3)));
		}
		return Arbitraries.oneOf(choices);
	}

	static Arbitrary<Object> oneOf(List<Arbitrary<Object>> choices) {
		if (choices.size() == 1) {
			return choices.get(0);
		}
		return Arbitraries.oneOf(choices);
	}

	@SafeVarargs
	static Arbitrary<Object> oneOf(Arbitrary<Object>... choices) {
		return oneOf(List.of(choices));
	}

	static Arbitrary<Object> widen(Arbitrary<?> arbitrary) {
		return arbitrary.map(v -> (Object) v);
	}

	private static Arbitrary<byte[]> byteArrays() {
		return Arbitraries.bytes().array(byte[].class).ofMaxSize(8);
	}
}
