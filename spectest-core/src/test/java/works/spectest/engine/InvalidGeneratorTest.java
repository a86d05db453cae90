package works.spectest.engine;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.spectest.descriptor.BoundedIntegerNode;
import works.spectest.descriptor.KeywordListNode;
import works.spectest.descriptor.LiteralNode;
import works.spectest.descriptor.MappingNode;
import works.spectest.descriptor.RecordNode;
import works.spectest.descriptor.RemoteRefNode;
import works.spectest.descriptor.SequenceNode;
import works.spectest.descriptor.TupleNode;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.source.SignatureRegistry;
import works.spectest.values.Atom;
import works.spectest.values.Values;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.spectest.TestDescriptors.ANY;
import static works.spectest.TestDescriptors.ATOM;
import static works.spectest.TestDescriptors.BINARY;
import static works.spectest.TestDescriptors.BITSTRING;
import static works.spectest.TestDescriptors.BOOLEAN;
import static works.spectest.TestDescriptors.CHARLIST;
import static works.spectest.TestDescriptors.FLOAT;
import static works.spectest.TestDescriptors.INTEGER;
import static works.spectest.TestDescriptors.NULL;
import static works.spectest.TestDescriptors.STRING;
import static works.spectest.TestDescriptors.draws;

public class InvalidGeneratorTest {
	static final SignatureRegistry REGISTRY = SignatureRegistry.builder()
		.defineType("Users", "t", RecordNode.of("User", RecordNode.field("name", STRING)))
		.defineType("Users", "id", BoundedIntegerNode.positive())
		.build();

	final InvalidGeneratorSynthesizer invalidGenerators = new InvalidGeneratorSynthesizer(REGISTRY);
	final ValidatorSynthesizer validators = new ValidatorSynthesizer(REGISTRY);

	/**
	 * Descriptors whose invalid generators never produce a valid value.
	 */
	static Stream<TypeDescriptor> disjointDescriptors() {
		return Stream.of(
			INTEGER, FLOAT, BOOLEAN, ATOM, BINARY, BITSTRING, STRING, CHARLIST, NULL,
			BoundedIntegerNode.nonNegative(),
			BoundedIntegerNode.negative(),
			BoundedIntegerNode.between(10, 20),
			new BoundedIntegerNode(null, null),
			LiteralNode.atom("ok"),
			LiteralNode.integer(0),
			new SequenceNode(INTEGER),
			new KeywordListNode(Atom.of("k"), INTEGER),
			TupleNode.of(INTEGER, STRING),
			MappingNode.anyMap(),
			RecordNode.of("User", RecordNode.field("name", STRING)),
			new RemoteRefNode("Users", "t"),
			new RemoteRefNode("Users", "id")
		);
	}

	@ParameterizedTest
	@MethodSource("disjointDescriptors")
	void validatorRejectsInvalidValues(TypeDescriptor descriptor) {
		Predicate<Object> validator = validators.validatorFor(descriptor);
		for (Object value : draws(invalidGenerators.invalidGeneratorFor(descriptor))) {
			assertFalse(validator.test(value), () -> "Invalid value " + Values.inspect(value) + " should not be a valid " + descriptor);
		}
	}

	@Test
	void nonNegative_invalidIntegersAreJustBelowZero() {
		for (Object value : draws(invalidGenerators.invalidGeneratorFor(BoundedIntegerNode.nonNegative()))) {
			if (Values.isIntegral(value)) {
				long i = ((Number) value).longValue();
				assertTrue(-1000 <= i && i <= -1, "Expected [-1000,-1]; got " + i);
			}
		}
	}

	@Test
	void range_invalidIntegersAreOnEitherSide() {
		BoundedIntegerNode range = BoundedIntegerNode.between(10, 20);
		for (Object value : draws(invalidGenerators.invalidGeneratorFor(range))) {
			if (Values.isIntegral(value)) {
				long i = ((Number) value).longValue();
				assertTrue((-990 <= i && i <= 9) || (21 <= i && i <= 1020), "Out of range by at most 1000: " + i);
			}
		}
	}

	@Test
	void extremeBounds_produceLongs() {
		BoundedIntegerNode node = new BoundedIntegerNode(null, Integer.MAX_VALUE);
		Predicate<Object> validator = validators.validatorFor(node);
		for (Object value : draws(invalidGenerators.invalidGeneratorFor(node))) {
			assertFalse(validator.test(value));
			if (Values.isIntegral(value)) {
				assertEquals(Long.class, value.getClass());
			}
		}
	}

	@Test
	void any_drawsFromGenericPool() {
		assertEquals(100, draws(invalidGenerators.invalidGeneratorFor(ANY)).size());
	}

	@Test
	void invalidArguments_everyPositionInvalid() {
		Predicate<Object> integer = validators.validatorFor(INTEGER);
		Predicate<Object> atom = validators.validatorFor(ATOM);
		for (List<Object> args : draws(invalidGenerators.invalidArgumentsFor(List.of(INTEGER, ATOM)))) {
			assertEquals(2, args.size());
			assertFalse(integer.test(args.get(0)));
			assertFalse(atom.test(args.get(1)));
		}
	}
}
