package works.spectest.engine;

import java.util.Map;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;
import works.spectest.descriptor.RecordNode;
import works.spectest.descriptor.RemoteRefNode;
import works.spectest.descriptor.SequenceNode;
import works.spectest.descriptor.TupleNode;
import works.spectest.descriptor.UnionNode;
import works.spectest.source.DescriptorResolver;
import works.spectest.source.SignatureRegistry;
import works.spectest.values.Atom;
import works.spectest.values.Struct;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.spectest.TestDescriptors.BOOLEAN;
import static works.spectest.TestDescriptors.INTEGER;
import static works.spectest.TestDescriptors.NULL;
import static works.spectest.TestDescriptors.STRING;
import static works.spectest.TestDescriptors.draws;

public class RemoteReferenceTest {
	static final RemoteRefNode USER = new RemoteRefNode("Users", "t");
	static final RemoteRefNode TREE = new RemoteRefNode("Trees", "t");
	static final RemoteRefNode PING = new RemoteRefNode("Ping", "t");
	static final RemoteRefNode PONG = new RemoteRefNode("Pong", "t");

	static final SignatureRegistry REGISTRY = SignatureRegistry.builder()
		.defineType("Users", "t", RecordNode.of("User",
			RecordNode.field("name", STRING),
			RecordNode.field("friend", UnionNode.of(NULL, USER))))
		.defineType("Trees", "t", UnionNode.of(INTEGER, TupleNode.of(TREE, TREE)))
		.defineType("Ping", "t", new SequenceNode(PONG))
		.defineType("Pong", "t", new SequenceNode(PING))
		.build();

	final GeneratorSynthesizer generators = new GeneratorSynthesizer(REGISTRY);
	final ValidatorSynthesizer validators = new ValidatorSynthesizer(REGISTRY);
	final InvalidGeneratorSynthesizer invalidGenerators = new InvalidGeneratorSynthesizer(REGISTRY);

	@Test
	void selfReferentialRecord_terminates() {
		Predicate<Object> validator = validators.validatorFor(USER);
		for (Object value : draws(generators.generatorFor(USER))) {
			Struct user = assertInstanceOf(Struct.class, value);
			assertEquals("User", user.typeName());
			assertTrue(validator.test(user));
		}
		assertEquals(100, draws(invalidGenerators.invalidGeneratorFor(USER)).size());
	}

	@Test
	void recursiveUnion_terminates() {
		Predicate<Object> validator = validators.validatorFor(TREE);
		for (Object value : draws(generators.generatorFor(TREE))) {
			assertTrue(validator.test(value));
		}
	}

	@Test
	void mutualRecursion_terminates() {
		Predicate<Object> validator = validators.validatorFor(PING);
		for (Object value : draws(generators.generatorFor(PING))) {
			assertTrue(validator.test(value));
		}
		assertEquals(100, draws(invalidGenerators.invalidGeneratorFor(PING)).size());
	}

	@Test
	void cyclePoint_isPermissive() {
		Predicate<Object> validator = validators.validatorFor(USER);
		Struct withOddFriend = new Struct("User", Map.of(Atom.of("name"), "Ann", Atom.of("friend"), 42));
		assertTrue(validator.test(withOddFriend), "The nested reference is a cycle, so it accepts anything");
	}

	@Test
	void fallbackResolution_usedWhenResolverHasNothing() {
		var ref = new RemoteRefNode("Missing", "t").withFallback(BOOLEAN);
		assertTrue(validators.validatorFor(ref).test(true));
		assertFalse(validators.validatorFor(ref).test(1));
		for (Object value : draws(generators.generatorFor(ref))) {
			assertInstanceOf(Boolean.class, value);
		}
	}

	@Test
	void resolverTakesPrecedenceOverFallback() {
		var ref = USER.withFallback(BOOLEAN);
		assertFalse(validators.validatorFor(ref).test(true));
	}

	@Test
	void unresolvable_isPermissive() {
		var unresolving = new ValidatorSynthesizer(DescriptorResolver.none());
		assertTrue(unresolving.validatorFor(USER).test("anything"));
	}
}
