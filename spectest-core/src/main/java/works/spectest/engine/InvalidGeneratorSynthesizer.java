package works.spectest.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectest.descriptor.BoundedIntegerNode;
import works.spectest.descriptor.KeywordListNode;
import works.spectest.descriptor.LiteralNode;
import works.spectest.descriptor.MappingNode;
import works.spectest.descriptor.PrimitiveKind;
import works.spectest.descriptor.PrimitiveNode;
import works.spectest.descriptor.RecordNode;
import works.spectest.descriptor.RemoteRefNode;
import works.spectest.descriptor.SequenceNode;
import works.spectest.descriptor.TupleNode;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.descriptor.UnionNode;
import works.spectest.descriptor.UnsupportedNode;
import works.spectest.source.DescriptorResolver;
import works.spectest.values.Values;

import static works.spectest.descriptor.BoundedIntegerNode.DEFAULT_SPAN;
import static works.spectest.engine.Pools.atoms;
import static works.spectest.engine.Pools.floats;
import static works.spectest.engine.Pools.integers;
import static works.spectest.engine.Pools.listsOf;
import static works.spectest.engine.Pools.maps;
import static works.spectest.engine.Pools.oneOf;
import static works.spectest.engine.Pools.strings;
import static works.spectest.engine.Pools.term;

/**
 * Turns a {@link TypeDescriptor} into an {@link Arbitrary} of values that are
 * <em>probably</em> not members of it.
 * <p>
 * For scalars, bounded integers and literals, the values are guaranteed to be rejected
 * by the corresponding {@link ValidatorSynthesizer validator}.
 * For {@code any}, {@code term}, unions and unsupported types there is no such guarantee:
 * these draw from a generic pool of unrelated values,
 * which for {@code any} and {@code term} are in fact valid.
 */
public final class InvalidGeneratorSynthesizer {
	private final DescriptorResolver resolver;
	private final ValidatorSynthesizer validators;

	public InvalidGeneratorSynthesizer(DescriptorResolver resolver) {
		this.resolver = resolver;
		this.validators = new ValidatorSynthesizer(resolver);
	}

	public Arbitrary<Object> invalidGeneratorFor(TypeDescriptor descriptor) {
		LOGGER.debug("Synthesizing invalid generator for {}", descriptor);
		return new Session(new ReferenceChain(resolver)).invalidGeneratorFor(descriptor);
	}

	/**
	 * @return argument lists in which every position is drawn from its parameter's invalid pool
	 */
	public Arbitrary<List<Object>> invalidArgumentsFor(List<TypeDescriptor> parameters) {
		Session session = new Session(new ReferenceChain(resolver));
		return GeneratorSynthesizer.combineArguments(parameters.stream().map(session::invalidGeneratorFor).toList());
	}

	final class Session {
		final ReferenceChain references;

		Session(ReferenceChain references) {
			this.references = references;
		}

		Arbitrary<Object> invalidGeneratorFor(TypeDescriptor descriptor) {
			if (descriptor instanceof PrimitiveNode node) {
				return primitive(node.kind());
			} else if (descriptor instanceof BoundedIntegerNode node) {
				return outOfBounds(node);
			} else if (descriptor instanceof LiteralNode node) {
				Predicate<Object> literal = validators.validatorFor(node);
				return oneOf(atoms(), integers(), floats(), strings()).filter(v -> !literal.test(v));
			} else if (descriptor instanceof SequenceNode || descriptor instanceof KeywordListNode) {
				return oneOf(integers(), floats(), strings(), atoms(), maps());
			} else if (descriptor instanceof TupleNode) {
				return oneOf(integers(), floats(), strings(), atoms(), listsOf(term()), maps());
			} else if (descriptor instanceof MappingNode || descriptor instanceof RecordNode) {
				return nonMaps();
			} else if (descriptor instanceof UnionNode || descriptor instanceof UnsupportedNode) {
				return generic();
			} else if (descriptor instanceof RemoteRefNode node) {
				return references.follow(node, this::resolvedReference, InvalidGeneratorSynthesizer::nonMaps);
			} else {
				throw new IllegalStateException("Unexpected descriptor: " + descriptor.getClass());
			}
		}

		private Arbitrary<Object> resolvedReference(TypeDescriptor resolved) {
			if (resolved instanceof RecordNode) {
				return nonMaps();
			}
			return invalidGeneratorFor(resolved);
		}
	}

	private static Arbitrary<Object> primitive(PrimitiveKind kind) {
		return switch (kind) {
			case INTEGER -> oneOf(floats(), strings(), atoms(), listsOf(integers()), maps());
			case FLOAT -> oneOf(integers(), strings(), atoms(), listsOf(floats()), maps());
			case BOOLEAN -> oneOf(integers(), floats(), strings(), listsOf(atoms()));
			case BINARY -> oneOf(integers(), floats(), atoms(), listsOf(term()), maps());
			case BITSTRING -> oneOf(integers(), atoms(), maps());
			case ATOM -> oneOf(integers(), floats(), strings(), listsOf(term()), maps());
			case STRING -> oneOf(integers(), floats(), atoms(), listsOf(term()), maps());
			case CHARLIST -> oneOf(integers(), floats(), strings(), atoms(), maps());
			case NULL -> oneOf(integers(), floats(), strings(), atoms(), listsOf(term()));
			case ANY, TERM -> generic();
		};
	}

	/**
	 * Integers just outside whichever bounds are present, plus non-integers.
	 */
	private static Arbitrary<Object> outOfBounds(BoundedIntegerNode node) {
		List<Arbitrary<Object>> choices = new ArrayList<>();
		if (node.lowerBound() != null) {
			long lower = node.lowerBound();
			choices.add(Pools.widen(Arbitraries.longs().between(lower - DEFAULT_SPAN, lower - 1).map(Values::narrow)));
		}
		if (node.upperBound() != null) {
			long upper = node.upperBound();
			choices.add(Pools.widen(Arbitraries.longs().between(upper + 1, upper + DEFAULT_SPAN).map(Values::narrow)));
		}
		choices.add(floats());
		choices.add(strings());
		choices.add(atoms());
		return oneOf(choices);
	}

	private static Arbitrary<Object> nonMaps() {
		return oneOf(integers(), floats(), strings(), atoms(), listsOf(term()));
	}

	private static Arbitrary<Object> generic() {
		return oneOf(integers(), floats(), strings(), atoms(), listsOf(term()), maps());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InvalidGeneratorSynthesizer.class);
}
