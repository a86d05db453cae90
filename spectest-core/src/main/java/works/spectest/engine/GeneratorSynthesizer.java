package works.spectest.engine;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectest.descriptor.BoundedIntegerNode;
import works.spectest.descriptor.KeywordListNode;
import works.spectest.descriptor.LiteralNode;
import works.spectest.descriptor.MappingField;
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
import works.spectest.values.Struct;
import works.spectest.values.Tuple;

/**
 * Turns a {@link TypeDescriptor} into an {@link Arbitrary} of values it describes.
 * <p>
 * Every call to {@link Arbitrary#sampleStream()} on the result starts a fresh,
 * independent, unbounded stream.
 * Descriptors that can't be interpreted (unsupported nodes, unresolvable or cyclic references)
 * produce arbitrary terms and a warning rather than an error.
 */
public final class GeneratorSynthesizer {
	private final DescriptorResolver resolver;

	/**
	 * @param resolver used to resolve {@link RemoteRefNode}s
	 */
	public GeneratorSynthesizer(DescriptorResolver resolver) {
		this.resolver = resolver;
	}

	public Arbitrary<Object> generatorFor(TypeDescriptor descriptor) {
		LOGGER.debug("Synthesizing generator for {}", descriptor);
		return new Session(new ReferenceChain(resolver)).generatorFor(descriptor);
	}

	/**
	 * @return argument lists with one independently drawn value per parameter
	 */
	public Arbitrary<List<Object>> argumentsFor(List<TypeDescriptor> parameters) {
		Session session = new Session(new ReferenceChain(resolver));
		return combineArguments(parameters.stream().map(session::generatorFor).toList());
	}

	static Arbitrary<List<Object>> combineArguments(List<Arbitrary<Object>> generators) {
		if (generators.isEmpty()) {
			return Arbitraries.just(List.of());
		}
		return Combinators.combine(generators).as(GeneratorSynthesizer::argumentList);
	}

	private static List<Object> argumentList(List<Object> values) {
		return Collections.unmodifiableList(new ArrayList<>(values));
	}

	static final class Session {
		final ReferenceChain references;

		Session(ReferenceChain references) {
			this.references = references;
		}

		Arbitrary<Object> generatorFor(TypeDescriptor descriptor) {
			if (descriptor instanceof PrimitiveNode node) {
				return primitive(node.kind());
			} else if (descriptor instanceof BoundedIntegerNode node) {
				return Pools.widen(Arbitraries.integers().between(node.generationLowerBound(), node.generationUpperBound()));
			} else if (descriptor instanceof LiteralNode node) {
				return Arbitraries.just(node.value());
			} else if (descriptor instanceof SequenceNode node) {
				return Pools.listsOf(node.element() == null ? Pools.term() : generatorFor(node.element()));
			} else if (descriptor instanceof KeywordListNode node) {
				return generateKeywordList(node);
			} else if (descriptor instanceof TupleNode node) {
				return generateTuple(node);
			} else if (descriptor instanceof MappingNode node) {
				return node.fields().isEmpty() ? Pools.maps() : Pools.widen(generateFields(node.fields()));
			} else if (descriptor instanceof RecordNode node) {
				return Pools.widen(generateFields(node.fields()).map(fields -> new Struct(node.typeName(), fields)));
			} else if (descriptor instanceof UnionNode node) {
				return Pools.oneOf(node.alternatives().stream().map(this::generatorFor).toList());
			} else if (descriptor instanceof RemoteRefNode node) {
				return references.follow(node, this::generatorFor, Pools::term);
			} else if (descriptor instanceof UnsupportedNode node) {
				LOGGER.warn("Unsupported type {} at {}; generating arbitrary terms", node.description(), node.location());
				return Pools.term();
			} else {
				throw new IllegalStateException("Unexpected descriptor: " + descriptor.getClass());
			}
		}

		private static Arbitrary<Object> primitive(PrimitiveKind kind) {
			return switch (kind) {
				case INTEGER -> Pools.integers();
				case FLOAT -> Pools.floats();
				case BOOLEAN -> Pools.booleans();
				case ATOM -> Pools.atoms();
				case BINARY -> Pools.binaries();
				case BITSTRING -> Pools.bitstrings();
				case STRING -> Pools.strings();
				case CHARLIST -> Pools.charlists();
				case ANY, TERM -> Pools.term();
				case NULL -> Arbitraries.just(null);
			};
		}

		/**
		 * Always exactly one pair. Multi-entry keyword lists are never generated.
		 */
		private Arbitrary<Object> generateKeywordList(KeywordListNode node) {
			return generatorFor(node.value()).map(value -> Collections.singletonList(Tuple.of(node.key(), value)));
		}

		private Arbitrary<Object> generateTuple(TupleNode node) {
			if (node.elements().isEmpty()) {
				return Arbitraries.just(Tuple.of());
			}
			List<Arbitrary<Object>> elements = node.elements().stream().map(this::generatorFor).toList();
			return Pools.widen(Combinators.combine(elements).as(Tuple::new));
		}

		/**
		 * Draws every field, optional ones included.
		 * Draws in which two fields happen to produce the same key are discarded.
		 */
		private Arbitrary<Map<Object, Object>> generateFields(List<MappingField> fields) {
			if (fields.isEmpty()) {
				return Arbitraries.just(Map.of());
			}
			List<Arbitrary<SimpleImmutableEntry<Object, Object>>> entries = new ArrayList<>();
			for (MappingField field : fields) {
				entries.add(Combinators.combine(generatorFor(field.key()), generatorFor(field.value()))
					.as((key, value) -> new SimpleImmutableEntry<Object, Object>(key, value)));
			}
			Arbitrary<Map<Object, Object>> maps = Combinators.combine(entries).as(list -> {
				Map<Object, Object> result = new LinkedHashMap<>();
				list.forEach(e -> result.put(e.getKey(), e.getValue()));
				return result;
			});
			if (fields.size() == 1) {
				return maps;
			}
			return maps.filter(m -> m.size() == fields.size());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GeneratorSynthesizer.class);
}
