package works.spectest.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
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
import works.spectest.values.Atom;
import works.spectest.values.Bitstring;
import works.spectest.values.Struct;
import works.spectest.values.Tuple;
import works.spectest.values.Values;

/**
 * Turns a {@link TypeDescriptor} into a membership predicate.
 * <p>
 * Validators are total: they return false for non-members and never throw.
 * Descriptors that can't be interpreted accept everything.
 * <p>
 * Maps and records are checked loosely: each <em>required</em> field
 * must be matched by at least one entry, and entries matching no field are ignored.
 * Optional fields impose no constraint at all.
 */
public final class ValidatorSynthesizer {
	private final DescriptorResolver resolver;

	public ValidatorSynthesizer(DescriptorResolver resolver) {
		this.resolver = resolver;
	}

	public Predicate<Object> validatorFor(TypeDescriptor descriptor) {
		LOGGER.debug("Synthesizing validator for {}", descriptor);
		return new Session(new ReferenceChain(resolver)).validatorFor(descriptor);
	}

	static final class Session {
		final ReferenceChain references;

		Session(ReferenceChain references) {
			this.references = references;
		}

		Predicate<Object> validatorFor(TypeDescriptor descriptor) {
			if (descriptor instanceof PrimitiveNode node) {
				return primitive(node.kind());
			} else if (descriptor instanceof BoundedIntegerNode node) {
				return boundedInteger(node);
			} else if (descriptor instanceof LiteralNode node) {
				return literal(node);
			} else if (descriptor instanceof SequenceNode node) {
				if (node.element() == null) {
					return v -> v instanceof List;
				}
				Predicate<Object> element = validatorFor(node.element());
				return v -> v instanceof List<?> list && list.stream().allMatch(element);
			} else if (descriptor instanceof KeywordListNode node) {
				return keywordList(node);
			} else if (descriptor instanceof TupleNode node) {
				return tuple(node);
			} else if (descriptor instanceof MappingNode node) {
				Predicate<Map<?, ?>> fields = requiredFields(node.fields());
				return v -> v instanceof Map<?, ?> map && fields.test(map);
			} else if (descriptor instanceof RecordNode node) {
				Predicate<Map<?, ?>> fields = requiredFields(node.fields());
				return v -> v instanceof Struct struct
					&& struct.typeName().equals(node.typeName())
					&& fields.test(struct.fields());
			} else if (descriptor instanceof UnionNode node) {
				List<Predicate<Object>> alternatives = node.alternatives().stream().map(this::validatorFor).toList();
				return v -> alternatives.stream().anyMatch(p -> p.test(v));
			} else if (descriptor instanceof RemoteRefNode node) {
				return references.follow(node, this::validatorFor, () -> v -> true);
			} else if (descriptor instanceof UnsupportedNode node) {
				LOGGER.warn("Unsupported type {} at {}; accepting any value", node.description(), node.location());
				return v -> true;
			} else {
				throw new IllegalStateException("Unexpected descriptor: " + descriptor.getClass());
			}
		}

		private static Predicate<Object> primitive(PrimitiveKind kind) {
			return switch (kind) {
				case INTEGER -> Values::isIntegral;
				case FLOAT -> Values::isFloat;
				case BOOLEAN -> v -> v instanceof Boolean;
				case ATOM -> v -> v instanceof Atom;
				case BINARY -> v -> v instanceof Bitstring bits && bits.isBinary();
				case BITSTRING -> v -> v instanceof Bitstring;
				case STRING -> v -> v instanceof String;
				case CHARLIST -> v -> v instanceof List<?> list && list.stream().allMatch(Values::isIntegral);
				case ANY, TERM -> v -> true;
				case NULL -> Objects::isNull;
			};
		}

		private static Predicate<Object> boundedInteger(BoundedIntegerNode node) {
			Integer lower = node.lowerBound();
			Integer upper = node.upperBound();
			return v -> Values.isIntegral(v)
				&& (lower == null || Values.compareIntegral(v, lower) >= 0)
				&& (upper == null || Values.compareIntegral(v, upper) <= 0);
		}

		private static Predicate<Object> literal(LiteralNode node) {
			Object expected = node.value();
			if (expected instanceof Atom) {
				return expected::equals;
			}
			return v -> Values.integralEquals(expected, v);
		}

		/**
		 * Accepts any list containing some pair whose key is the node's key
		 * and whose value is valid.
		 */
		private Predicate<Object> keywordList(KeywordListNode node) {
			Atom key = node.key();
			Predicate<Object> value = validatorFor(node.value());
			return v -> v instanceof List<?> list && list.stream().anyMatch(element ->
				element instanceof Tuple pair
					&& pair.size() == 2
					&& key.equals(pair.get(0))
					&& value.test(pair.get(1)));
		}

		private Predicate<Object> tuple(TupleNode node) {
			List<Predicate<Object>> elements = node.elements().stream().map(this::validatorFor).toList();
			return v -> {
				if (!(v instanceof Tuple tuple) || tuple.size() != elements.size()) {
					return false;
				}
				for (int i = 0; i < elements.size(); i++) {
					if (!elements.get(i).test(tuple.get(i))) {
						return false;
					}
				}
				return true;
			};
		}

		private Predicate<Map<?, ?>> requiredFields(List<MappingField> fields) {
			List<FieldCheck> checks = fields.stream()
				.filter(MappingField::required)
				.map(f -> new FieldCheck(validatorFor(f.key()), validatorFor(f.value())))
				.toList();
			return map -> checks.stream().allMatch(check -> map.entrySet().stream().anyMatch(check::matches));
		}

		private record FieldCheck(Predicate<Object> key, Predicate<Object> value) {
			boolean matches(Map.Entry<?, ?> entry) {
				return key.test(entry.getKey()) && value.test(entry.getValue());
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorSynthesizer.class);
}
