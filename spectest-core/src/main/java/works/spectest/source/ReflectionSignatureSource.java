package works.spectest.source;

import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.AnnotatedWildcardType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectest.descriptor.BoundedIntegerNode;
import works.spectest.descriptor.LiteralNode;
import works.spectest.descriptor.MappingField;
import works.spectest.descriptor.MappingNode;
import works.spectest.descriptor.PrimitiveKind;
import works.spectest.descriptor.PrimitiveNode;
import works.spectest.descriptor.SequenceNode;
import works.spectest.descriptor.Signature;
import works.spectest.descriptor.SourceLocation;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.descriptor.UnionNode;
import works.spectest.descriptor.UnsupportedNode;
import works.spectest.exceptions.SpecNotFoundException;
import works.spectest.harness.Implementation;
import works.spectest.harness.MethodImplementation;
import works.spectest.values.Atom;
import works.spectest.values.Bitstring;

import static works.spectest.descriptor.PrimitiveKind.ANY;
import static works.spectest.descriptor.PrimitiveKind.ATOM;
import static works.spectest.descriptor.PrimitiveKind.BITSTRING;
import static works.spectest.descriptor.PrimitiveKind.BOOLEAN;
import static works.spectest.descriptor.PrimitiveKind.FLOAT;
import static works.spectest.descriptor.PrimitiveKind.INTEGER;
import static works.spectest.descriptor.PrimitiveKind.NULL;
import static works.spectest.descriptor.PrimitiveKind.STRING;

/**
 * Derives signatures from the generic, annotated types of public static methods.
 * <p>
 * A {@link FunctionRef} names a class by its binary name and a method by its simple name.
 * The method name must not be overloaded.
 * Integer types can be refined with the type-use annotations
 * {@link NonNegative}, {@link Positive}, {@link Negative} and {@link IntRange}.
 * Types with no descriptor counterpart become {@link UnsupportedNode}s.
 */
public final class ReflectionSignatureSource implements SignatureSource {
	private final ClassLoader classLoader;

	public ReflectionSignatureSource() {
		this(ReflectionSignatureSource.class.getClassLoader());
	}

	public ReflectionSignatureSource(ClassLoader classLoader) {
		this.classLoader = classLoader;
	}

	@Override
	public Signature signatureOf(FunctionRef function) throws SpecNotFoundException {
		return signatureOf(methodFor(function));
	}

	public Signature signatureOf(Method method) {
		AnnotatedType[] parameterTypes = method.getAnnotatedParameterTypes();
		List<TypeDescriptor> parameters = new ArrayList<>(parameterTypes.length);
		for (int i = 0; i < parameterTypes.length; i++) {
			parameters.add(describe(parameterTypes[i], locationOf(method, "parameter " + i)));
		}
		return new Signature(parameters, describe(method.getAnnotatedReturnType(), locationOf(method, "return")));
	}

	public Implementation implementationOf(FunctionRef function) throws SpecNotFoundException {
		return new MethodImplementation(methodFor(function));
	}

	/**
	 * @return every public static method of {@code type} whose name is not overloaded, ordered by name
	 */
	public List<FunctionRef> publicFunctions(Class<?> type) {
		Map<String, List<Method>> byName = Arrays.stream(type.getDeclaredMethods())
			.filter(ReflectionSignatureSource::isCandidate)
			.collect(Collectors.groupingBy(Method::getName));
		List<FunctionRef> result = new ArrayList<>();
		byName.forEach((name, methods) -> {
			if (methods.size() == 1) {
				result.add(FunctionRef.of(type, name));
			} else {
				LOGGER.debug("Skipping overloaded method {}.{}", type.getSimpleName(), name);
			}
		});
		result.sort(Comparator.comparing(FunctionRef::name));
		return result;
	}

	Method methodFor(FunctionRef function) throws SpecNotFoundException {
		Class<?> owner;
		try {
			owner = Class.forName(function.owner(), false, classLoader);
		} catch (ClassNotFoundException e) {
			throw new SpecNotFoundException(function, "class not found", e);
		}
		List<Method> candidates = Arrays.stream(owner.getDeclaredMethods())
			.filter(ReflectionSignatureSource::isCandidate)
			.filter(m -> m.getName().equals(function.name()))
			.toList();
		if (candidates.isEmpty()) {
			throw new SpecNotFoundException(function, "no public static method with that name");
		} else if (candidates.size() > 1) {
			throw new SpecNotFoundException(function, "method is overloaded " + candidates.size() + " times");
		}
		return candidates.get(0);
	}

	private static boolean isCandidate(Method method) {
		int modifiers = method.getModifiers();
		return Modifier.isPublic(modifiers)
			&& Modifier.isStatic(modifiers)
			&& !method.isSynthetic()
			&& !method.isBridge();
	}

	private static SourceLocation locationOf(Method method, String position) {
		return SourceLocation.of(method.getDeclaringClass().getSimpleName() + "." + method.getName() + " " + position);
	}

	TypeDescriptor describe(AnnotatedType annotatedType, SourceLocation location) {
		Type type = annotatedType.getType();
		if (annotatedType instanceof AnnotatedParameterizedType parameterized) {
			Class<?> raw = (Class<?>) ((ParameterizedType) type).getRawType();
			AnnotatedType[] arguments = parameterized.getAnnotatedActualTypeArguments();
			if (isSequenceType(raw)) {
				return new SequenceNode(describe(arguments[0], location), location);
			} else if (raw == Map.class) {
				return new MappingNode(List.of(MappingField.optional(
					describe(arguments[0], location),
					describe(arguments[1], location))), location);
			} else {
				return new UnsupportedNode(type.getTypeName(), location);
			}
		} else if (annotatedType instanceof AnnotatedWildcardType wildcard) {
			AnnotatedType[] upperBounds = wildcard.getAnnotatedUpperBounds();
			if (upperBounds.length == 1) {
				return describe(upperBounds[0], location);
			} else {
				return new PrimitiveNode(ANY, location);
			}
		} else if (type instanceof Class<?> c) {
			return describeClass(c, annotatedType, location);
		} else {
			return new UnsupportedNode(type.getTypeName(), location);
		}
	}

	private TypeDescriptor describeClass(Class<?> c, AnnotatedType annotatedType, SourceLocation location) {
		if (c == int.class || c == Integer.class || c == long.class || c == Long.class || c == BigInteger.class) {
			return integer(annotatedType, Integer.MIN_VALUE, Integer.MAX_VALUE, location);
		} else if (c == short.class || c == Short.class) {
			return integer(annotatedType, Short.MIN_VALUE, Short.MAX_VALUE, location);
		} else if (c == byte.class || c == Byte.class) {
			return integer(annotatedType, Byte.MIN_VALUE, Byte.MAX_VALUE, location);
		} else if (c == double.class || c == Double.class || c == float.class || c == Float.class) {
			return primitive(FLOAT, location);
		} else if (c == boolean.class || c == Boolean.class) {
			return primitive(BOOLEAN, location);
		} else if (c == String.class || c == CharSequence.class) {
			return primitive(STRING, location);
		} else if (c == Atom.class) {
			return primitive(ATOM, location);
		} else if (c == Bitstring.class) {
			return primitive(BITSTRING, location);
		} else if (c == Number.class) {
			return new UnionNode(List.of(primitive(INTEGER, location), primitive(FLOAT, location)), location);
		} else if (c == Object.class) {
			return primitive(ANY, location);
		} else if (c == void.class || c == Void.class) {
			return primitive(NULL, location);
		} else if (c.isEnum()) {
			return enumAtoms(c, location);
		} else if (isSequenceType(c)) {
			return new SequenceNode(null, location);
		} else if (c == Map.class) {
			return new MappingNode(List.of(), location);
		} else {
			return new UnsupportedNode(c.getName(), location);
		}
	}

	/**
	 * Integers are unbounded unless annotated, or unless the Java type is narrower than {@code int}.
	 * Annotations that leave no integers at all are unsupported.
	 */
	private static TypeDescriptor integer(AnnotatedType annotatedType, int typeMin, int typeMax, SourceLocation location) {
		long lower = typeMin;
		long upper = typeMax;
		boolean constrained = typeMin != Integer.MIN_VALUE;
		if (annotatedType.isAnnotationPresent(NonNegative.class)) {
			lower = Math.max(lower, 0);
			constrained = true;
		}
		if (annotatedType.isAnnotationPresent(Positive.class)) {
			lower = Math.max(lower, 1);
			constrained = true;
		}
		if (annotatedType.isAnnotationPresent(Negative.class)) {
			upper = Math.min(upper, -1);
			constrained = true;
		}
		IntRange range = annotatedType.getAnnotation(IntRange.class);
		if (range != null) {
			lower = Math.max(lower, range.min());
			upper = Math.min(upper, range.max());
			constrained = true;
		}
		if (!constrained) {
			return primitive(INTEGER, location);
		}
		if (lower > upper) {
			LOGGER.warn("Annotations on {} at {} leave an empty range {}..{}", annotatedType.getType().getTypeName(), location, lower, upper);
			return new UnsupportedNode("empty integer range " + lower + ".." + upper, location);
		}
		return new BoundedIntegerNode(
			lower == Integer.MIN_VALUE ? null : (int) lower,
			upper == Integer.MAX_VALUE ? null : (int) upper,
			location);
	}

	private static TypeDescriptor enumAtoms(Class<?> enumClass, SourceLocation location) {
		Object[] constants = enumClass.getEnumConstants();
		if (constants.length == 0) {
			return new UnsupportedNode("empty enum " + enumClass.getName(), location);
		}
		Function<Object, TypeDescriptor> literal = e -> new LiteralNode(Atom.of(((Enum<?>) e).name()), location);
		return new UnionNode(Arrays.stream(constants).map(literal).toList(), location);
	}

	private static boolean isSequenceType(Class<?> c) {
		return c == List.class || c == Collection.class || c == Iterable.class;
	}

	private static PrimitiveNode primitive(PrimitiveKind kind, SourceLocation location) {
		return new PrimitiveNode(kind, location);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectionSignatureSource.class);
}
