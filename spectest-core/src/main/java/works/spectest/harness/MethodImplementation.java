package works.spectest.harness;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import works.spectest.values.Atom;
import works.spectest.values.Values;

import static java.util.Objects.requireNonNull;

/**
 * Invokes a public static method reflectively.
 * <p>
 * Generated values use a canonical Java type per kind, so arguments are first coerced
 * to the declared parameter types:
 * integers to the declared integral type when in range, and atoms to enum constants of the same name.
 * Those coercions are exact.
 * Doubles passed to a {@code float} parameter are rounded to the nearest {@code float},
 * so they may lose precision, and magnitudes beyond the {@code float} range become infinite.
 * Enum results are converted back to atoms.
 * Arguments that can't be coerced are passed as they are,
 * so the reflective call rejects them with an {@link IllegalArgumentException}.
 */
public final class MethodImplementation implements Implementation {
	private final Method method;

	public MethodImplementation(Method method) {
		this.method = requireNonNull(method);
		if (!Modifier.isStatic(method.getModifiers())) {
			throw new IllegalArgumentException("Method must be static: " + method);
		}
		method.trySetAccessible();
	}

	public Method method() {
		return method;
	}

	@Override
	public Object invoke(List<Object> arguments) throws Exception {
		Class<?>[] parameterTypes = method.getParameterTypes();
		if (arguments.size() != parameterTypes.length) {
			throw new IllegalArgumentException("Expected " + parameterTypes.length + " arguments; got " + arguments.size());
		}
		Object[] coerced = new Object[parameterTypes.length];
		for (int i = 0; i < coerced.length; i++) {
			coerced[i] = coerce(arguments.get(i), parameterTypes[i]);
		}
		try {
			return normalize(method.invoke(null, coerced));
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof Exception exception) {
				throw exception;
			} else if (cause instanceof Error error) {
				throw error;
			} else {
				throw e;
			}
		}
	}

	static Object coerce(Object value, Class<?> target) {
		if (value == null) {
			return null;
		}
		Class<?> boxed = boxed(target);
		if (boxed.isInstance(value)) {
			return value;
		} else if (Values.isIntegral(value)) {
			return coerceIntegral(value, boxed);
		} else if (value instanceof Double d && boxed == Float.class) {
			return d.floatValue();
		} else if (value instanceof Atom atom && boxed.isEnum()) {
			return Arrays.stream((Object[]) boxed.getEnumConstants())
				.filter(c -> ((Enum<?>) c).name().equals(atom.name()))
				.findFirst()
				.orElse(value);
		} else {
			return value;
		}
	}

	private static Object coerceIntegral(Object value, Class<?> target) {
		BigInteger big = Values.toBigInteger(value);
		if (target == BigInteger.class) {
			return big;
		} else if (target == Long.class && big.bitLength() < 64) {
			return big.longValue();
		} else if (target == Integer.class && big.bitLength() < 32) {
			return big.intValue();
		} else if (target == Short.class && big.bitLength() < 16) {
			return big.shortValue();
		} else if (target == Byte.class && big.bitLength() < 8) {
			return big.byteValue();
		} else {
			return value;
		}
	}

	private static Object normalize(Object result) {
		if (result instanceof Enum<?> e) {
			return Atom.of(e.name());
		}
		return result;
	}

	private static Class<?> boxed(Class<?> type) {
		if (!type.isPrimitive()) {
			return type;
		} else if (type == int.class) {
			return Integer.class;
		} else if (type == long.class) {
			return Long.class;
		} else if (type == short.class) {
			return Short.class;
		} else if (type == byte.class) {
			return Byte.class;
		} else if (type == double.class) {
			return Double.class;
		} else if (type == float.class) {
			return Float.class;
		} else if (type == boolean.class) {
			return Boolean.class;
		} else if (type == char.class) {
			return Character.class;
		} else {
			return Void.class;
		}
	}

	@Override
	public String toString() {
		return method.getDeclaringClass().getSimpleName() + "." + method.getName();
	}
}
