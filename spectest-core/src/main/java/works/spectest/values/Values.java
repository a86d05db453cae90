package works.spectest.values;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helpers for the numeric and textual handling of host values.
 */
public final class Values {
	private Values() {}

	/**
	 * @return true for the integral boxed types and {@link BigInteger}
	 */
	public static boolean isIntegral(Object value) {
		return value instanceof Integer
			|| value instanceof Long
			|| value instanceof Short
			|| value instanceof Byte
			|| value instanceof BigInteger;
	}

	public static boolean isFloat(Object value) {
		return value instanceof Double || value instanceof Float;
	}

	public static BigInteger toBigInteger(Object integral) {
		if (integral instanceof BigInteger big) {
			return big;
		} else if (isIntegral(integral)) {
			return BigInteger.valueOf(((Number) integral).longValue());
		} else {
			throw new IllegalArgumentException("Not an integral value: " + inspect(integral));
		}
	}

	/**
	 * Numeric equality across the integral types, so {@code 5} and {@code 5L} agree.
	 */
	public static boolean integralEquals(Object a, Object b) {
		return isIntegral(a) && isIntegral(b) && toBigInteger(a).equals(toBigInteger(b));
	}

	public static int compareIntegral(Object integral, long bound) {
		return toBigInteger(integral).compareTo(BigInteger.valueOf(bound));
	}

	/**
	 * @return an {@link Integer} when the value fits, else a {@link Long}
	 */
	public static Object narrow(long value) {
		if (Integer.MIN_VALUE <= value && value <= Integer.MAX_VALUE) {
			return (int) value;
		} else {
			return value;
		}
	}

	/**
	 * Renders a value for diagnostics.
	 */
	public static String inspect(Object value) {
		if (value == null) {
			return "null";
		} else if (value instanceof String s) {
			return quote(s);
		} else if (value instanceof Tuple tuple) {
			return join("{", tuple.elements(), "}");
		} else if (value instanceof List<?> list) {
			return join("[", list, "]");
		} else if (value instanceof Struct struct) {
			return struct.typeName() + joinEntries(struct.fields());
		} else if (value instanceof Map<?, ?> map) {
			return "map" + joinEntries(map);
		} else if (value instanceof Bitstring bits) {
			StringJoiner joiner = new StringJoiner(", ", "<<", ">>");
			byte[] bytes = bits.bytes();
			for (int i = 0; i < bytes.length; i++) {
				int used = Math.min(8, bits.bitLength() - 8 * i);
				int unsigned = Byte.toUnsignedInt(bytes[i]) >>> (8 - used);
				joiner.add(used == 8 ? Integer.toString(unsigned) : unsigned + ":" + used);
			}
			return joiner.toString();
		} else {
			return String.valueOf(value);
		}
	}

	private static String join(String prefix, List<?> elements, String suffix) {
		StringJoiner joiner = new StringJoiner(", ", prefix, suffix);
		elements.forEach(e -> joiner.add(inspect(e)));
		return joiner.toString();
	}

	private static String joinEntries(Map<?, ?> map) {
		StringJoiner joiner = new StringJoiner(", ", "{", "}");
		map.forEach((k, v) -> joiner.add(inspect(k) + " => " + inspect(v)));
		return joiner.toString();
	}

	private static String quote(String s) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
