package works.spectest.junit;

import java.util.List;
import works.spectest.source.IntRange;
import works.spectest.source.NonNegative;

/**
 * Well-behaved functions whose declared types are their whole contract.
 */
public final class Arithmetic {
	private Arithmetic() {}

	public static long sum(List<Integer> values) {
		return values.stream().mapToLong(Integer::longValue).sum();
	}

	public static @IntRange(min = 0, max = 10) int clamp(int value) {
		return Math.max(0, Math.min(10, value));
	}

	public static @NonNegative int count(String s) {
		return s.length();
	}

	public static boolean isEven(long value) {
		return value % 2 == 0;
	}
}
