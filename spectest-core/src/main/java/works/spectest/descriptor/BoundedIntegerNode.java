package works.spectest.descriptor;

import java.math.BigInteger;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Integers within optional inclusive bounds.
 * <p>
 * Validation enforces only the bounds that are present.
 * Generation needs a finite range, so a missing bound is replaced by
 * {@link #generationLowerBound()} or {@link #generationUpperBound()},
 * which extend {@link #DEFAULT_SPAN} beyond the present bound (or beyond zero).
 */
public record BoundedIntegerNode(
	@Nullable Integer lowerBound,
	@Nullable Integer upperBound,
	SourceLocation location
) implements TypeDescriptor {
	public static final int DEFAULT_SPAN = 1000;

	/**
	 * Used when a lower bound expression can't be interpreted.
	 */
	public static final int FALLBACK_LOWER = 0;

	/**
	 * Used when an upper bound expression can't be interpreted.
	 */
	public static final int FALLBACK_UPPER = 100;

	private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
	private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

	public BoundedIntegerNode {
		requireNonNull(location);
		if (lowerBound != null && upperBound != null && lowerBound > upperBound) {
			throw new IllegalArgumentException("Empty integer range " + lowerBound + ".." + upperBound);
		}
	}

	public BoundedIntegerNode(@Nullable Integer lowerBound, @Nullable Integer upperBound) {
		this(lowerBound, upperBound, SourceLocation.UNKNOWN);
	}

	public static BoundedIntegerNode nonNegative() {
		return new BoundedIntegerNode(0, null);
	}

	public static BoundedIntegerNode positive() {
		return new BoundedIntegerNode(1, null);
	}

	public static BoundedIntegerNode negative() {
		return new BoundedIntegerNode(null, -1);
	}

	public static BoundedIntegerNode between(int lower, int upper) {
		return new BoundedIntegerNode(lower, upper);
	}

	/**
	 * Builds a range from bound <em>expressions</em>, which may be integral numbers
	 * or integral {@link LiteralNode}s. Anything else can't be interpreted,
	 * and falls back to {@link #FALLBACK_LOWER} or {@link #FALLBACK_UPPER}.
	 * <p>
	 * Bounds beyond the range of {@code int} are loosened rather than rejected:
	 * a lower bound below it or an upper bound above it is dropped,
	 * and one on the far side is clamped.
	 * A fallback bound that would invert the range is moved to meet the other bound.
	 */
	public static BoundedIntegerNode range(Object lowerExpression, Object upperExpression) {
		BigInteger lower = integralValue(lowerExpression);
		BigInteger upper = integralValue(upperExpression);
		Integer lowerBound = (lower == null) ? Integer.valueOf(FALLBACK_LOWER) : lowerBoundOf(lower);
		Integer upperBound = (upper == null) ? Integer.valueOf(FALLBACK_UPPER) : upperBoundOf(upper);
		if (lowerBound != null && upperBound != null && lowerBound > upperBound) {
			if (lower == null) {
				lowerBound = upperBound;
			} else if (upper == null) {
				upperBound = lowerBound;
			}
		}
		return new BoundedIntegerNode(lowerBound, upperBound);
	}

	/**
	 * @return null if {@code expression} is not integral
	 */
	static @Nullable BigInteger integralValue(Object expression) {
		if (expression instanceof LiteralNode literal) {
			return integralValue(literal.value());
		} else if (expression instanceof BigInteger b) {
			return b;
		} else if (expression instanceof Number n && isIntegral(n)) {
			return BigInteger.valueOf(n.longValue());
		} else {
			return null;
		}
	}

	private static @Nullable Integer lowerBoundOf(BigInteger value) {
		if (value.compareTo(INT_MIN) < 0) {
			return null;
		}
		return value.min(INT_MAX).intValue();
	}

	private static @Nullable Integer upperBoundOf(BigInteger value) {
		if (value.compareTo(INT_MAX) > 0) {
			return null;
		}
		return value.max(INT_MIN).intValue();
	}

	private static boolean isIntegral(Number n) {
		return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte || n instanceof BigInteger;
	}

	public int generationLowerBound() {
		if (lowerBound != null) {
			return lowerBound;
		} else if (upperBound == null || upperBound > -DEFAULT_SPAN) {
			return -DEFAULT_SPAN;
		} else {
			return (int) Math.max(Integer.MIN_VALUE, (long) upperBound - DEFAULT_SPAN);
		}
	}

	public int generationUpperBound() {
		if (upperBound != null) {
			return upperBound;
		} else if (lowerBound == null || lowerBound < DEFAULT_SPAN) {
			return DEFAULT_SPAN;
		} else {
			return (int) Math.min(Integer.MAX_VALUE, (long) lowerBound + DEFAULT_SPAN);
		}
	}

	@Override
	public String toString() {
		return "integer["
			+ (lowerBound == null ? "" : lowerBound)
			+ ".."
			+ (upperBound == null ? "" : upperBound)
			+ "]";
	}
}
