package works.spectest.values;

import java.util.Arrays;

/**
 * A sequence of bits. When {@link #bitLength()} is a multiple of 8,
 * the bitstring is also a <em>binary</em>.
 * <p>
 * Unused low-order bits of the final byte are always zero,
 * so equality depends only on the meaningful bits.
 */
public final class Bitstring {
	private final byte[] bytes;
	private final int bitLength;

	private Bitstring(byte[] bytes, int bitLength) {
		this.bytes = bytes;
		this.bitLength = bitLength;
	}

	public static Bitstring binary(byte[] bytes) {
		return new Bitstring(bytes.clone(), bytes.length * 8);
	}

	/**
	 * @param bitLength must fit within {@code bytes}; trailing bits beyond it are discarded
	 */
	public static Bitstring of(byte[] bytes, int bitLength) {
		if (bitLength < 0 || bitLength > bytes.length * 8) {
			throw new IllegalArgumentException("Bit length " + bitLength + " doesn't fit in " + bytes.length + " bytes");
		}
		byte[] copy = Arrays.copyOf(bytes, (bitLength + 7) / 8);
		int spare = copy.length * 8 - bitLength;
		if (spare != 0) {
			copy[copy.length - 1] &= (byte) (0xFF << spare);
		}
		return new Bitstring(copy, bitLength);
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	public int bitLength() {
		return bitLength;
	}

	public boolean isBinary() {
		return bitLength % 8 == 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Bitstring other
			&& bitLength == other.bitLength
			&& Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(bytes) + bitLength;
	}

	@Override
	public String toString() {
		return Values.inspect(this);
	}
}
