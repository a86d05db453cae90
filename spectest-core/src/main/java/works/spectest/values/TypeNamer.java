package works.spectest.values;

import java.util.List;
import java.util.Map;

/**
 * Produces the short type names that appear in failure messages.
 * These names are for humans; nothing parses them.
 */
public final class TypeNamer {
	private TypeNamer() {}

	public static String nameOf(Object value) {
		if (value == null) {
			return "null";
		} else if (Values.isIntegral(value)) {
			return "integer";
		} else if (Values.isFloat(value)) {
			return "float";
		} else if (value instanceof Boolean) {
			return "boolean";
		} else if (value instanceof Atom) {
			return "atom";
		} else if (value instanceof Bitstring bits) {
			return bits.isBinary() ? "binary" : "bitstring";
		} else if (value instanceof String) {
			return "string";
		} else if (value instanceof List) {
			return "list";
		} else if (value instanceof Tuple) {
			return "tuple";
		} else if (value instanceof Struct struct) {
			return "record " + struct.typeName();
		} else if (value instanceof Map) {
			return "map";
		} else {
			return value.getClass().getSimpleName();
		}
	}
}
