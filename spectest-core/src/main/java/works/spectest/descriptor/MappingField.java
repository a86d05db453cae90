package works.spectest.descriptor;

import static java.util.Objects.requireNonNull;

/**
 * One key/value association of a {@link MappingNode} or {@link RecordNode}.
 * A required field must be present in every valid map; an optional one may be absent.
 */
public record MappingField(
	TypeDescriptor key,
	TypeDescriptor value,
	boolean required
) {
	public MappingField {
		requireNonNull(key);
		requireNonNull(value);
	}

	public static MappingField required(TypeDescriptor key, TypeDescriptor value) {
		return new MappingField(key, value, true);
	}

	public static MappingField optional(TypeDescriptor key, TypeDescriptor value) {
		return new MappingField(key, value, false);
	}

	@Override
	public String toString() {
		return (required ? "required " : "optional ") + key + " => " + value;
	}
}
