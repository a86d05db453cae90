package works.spectest.descriptor;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A map described field by field. With no fields, any map at all.
 * Field keys are unique up to {@link Equivalence}.
 */
public record MappingNode(
	List<MappingField> fields,
	SourceLocation location
) implements TypeDescriptor {
	public MappingNode {
		fields = Fields.checkedCopy(fields);
		requireNonNull(location);
	}

	public MappingNode(List<MappingField> fields) {
		this(fields, SourceLocation.UNKNOWN);
	}

	public static MappingNode of(MappingField... fields) {
		return new MappingNode(List.of(fields));
	}

	public static MappingNode anyMap() {
		return new MappingNode(List.of());
	}

	@Override
	public String toString() {
		if (fields.isEmpty()) {
			return "map";
		}
		return fields.stream().map(Object::toString).collect(joining(", ", "map{", "}"));
	}
}
