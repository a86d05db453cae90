package works.spectest.descriptor;

import java.util.List;
import works.spectest.values.Atom;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A named record: a field map tagged with {@link #typeName}.
 * Values are {@link works.spectest.values.Struct}s.
 */
public record RecordNode(
	String typeName,
	List<MappingField> fields,
	SourceLocation location
) implements TypeDescriptor {
	public RecordNode {
		requireNonNull(typeName);
		fields = Fields.checkedCopy(fields);
		requireNonNull(location);
	}

	public RecordNode(String typeName, List<MappingField> fields) {
		this(typeName, fields, SourceLocation.UNKNOWN);
	}

	public static RecordNode of(String typeName, MappingField... fields) {
		return new RecordNode(typeName, List.of(fields));
	}

	/**
	 * Convenience for the common case of required fields with atom keys.
	 */
	public static MappingField field(String name, TypeDescriptor value) {
		return MappingField.required(LiteralNode.atom(name), value);
	}

	@Override
	public String toString() {
		return fields.stream()
			.map(RecordNode::fieldNotation)
			.collect(joining(", ", typeName + "{", "}"));
	}

	private static String fieldNotation(MappingField field) {
		if (field.required() && field.key() instanceof LiteralNode literal && literal.value() instanceof Atom atom) {
			return atom.name() + ": " + field.value();
		}
		return field.toString();
	}
}
