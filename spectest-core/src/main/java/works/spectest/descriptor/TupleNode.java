package works.spectest.descriptor;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

public record TupleNode(
	List<TypeDescriptor> elements,
	SourceLocation location
) implements TypeDescriptor {
	public TupleNode {
		elements = List.copyOf(elements);
		requireNonNull(location);
	}

	public TupleNode(List<TypeDescriptor> elements) {
		this(elements, SourceLocation.UNKNOWN);
	}

	public static TupleNode of(TypeDescriptor... elements) {
		return new TupleNode(List.of(elements));
	}

	@Override
	public String toString() {
		return elements.stream().map(Object::toString).collect(joining(", ", "{", "}"));
	}
}
