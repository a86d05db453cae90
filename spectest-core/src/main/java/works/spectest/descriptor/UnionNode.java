package works.spectest.descriptor;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

public record UnionNode(
	List<TypeDescriptor> alternatives,
	SourceLocation location
) implements TypeDescriptor {
	public UnionNode {
		alternatives = List.copyOf(alternatives);
		requireNonNull(location);
		if (alternatives.isEmpty()) {
			throw new IllegalArgumentException("Union must have at least one alternative");
		}
	}

	public UnionNode(List<TypeDescriptor> alternatives) {
		this(alternatives, SourceLocation.UNKNOWN);
	}

	public static UnionNode of(TypeDescriptor... alternatives) {
		return new UnionNode(List.of(alternatives));
	}

	@Override
	public String toString() {
		return alternatives.stream().map(Object::toString).collect(joining(" | "));
	}
}
