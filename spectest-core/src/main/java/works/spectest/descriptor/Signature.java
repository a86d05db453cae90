package works.spectest.descriptor;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The declared parameter and return descriptors of one function.
 */
public record Signature(
	List<TypeDescriptor> parameters,
	TypeDescriptor returnType
) {
	public Signature {
		parameters = List.copyOf(parameters);
		requireNonNull(returnType);
	}

	public static Signature of(TypeDescriptor returnType, TypeDescriptor... parameters) {
		return new Signature(List.of(parameters), returnType);
	}

	public int arity() {
		return parameters.size();
	}

	@Override
	public String toString() {
		return parameters.stream().map(Object::toString).collect(joining(", ", "(", ") -> ")) + returnType;
	}
}
