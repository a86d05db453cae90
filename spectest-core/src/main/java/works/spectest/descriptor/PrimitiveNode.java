package works.spectest.descriptor;

import static java.util.Objects.requireNonNull;

public record PrimitiveNode(
	PrimitiveKind kind,
	SourceLocation location
) implements TypeDescriptor {
	public PrimitiveNode {
		requireNonNull(kind);
		requireNonNull(location);
	}

	public PrimitiveNode(PrimitiveKind kind) {
		this(kind, SourceLocation.UNKNOWN);
	}

	public static PrimitiveNode of(PrimitiveKind kind) {
		return new PrimitiveNode(kind);
	}

	@Override
	public String toString() {
		return kind.notation();
	}
}
