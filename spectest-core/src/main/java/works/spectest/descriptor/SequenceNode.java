package works.spectest.descriptor;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A list whose elements all match {@link #element}.
 * A null element descriptor means any elements at all.
 */
public record SequenceNode(
	@Nullable TypeDescriptor element,
	SourceLocation location
) implements TypeDescriptor {
	public SequenceNode {
		requireNonNull(location);
	}

	public SequenceNode(@Nullable TypeDescriptor element) {
		this(element, SourceLocation.UNKNOWN);
	}

	public static SequenceNode ofAnything() {
		return new SequenceNode(null);
	}

	@Override
	public String toString() {
		return "list<" + (element == null ? "any" : element) + ">";
	}
}
