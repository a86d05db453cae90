package works.spectest.descriptor;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A named type defined elsewhere, resolved lazily by a
 * {@link works.spectest.source.DescriptorResolver DescriptorResolver}.
 * <p>
 * If the resolver has nothing for this name, {@link #fallbackResolution} is used instead, when present.
 */
public record RemoteRefNode(
	String ownerName,
	String typeName,
	@Nullable TypeDescriptor fallbackResolution,
	SourceLocation location
) implements TypeDescriptor {
	public RemoteRefNode {
		requireNonNull(ownerName);
		requireNonNull(typeName);
		requireNonNull(location);
	}

	public RemoteRefNode(String ownerName, String typeName) {
		this(ownerName, typeName, null, SourceLocation.UNKNOWN);
	}

	public RemoteRefNode withFallback(TypeDescriptor fallback) {
		return new RemoteRefNode(ownerName, typeName, fallback, location);
	}

	public String qualifiedName() {
		return ownerName + "." + typeName;
	}

	@Override
	public String toString() {
		return qualifiedName();
	}
}
