package works.spectest.source;

import java.util.Optional;
import works.spectest.descriptor.RemoteRefNode;
import works.spectest.descriptor.TypeDescriptor;

/**
 * Looks up named types referenced by {@link RemoteRefNode}s.
 */
@FunctionalInterface
public interface DescriptorResolver {
	Optional<TypeDescriptor> resolve(String ownerName, String typeName);

	/**
	 * Resolves {@code ref}, falling back to its {@link RemoteRefNode#fallbackResolution() fallbackResolution}.
	 */
	default Optional<TypeDescriptor> resolve(RemoteRefNode ref) {
		Optional<TypeDescriptor> resolved = resolve(ref.ownerName(), ref.typeName());
		if (resolved.isPresent()) {
			return resolved;
		}
		return Optional.ofNullable(ref.fallbackResolution());
	}

	static DescriptorResolver none() {
		return (ownerName, typeName) -> Optional.empty();
	}
}
