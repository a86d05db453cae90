package works.spectest.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectest.descriptor.RemoteRefNode;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.source.DescriptorResolver;

/**
 * Follows {@link RemoteRefNode}s during one synthesis,
 * remembering which references are being expanded on the current call chain.
 * A reference that is already being expanded is a cycle, and is not followed again.
 * <p>
 * Not thread-safe; each synthesis uses its own instance.
 */
final class ReferenceChain {
	private final DescriptorResolver resolver;
	private final Deque<String> inProgress = new ArrayDeque<>();

	ReferenceChain(DescriptorResolver resolver) {
		this.resolver = resolver;
	}

	/**
	 * @param interpreter applied to the resolved descriptor, with {@code ref} marked as in progress
	 * @param fallback used when {@code ref} is unresolvable or cyclic
	 */
	<T> T follow(RemoteRefNode ref, Function<TypeDescriptor, T> interpreter, Supplier<T> fallback) {
		String name = ref.qualifiedName();
		if (inProgress.contains(name)) {
			LOGGER.warn("Cyclic reference to {} at {}; treating it as any value", name, ref.location());
			return fallback.get();
		}
		Optional<TypeDescriptor> resolved = resolver.resolve(ref);
		if (resolved.isEmpty()) {
			LOGGER.warn("Unable to resolve {} at {}; treating it as any value", name, ref.location());
			return fallback.get();
		}
		inProgress.push(name);
		try {
			return interpreter.apply(resolved.get());
		} finally {
			inProgress.pop();
		}
	}

	Optional<TypeDescriptor> resolve(RemoteRefNode ref) {
		return resolver.resolve(ref);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceChain.class);
}
