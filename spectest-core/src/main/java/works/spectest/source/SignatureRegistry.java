package works.spectest.source;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import works.spectest.descriptor.Signature;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.exceptions.SpecNotFoundException;

/**
 * An immutable in-memory table of signatures and named types.
 */
public final class SignatureRegistry implements SignatureSource, DescriptorResolver {
	private final Map<FunctionRef, Signature> signatures;
	private final Map<String, TypeDescriptor> types;

	private SignatureRegistry(Map<FunctionRef, Signature> signatures, Map<String, TypeDescriptor> types) {
		this.signatures = Map.copyOf(signatures);
		this.types = Map.copyOf(types);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Signature signatureOf(FunctionRef function) throws SpecNotFoundException {
		Signature result = signatures.get(function);
		if (result == null) {
			throw new SpecNotFoundException(function, "not registered");
		}
		return result;
	}

	@Override
	public Optional<TypeDescriptor> resolve(String ownerName, String typeName) {
		return Optional.ofNullable(types.get(key(ownerName, typeName)));
	}

	private static String key(String ownerName, String typeName) {
		return ownerName + "." + typeName;
	}

	public static final class Builder {
		private final Map<FunctionRef, Signature> signatures = new LinkedHashMap<>();
		private final Map<String, TypeDescriptor> types = new LinkedHashMap<>();

		private Builder() {}

		public Builder define(FunctionRef function, Signature signature) {
			if (signatures.putIfAbsent(function, signature) != null) {
				throw new IllegalArgumentException("Duplicate signature for " + function);
			}
			return this;
		}

		public Builder define(String owner, String name, Signature signature) {
			return define(new FunctionRef(owner, name), signature);
		}

		public Builder defineType(String ownerName, String typeName, TypeDescriptor descriptor) {
			if (types.putIfAbsent(key(ownerName, typeName), descriptor) != null) {
				throw new IllegalArgumentException("Duplicate type " + key(ownerName, typeName));
			}
			return this;
		}

		public SignatureRegistry build() {
			return new SignatureRegistry(signatures, types);
		}
	}
}
