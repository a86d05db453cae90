package works.spectest.source;

import works.spectest.descriptor.Signature;
import works.spectest.exceptions.SpecNotFoundException;

/**
 * Supplies the declared signature of a function.
 */
@FunctionalInterface
public interface SignatureSource {
	Signature signatureOf(FunctionRef function) throws SpecNotFoundException;
}
