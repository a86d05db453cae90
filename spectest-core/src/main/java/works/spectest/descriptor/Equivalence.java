package works.spectest.descriptor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import works.spectest.values.Values;

/**
 * Structural equality of descriptors, ignoring {@link SourceLocation}.
 * <p>
 * Positional children (tuple elements, union alternatives, parameters) must agree pairwise in order.
 * Mapping and record fields are compared as sets.
 * Remote references compare by name only; they are not resolved.
 */
public final class Equivalence {
	private Equivalence() {}

	public static boolean equivalent(Signature a, Signature b) {
		return equivalent(a.parameters(), b.parameters())
			&& equivalent(a.returnType(), b.returnType());
	}

	public static boolean equivalent(List<TypeDescriptor> a, List<TypeDescriptor> b) {
		if (a.size() != b.size()) {
			return false;
		}
		for (int i = 0; i < a.size(); i++) {
			if (!equivalent(a.get(i), b.get(i))) {
				return false;
			}
		}
		return true;
	}

	public static boolean equivalent(TypeDescriptor a, TypeDescriptor b) {
		if (a == b) {
			return true;
		} else if (a == null || b == null || a.getClass() != b.getClass()) {
			return false;
		} else if (a instanceof PrimitiveNode pa) {
			return pa.kind() == ((PrimitiveNode) b).kind();
		} else if (a instanceof BoundedIntegerNode ba) {
			BoundedIntegerNode bb = (BoundedIntegerNode) b;
			return Objects.equals(ba.lowerBound(), bb.lowerBound())
				&& Objects.equals(ba.upperBound(), bb.upperBound());
		} else if (a instanceof LiteralNode la) {
			return sameLiteral(la.value(), ((LiteralNode) b).value());
		} else if (a instanceof SequenceNode sa) {
			return optionallyEquivalent(sa.element(), ((SequenceNode) b).element());
		} else if (a instanceof KeywordListNode ka) {
			KeywordListNode kb = (KeywordListNode) b;
			return ka.key().equals(kb.key()) && equivalent(ka.value(), kb.value());
		} else if (a instanceof TupleNode ta) {
			return equivalent(ta.elements(), ((TupleNode) b).elements());
		} else if (a instanceof MappingNode ma) {
			return equivalentFields(ma.fields(), ((MappingNode) b).fields());
		} else if (a instanceof RecordNode ra) {
			RecordNode rb = (RecordNode) b;
			return ra.typeName().equals(rb.typeName()) && equivalentFields(ra.fields(), rb.fields());
		} else if (a instanceof UnionNode ua) {
			return equivalent(ua.alternatives(), ((UnionNode) b).alternatives());
		} else if (a instanceof RemoteRefNode ra) {
			RemoteRefNode rb = (RemoteRefNode) b;
			return ra.ownerName().equals(rb.ownerName()) && ra.typeName().equals(rb.typeName());
		} else if (a instanceof UnsupportedNode ua) {
			return ua.description().equals(((UnsupportedNode) b).description());
		} else {
			throw new IllegalStateException("Unexpected descriptor: " + a.getClass());
		}
	}

	public static boolean equivalent(MappingField a, MappingField b) {
		return a.required() == b.required()
			&& equivalent(a.key(), b.key())
			&& equivalent(a.value(), b.value());
	}

	private static boolean optionallyEquivalent(TypeDescriptor a, TypeDescriptor b) {
		if (a == null || b == null) {
			return a == b;
		}
		return equivalent(a, b);
	}

	private static boolean equivalentFields(List<MappingField> a, List<MappingField> b) {
		if (a.size() != b.size()) {
			return false;
		}
		List<MappingField> unmatched = new ArrayList<>(b);
		for (MappingField field : a) {
			if (!unmatched.removeIf(candidate -> equivalent(field, candidate))) {
				return false;
			}
		}
		return unmatched.isEmpty();
	}

	private static boolean sameLiteral(Object a, Object b) {
		if (Values.isIntegral(a) && Values.isIntegral(b)) {
			BigInteger ia = Values.toBigInteger(a);
			return ia.equals(Values.toBigInteger(b));
		}
		return a.equals(b);
	}
}
