package works.spectest.descriptor;

/**
 * A node in a type-descriptor tree, describing a set of values.
 * <p>
 * Descriptors are pure data. The engine interprets them in three ways:
 * as a generator of members, as a membership predicate,
 * and as a generator of non-members.
 * <p>
 * Every node carries a {@link SourceLocation}, which has no bearing on its meaning.
 * Use {@link Equivalence} rather than {@code equals} to compare descriptors by meaning.
 * <p>
 * {@code toString} renders a compact notation used in failure messages,
 * such as {@code integer[0..]} or {@code {integer, string}}.
 */
public sealed interface TypeDescriptor permits
	PrimitiveNode,
	BoundedIntegerNode,
	LiteralNode,
	SequenceNode,
	KeywordListNode,
	TupleNode,
	MappingNode,
	RecordNode,
	UnionNode,
	RemoteRefNode,
	UnsupportedNode
{
	SourceLocation location();
}
