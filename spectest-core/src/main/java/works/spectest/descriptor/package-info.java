/**
 * The type-descriptor tree: a small, closed vocabulary of value shapes
 * from which generators, validators and invalid-value generators are synthesized.
 *
 * @see works.spectest.descriptor.TypeDescriptor
 * @see works.spectest.engine
 */
package works.spectest.descriptor;
