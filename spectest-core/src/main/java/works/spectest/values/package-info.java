/**
 * The host values that inhabit type descriptors.
 * <p>
 * Integers, floats, booleans, strings, lists and maps are ordinary Java objects;
 * the classes here cover the remaining kinds: {@link works.spectest.values.Atom atoms},
 * {@link works.spectest.values.Tuple tuples}, {@link works.spectest.values.Bitstring bitstrings}
 * and named {@link works.spectest.values.Struct records}.
 */
package works.spectest.values;
