/**
 * Interprets {@link works.spectest.descriptor.TypeDescriptor}s three ways:
 * <ul>
 *     <li>{@link works.spectest.engine.GeneratorSynthesizer}: values the descriptor describes</li>
 *     <li>{@link works.spectest.engine.ValidatorSynthesizer}: a membership test</li>
 *     <li>{@link works.spectest.engine.InvalidGeneratorSynthesizer}: values it probably doesn't describe</li>
 * </ul>
 *
 * Generators are jqwik {@link net.jqwik.api.Arbitrary Arbitraries}.
 * Inside a jqwik property they follow the property's seed;
 * elsewhere they draw from a fresh random source.
 */
package works.spectest.engine;
