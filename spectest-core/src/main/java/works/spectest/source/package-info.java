/**
 * Where signatures and named types come from.
 * <p>
 * The engine itself never reads source code or class files;
 * it asks a {@link works.spectest.source.SignatureSource} for signatures
 * and a {@link works.spectest.source.DescriptorResolver} for named types.
 */
package works.spectest.source;
