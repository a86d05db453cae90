/**
 * Jackson serialization of trial results for external reporting.
 */
package works.spectest.jackson;
