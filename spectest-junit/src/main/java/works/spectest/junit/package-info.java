/**
 * JUnit Jupiter integration: trials as {@link org.junit.jupiter.api.DynamicTest}s,
 * and failures as {@link org.opentest4j.AssertionFailedError}s.
 */
package works.spectest.junit;
