package works.spectest.source;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Restricts an integer parameter or return type to zero or greater.
 *
 * @see ReflectionSignatureSource
 */
@Retention(RUNTIME)
@Target(TYPE_USE)
public @interface NonNegative {
}
