package works.spectest.harness;

import java.util.List;

/**
 * A function under test, invoked with a list of positional arguments.
 * <p>
 * Throwing an {@link Exception} is how an implementation rejects its input.
 * {@link Error}s, and assertion failures in particular, are never treated as rejections.
 */
@FunctionalInterface
public interface Implementation {
	Object invoke(List<Object> arguments) throws Exception;
}
