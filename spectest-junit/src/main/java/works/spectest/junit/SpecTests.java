package works.spectest.junit;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectest.exceptions.SpecNotFoundException;
import works.spectest.harness.TrialConfig;
import works.spectest.harness.TrialHarness;
import works.spectest.harness.TrialPlan;
import works.spectest.harness.TrialResult;
import works.spectest.harness.TrialSuite;
import works.spectest.source.DescriptorResolver;
import works.spectest.source.FunctionRef;
import works.spectest.source.ReflectionSignatureSource;

/**
 * Turns trials into JUnit Jupiter dynamic tests.
 * Return the stream from a {@link org.junit.jupiter.api.TestFactory @TestFactory} method:
 *
 * <pre>
 * &#64;TestFactory
 * Stream&lt;DynamicTest&gt; sorting() {
 *     return SpecTests.dynamicTests(TrialSuite.builder(harness)
 *         .conformance(SORT, sortImpl)
 *         .robustness(SORT, sortImpl)
 *         .build());
 * }
 * </pre>
 */
public final class SpecTests {
	private SpecTests() {}

	public static Stream<DynamicTest> dynamicTests(TrialSuite suite) {
		return dynamicTests(suite, result -> {});
	}

	/**
	 * @param listener receives every result, passed or failed, before it is asserted
	 */
	public static Stream<DynamicTest> dynamicTests(TrialSuite suite, Consumer<? super TrialResult> listener) {
		return suite.plans().stream().map(plan -> dynamicTest(plan, listener));
	}

	public static DynamicTest dynamicTest(TrialPlan plan, Consumer<? super TrialResult> listener) {
		return DynamicTest.dynamicTest(plan.displayName(), () -> {
			TrialResult result = plan.run();
			listener.accept(result);
			assertPassed(result);
		});
	}

	/**
	 * Conformance tests for every public static, non-overloaded method of {@code type},
	 * with signatures taken from the methods' declared types.
	 */
	public static Stream<DynamicTest> forClass(Class<?> type, TrialConfig config) {
		ReflectionSignatureSource source = new ReflectionSignatureSource(type.getClassLoader());
		TrialHarness harness = new TrialHarness(source, DescriptorResolver.none(), config);
		TrialSuite.Builder suite = TrialSuite.builder(harness);
		List<FunctionRef> functions = source.publicFunctions(type);
		LOGGER.debug("Found {} functions in {}", functions.size(), type.getSimpleName());
		for (FunctionRef function : functions) {
			try {
				suite.conformance(function, source.implementationOf(function));
			} catch (SpecNotFoundException e) {
				throw new IllegalStateException("Function listed by " + type.getSimpleName() + " has vanished: " + function, e);
			}
		}
		return dynamicTests(suite.build());
	}

	/**
	 * @throws TrialFailedException if {@code result} is a failure
	 */
	public static void assertPassed(TrialResult result) {
		if (result instanceof TrialResult.Failed failed) {
			throw TrialFailedException.of(failed);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SpecTests.class);
}
