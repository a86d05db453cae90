package works.spectest.harness;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import works.spectest.descriptor.BoundedIntegerNode;
import works.spectest.descriptor.Signature;
import works.spectest.source.FunctionRef;
import works.spectest.source.SignatureRegistry;
import works.spectest.values.Atom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.spectest.TestDescriptors.ATOM;
import static works.spectest.TestDescriptors.FLOAT;
import static works.spectest.TestDescriptors.INTEGER;
import static works.spectest.TestDescriptors.STRING;
import static works.spectest.harness.FailureKind.IMPLEMENTATION_ERROR;
import static works.spectest.harness.FailureKind.INVALID_INPUT_ACCEPTED;
import static works.spectest.harness.FailureKind.RESULT_DIVERGENCE;
import static works.spectest.harness.FailureKind.SPEC_MISMATCH;
import static works.spectest.harness.FailureKind.SPEC_NOT_FOUND;
import static works.spectest.harness.FailureKind.VALIDATION_FAILURE;

public class TrialHarnessTest {
	static final FunctionRef ADD = new FunctionRef("Math", "add");
	static final FunctionRef PLUS = new FunctionRef("Arith", "plus");
	static final FunctionRef FADD = new FunctionRef("Math", "fadd");
	static final FunctionRef ABS = new FunctionRef("Math", "abs");
	static final FunctionRef NOW = new FunctionRef("Clock", "now");

	static final SignatureRegistry REGISTRY = SignatureRegistry.builder()
		.define(ADD, Signature.of(INTEGER, INTEGER, INTEGER))
		.define(PLUS, Signature.of(INTEGER, INTEGER, INTEGER))
		.define(FADD, Signature.of(FLOAT, FLOAT, FLOAT))
		.define(ABS, Signature.of(BoundedIntegerNode.nonNegative(), BoundedIntegerNode.nonNegative()))
		.define(NOW, Signature.of(INTEGER))
		.build();

	static final Implementation ADD_IMPL = args -> ((Integer) args.get(0)).longValue() + (Integer) args.get(1);
	static final Implementation ADD_IMPL_2 = args -> (long) (Integer) args.get(1) + (Integer) args.get(0);

	final TrialHarness harness = TrialHarness.of(REGISTRY, TrialConfig.defaults());

	@Test
	void conformance_passes() {
		TrialResult result = harness.conformance(ADD, ADD_IMPL);
		assertInstanceOf(TrialResult.Passed.class, result);
		assertEquals(100, result.successes());
		assertEquals(TrialKind.CONFORMANCE, result.kind());
	}

	@Test
	void conformance_invalidOutput() {
		TrialResult result = harness.conformance(ADD, args -> "not a number");
		FailureRecord failure = assertFailed(VALIDATION_FAILURE, result);
		assertEquals(0, result.successes());
		assertEquals(List.of("not a number"), failure.outputs());
		assertEquals(2, failure.input().size());
		assertTrue(failure.message().contains("(string)"), failure.message());
		assertTrue(failure.message().contains("integer"), failure.message());
	}

	@Test
	void conformance_implementationError() {
		FailureRecord failure = assertFailed(IMPLEMENTATION_ERROR, harness.conformance(ADD, args -> {
			throw new UnsupportedOperationException("nope");
		}));
		assertInstanceOf(UnsupportedOperationException.class, failure.cause());
	}

	@Test
	void conformance_failsPartWayThrough() {
		AtomicInteger calls = new AtomicInteger();
		TrialResult result = harness.conformance(ADD, args -> calls.incrementAndGet() <= 10 ? 1 : null);
		assertFailed(VALIDATION_FAILURE, result);
		assertEquals(10, result.successes());
	}

	@Test
	void nonNegativeIdentity() {
		Implementation abs = args -> Math.abs((Integer) args.get(0));
		assertTrue(harness.conformance(ABS, abs).passed());
		assertTrue(harness.robustness(ABS, args -> {
			int value = (Integer) args.get(0);
			if (value < 0) {
				throw new IllegalArgumentException("negative");
			}
			return value;
		}).passed());
	}

	@Test
	void comparison_agreeingImplementations() {
		TrialResult result = harness.comparison(ADD, ADD_IMPL, PLUS, ADD_IMPL_2);
		assertTrue(result.passed());
		assertEquals(100, result.successes());
		assertEquals(ADD + " vs " + PLUS, result.subject());
	}

	@Test
	void comparison_signatureMismatch_drawsNothing() {
		AtomicInteger calls = new AtomicInteger();
		Implementation counting = args -> {
			calls.incrementAndGet();
			return 0.0;
		};
		TrialResult result = harness.comparison(ADD, ADD_IMPL, FADD, counting);
		FailureRecord failure = assertFailed(SPEC_MISMATCH, result);
		assertEquals(0, result.successes());
		assertEquals(0, calls.get());
		assertTrue(failure.input().isEmpty());
		assertTrue(failure.message().contains("do not match"), failure.message());
	}

	@Test
	void comparison_divergentResults() {
		FailureRecord failure = assertFailed(RESULT_DIVERGENCE, harness.comparison(ADD, ADD_IMPL, PLUS,
			args -> (long) (Integer) args.get(0) + (Integer) args.get(1) + 1));
		assertEquals(2, failure.outputs().size());
	}

	@Test
	void comparison_oneInvalidOutput() {
		FailureRecord failure = assertFailed(RESULT_DIVERGENCE, harness.comparison(ADD, ADD_IMPL, PLUS, args -> Atom.of("oops")));
		assertTrue(failure.message().contains("(atom)"), failure.message());
	}

	@Test
	void comparison_bothInvalid() {
		assertFailed(VALIDATION_FAILURE, harness.comparison(ADD, args -> "a", PLUS, args -> "a"));
	}

	@Test
	void comparison_specNotFound() {
		assertFailed(SPEC_NOT_FOUND, harness.comparison(ADD, ADD_IMPL, new FunctionRef("Math", "missing"), ADD_IMPL));
	}

	@Test
	void robustness_guardedImplementationPasses() {
		Implementation guarded = args -> {
			if (!(args.get(0) instanceof Integer a) || !(args.get(1) instanceof Integer b)) {
				throw new IllegalArgumentException("integers only");
			}
			return a + b;
		};
		TrialResult result = harness.robustness(ADD, guarded);
		assertTrue(result.passed());
		assertEquals(100, result.successes());
	}

	@Test
	void robustness_unguardedImplementationFails() {
		TrialResult result = harness.robustness(ADD, args -> "accepted " + args);
		FailureRecord failure = assertFailed(INVALID_INPUT_ACCEPTED, result);
		assertEquals(0, result.successes());
		assertTrue(failure.message().startsWith("Function accepted invalid input"), failure.message());
	}

	@Test
	void robustness_returnedErrorCountsAsRejection() {
		assertTrue(harness.robustness(ADD, args -> new IllegalArgumentException("bad")).passed());
	}

	@Test
	void robustness_customRejectionSignal() {
		Atom error = Atom.of("error");
		TrialHarness custom = TrialHarness.of(REGISTRY, TrialConfig.builder()
			.rejectionSignal(error::equals)
			.build());
		assertTrue(custom.robustness(ADD, args -> error).passed());
		assertFailed(INVALID_INPUT_ACCEPTED, custom.robustness(ADD, args -> new IllegalArgumentException()));
	}

	@Test
	void robustness_assertionErrorsPropagate() {
		AssertionError thrown = assertThrows(AssertionError.class, () -> harness.robustness(ADD, args -> {
			throw new AssertionError("test assertion");
		}));
		assertEquals("test assertion", thrown.getMessage());
	}

	@Test
	void robustness_noParameters() {
		TrialResult result = harness.robustness(NOW, args -> 0);
		assertTrue(result.passed());
		assertEquals(0, result.successes());
	}

	@Test
	void specNotFound() {
		FunctionRef missing = new FunctionRef("Math", "missing");
		TrialResult result = harness.conformance(missing, ADD_IMPL);
		FailureRecord failure = assertFailed(SPEC_NOT_FOUND, result);
		assertEquals(missing.toString(), result.subject());
		assertTrue(failure.message().contains("Math::missing"), failure.message());
	}

	@Test
	void signatureOverloads() {
		Signature signature = Signature.of(STRING, ATOM);
		TrialResult result = harness.conformance("inline", signature, args -> ((Atom) args.get(0)).name());
		assertTrue(result.passed());
		assertEquals("inline", result.subject());
	}

	@Test
	void trialCount() {
		TrialHarness small = TrialHarness.of(REGISTRY, TrialConfig.builder().trialCount(7).build());
		assertEquals(7, small.conformance(ADD, ADD_IMPL).successes());
	}

	@Test
	void timeBudget_stopsEarlyWithoutFailing() {
		TrialHarness hasty = TrialHarness.of(REGISTRY, TrialConfig.builder()
			.timeBudget(Duration.ofMillis(20))
			.build());
		TrialResult result = hasty.conformance(ADD, args -> {
			Thread.sleep(5);
			return 0;
		});
		assertTrue(result.passed());
		assertTrue(result.successes() < 100, "Expected the budget to cut the trial short; ran " + result.successes());
	}

	@Test
	void verboseTrace() {
		TrialHarness verbose = TrialHarness.of(REGISTRY, TrialConfig.builder().verboseTrace(true).trialCount(3).build());
		assertTrue(verbose.conformance(ADD, ADD_IMPL).passed());
		assertTrue(verbose.robustness(ADD, args -> {
			throw new IllegalArgumentException();
		}).passed());
	}

	@Test
	void invalidConfig_rejected() {
		assertThrows(IllegalArgumentException.class, () -> TrialHarness.of(REGISTRY, TrialConfig.builder().trialCount(0).build()));
		assertThrows(IllegalArgumentException.class, () -> TrialHarness.of(REGISTRY, TrialConfig.builder().timeBudget(Duration.ofSeconds(-1)).build()));
	}

	static FailureRecord assertFailed(FailureKind expectedKind, TrialResult result) {
		TrialResult.Failed failed = assertInstanceOf(TrialResult.Failed.class, result, () -> "Expected failure but got " + result);
		assertEquals(expectedKind, failed.failure().kind(), failed.failure()::message);
		return failed.failure();
	}
}
