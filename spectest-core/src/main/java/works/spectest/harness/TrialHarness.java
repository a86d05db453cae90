package works.spectest.harness;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import net.jqwik.api.Arbitrary;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spectest.descriptor.Equivalence;
import works.spectest.descriptor.MappingField;
import works.spectest.descriptor.RecordNode;
import works.spectest.descriptor.RemoteRefNode;
import works.spectest.descriptor.Signature;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.engine.GeneratorSynthesizer;
import works.spectest.engine.InvalidGeneratorSynthesizer;
import works.spectest.engine.ValidatorSynthesizer;
import works.spectest.exceptions.SpecNotFoundException;
import works.spectest.source.DescriptorResolver;
import works.spectest.source.FunctionRef;
import works.spectest.source.SignatureRegistry;
import works.spectest.source.SignatureSource;
import works.spectest.values.TypeNamer;
import works.spectest.values.Values;

import static works.spectest.harness.FailureKind.IMPLEMENTATION_ERROR;
import static works.spectest.harness.FailureKind.INVALID_INPUT_ACCEPTED;
import static works.spectest.harness.FailureKind.RESULT_DIVERGENCE;
import static works.spectest.harness.FailureKind.SPEC_MISMATCH;
import static works.spectest.harness.FailureKind.SPEC_NOT_FOUND;
import static works.spectest.harness.FailureKind.TYPE_INCONSISTENCY;
import static works.spectest.harness.FailureKind.VALIDATION_FAILURE;
import static works.spectest.harness.TrialKind.COMPARISON;
import static works.spectest.harness.TrialKind.CONFORMANCE;
import static works.spectest.harness.TrialKind.RECORD_CONSISTENCY;
import static works.spectest.harness.TrialKind.ROBUSTNESS;

/**
 * Runs property trials against implementations, driven entirely by their signatures.
 * <p>
 * Each trial draws up to {@link TrialConfig#trialCount()} inputs, one at a time,
 * and stops at the first failing draw.
 * Trial failures are returned as {@link TrialResult.Failed}, never thrown.
 * {@link AssertionError}s raised by an implementation propagate unchanged.
 * <p>
 * A harness is stateless between trials, but each trial runs on the calling thread
 * and is not itself thread-safe.
 */
public final class TrialHarness {
	private final SignatureSource signatures;
	private final DescriptorResolver resolver;
	private final TrialConfig config;
	private final GeneratorSynthesizer generators;
	private final ValidatorSynthesizer validators;
	private final InvalidGeneratorSynthesizer invalidGenerators;

	public TrialHarness(SignatureSource signatures, DescriptorResolver resolver, TrialConfig config) {
		config.validate();
		this.signatures = signatures;
		this.resolver = resolver;
		this.config = config;
		this.generators = new GeneratorSynthesizer(resolver);
		this.validators = new ValidatorSynthesizer(resolver);
		this.invalidGenerators = new InvalidGeneratorSynthesizer(resolver);
	}

	public static TrialHarness of(SignatureRegistry registry, TrialConfig config) {
		return new TrialHarness(registry, registry, config);
	}

	public TrialConfig config() {
		return config;
	}

	public SignatureSource signatures() {
		return signatures;
	}

	// Conformance

	public TrialResult conformance(FunctionRef function, Implementation implementation) {
		return withSignature(CONFORMANCE, function, signature ->
			conformance(function.toString(), signature, implementation));
	}

	public TrialResult conformance(String subject, Signature signature, Implementation implementation) {
		TypeDescriptor returnType = signature.returnType();
		Predicate<Object> validOutput = validators.validatorFor(returnType);
		return runDraws(CONFORMANCE, subject, generators.argumentsFor(signature.parameters()), input -> {
			Object output;
			try {
				output = implementation.invoke(input);
			} catch (Exception e) {
				return Optional.of(implementationError(subject, input, returnType, e));
			}
			trace(input, output);
			if (validOutput.test(output)) {
				return Optional.empty();
			}
			return Optional.of(new FailureRecord(
				VALIDATION_FAILURE, subject, input, Collections.singletonList(output), returnType,
				validationMessage(output, returnType), null));
		});
	}

	// Comparison

	public TrialResult comparison(FunctionRef functionA, Implementation implementationA, FunctionRef functionB, Implementation implementationB) {
		return withSignature(COMPARISON, functionA, signatureA ->
			withSignature(COMPARISON, functionB, signatureB ->
				comparison(functionA.toString(), signatureA, implementationA, functionB.toString(), signatureB, implementationB)));
	}

	/**
	 * Both implementations receive each input, A first.
	 * The signatures must be {@link Equivalence equivalent}; otherwise the trial fails without drawing.
	 */
	public TrialResult comparison(
		String subjectA, Signature signatureA, Implementation implementationA,
		String subjectB, Signature signatureB, Implementation implementationB
	) {
		String subject = subjectA + " vs " + subjectB;
		if (!Equivalence.equivalent(signatureA, signatureB)) {
			LOGGER.debug("Signature mismatch: {} has {}; {} has {}", subjectA, signatureA, subjectB, signatureB);
			return new TrialResult.Failed(COMPARISON, subject, 0, FailureRecord.beforeDrawing(SPEC_MISMATCH, subject,
				"Signatures do not match: " + subjectA + " declares " + signatureA + " but " + subjectB + " declares " + signatureB,
				null));
		}
		TypeDescriptor returnType = signatureA.returnType();
		Predicate<Object> validOutput = validators.validatorFor(returnType);
		return runDraws(COMPARISON, subject, generators.argumentsFor(signatureA.parameters()), input -> {
			Object outputA;
			Object outputB;
			try {
				outputA = implementationA.invoke(input);
			} catch (Exception e) {
				return Optional.of(implementationError(subjectA, input, returnType, e));
			}
			try {
				outputB = implementationB.invoke(input);
			} catch (Exception e) {
				return Optional.of(implementationError(subjectB, input, returnType, e));
			}
			trace(input, outputA, outputB);
			List<Object> outputs = Arrays.asList(outputA, outputB);
			boolean validA = validOutput.test(outputA);
			boolean validB = validOutput.test(outputB);
			if (!validA && !validB) {
				return Optional.of(new FailureRecord(VALIDATION_FAILURE, subject, input, outputs, returnType,
					subjectA + ": " + validationMessage(outputA, returnType) + "; "
						+ subjectB + ": " + validationMessage(outputB, returnType), null));
			} else if (validA != validB) {
				String invalidOne = validA ? subjectB : subjectA;
				Object invalidOutput = validA ? outputB : outputA;
				return Optional.of(new FailureRecord(RESULT_DIVERGENCE, subject, input, outputs, returnType,
					"Only one output is valid. " + invalidOne + ": " + validationMessage(invalidOutput, returnType), null));
			} else if (!Objects.deepEquals(outputA, outputB)) {
				return Optional.of(new FailureRecord(RESULT_DIVERGENCE, subject, input, outputs, returnType,
					"Implementations disagree on input " + Values.inspect(input) + ": "
						+ subjectA + " returned " + Values.inspect(outputA) + " but "
						+ subjectB + " returned " + Values.inspect(outputB), null));
			} else {
				return Optional.empty();
			}
		});
	}

	// Robustness

	public TrialResult robustness(FunctionRef function, Implementation implementation) {
		return withSignature(ROBUSTNESS, function, signature ->
			robustness(function.toString(), signature, implementation));
	}

	/**
	 * Every draw supplies invalid values for all parameters.
	 * The implementation passes a draw by throwing an {@link Exception}
	 * or by returning a value recognized by {@link TrialConfig#rejectionSignal()}.
	 * A function with no parameters has no invalid inputs, and passes trivially.
	 */
	public TrialResult robustness(String subject, Signature signature, Implementation implementation) {
		if (signature.parameters().isEmpty()) {
			LOGGER.info("{} takes no parameters; no invalid inputs to try", subject);
			return new TrialResult.Passed(ROBUSTNESS, subject, 0);
		}
		return runDraws(ROBUSTNESS, subject, invalidGenerators.invalidArgumentsFor(signature.parameters()), input -> {
			Object output;
			try {
				output = implementation.invoke(input);
			} catch (Exception e) {
				if (config.verboseTrace()) {
					LOGGER.info("Input: {} -> rejected with {}", Values.inspect(input), e.toString());
				}
				return Optional.empty();
			}
			trace(input, output);
			if (config.rejectionSignal().test(output)) {
				return Optional.empty();
			}
			return Optional.of(new FailureRecord(
				INVALID_INPUT_ACCEPTED, subject, input, Collections.singletonList(output), null,
				"Function accepted invalid input " + Values.inspect(input)
					+ " and returned " + Values.inspect(output)
					+ ". Expected it to throw an exception or otherwise reject the input.",
				null));
		});
	}

	// Record consistency

	public TrialResult recordConsistency(FunctionRef function, Implementation implementation, TypeDescriptor recordDefinition) {
		return withSignature(RECORD_CONSISTENCY, function, signature ->
			recordConsistency(function.toString(), signature, implementation, recordDefinition));
	}

	/**
	 * Applies a one-parameter function to a record generated from {@code recordDefinition},
	 * which is usually a {@link RemoteRefNode} naming the record type.
	 * <p>
	 * The function must not throw.
	 * If the function's declared parameter is a record whose fields disagree with the definition,
	 * the output must also satisfy the declared return type.
	 * A definition that isn't a record passes without drawing anything.
	 */
	public TrialResult recordConsistency(String subject, Signature signature, Implementation implementation, TypeDescriptor recordDefinition) {
		if (signature.arity() != 1) {
			return new TrialResult.Failed(RECORD_CONSISTENCY, subject, 0, FailureRecord.beforeDrawing(SPEC_MISMATCH, subject,
				"Record consistency needs a function of one parameter; signature is " + signature, null));
		}
		Optional<RecordNode> definition = resolveRecord(recordDefinition, new HashSet<>());
		if (definition.isEmpty()) {
			LOGGER.info("{} does not describe a record; nothing to check for {}", recordDefinition, subject);
			return new TrialResult.Passed(RECORD_CONSISTENCY, subject, 0);
		}
		RecordNode record = definition.get();
		List<String> disagreements = resolveRecord(signature.parameters().get(0), new HashSet<>())
			.map(declared -> fieldDisagreements(record, declared))
			.orElse(List.of());
		TypeDescriptor returnType = signature.returnType();
		Predicate<Object> validOutput = validators.validatorFor(returnType);

		try (TrialCounter counter = TrialCounter.open()) {
			Object value = generators.generatorFor(record).sampleStream().findFirst().orElseThrow();
			List<Object> input = Collections.singletonList(value);
			Object output;
			try {
				output = implementation.invoke(input);
			} catch (Exception e) {
				return new TrialResult.Failed(RECORD_CONSISTENCY, subject, counter.value(), new FailureRecord(
					TYPE_INCONSISTENCY, subject, input, List.of(), record,
					"Function threw " + e + " when applied to a " + record.typeName() + " built from its own definition",
					e));
			}
			trace(input, output);
			if (!disagreements.isEmpty() && !validOutput.test(output)) {
				return new TrialResult.Failed(RECORD_CONSISTENCY, subject, counter.value(), new FailureRecord(
					TYPE_INCONSISTENCY, subject, input, Collections.singletonList(output), returnType,
					"Type inconsistency: " + String.join("; ", disagreements) + ". "
						+ validationMessage(output, returnType),
					null));
			}
			counter.increment();
			LOGGER.info("✓ {} successful {} runs of {}", counter.value(), RECORD_CONSISTENCY.displayName(), subject);
			return new TrialResult.Passed(RECORD_CONSISTENCY, subject, counter.value());
		}
	}

	private Optional<RecordNode> resolveRecord(TypeDescriptor descriptor, Set<String> visited) {
		if (descriptor instanceof RecordNode record) {
			return Optional.of(record);
		} else if (descriptor instanceof RemoteRefNode ref && visited.add(ref.qualifiedName())) {
			return resolver.resolve(ref).flatMap(resolved -> resolveRecord(resolved, visited));
		} else {
			return Optional.empty();
		}
	}

	private static List<String> fieldDisagreements(RecordNode definition, RecordNode declared) {
		return definition.fields().stream()
			.flatMap(field -> declared.fields().stream()
				.filter(other -> Equivalence.equivalent(field.key(), other.key()))
				.filter(other -> !Equivalence.equivalent(field.value(), other.value()))
				.map(other -> disagreement(definition, field, other)))
			.toList();
	}

	private static String disagreement(RecordNode definition, MappingField defined, MappingField declared) {
		return definition.typeName() + " defines field " + defined.key() + " as " + defined.value()
			+ " but the signature expects " + declared.value();
	}

	// Plumbing

	@FunctionalInterface
	private interface DrawCheck {
		Optional<FailureRecord> check(List<Object> input);
	}

	private TrialResult runDraws(TrialKind kind, String subject, Arbitrary<List<Object>> inputs, DrawCheck check) {
		long budgetNanos = (config.timeBudget() == null) ? Long.MAX_VALUE : config.timeBudget().toNanos();
		long start = System.nanoTime();
		try (TrialCounter counter = TrialCounter.open()) {
			Iterator<List<Object>> draws = inputs.sampleStream().iterator();
			while (counter.value() < config.trialCount()) {
				if (System.nanoTime() - start > budgetNanos) {
					LOGGER.info("Time budget {} used up after {} {} runs of {}", config.timeBudget(), counter.value(), kind.displayName(), subject);
					break;
				}
				Optional<FailureRecord> failure = check.check(draws.next());
				if (failure.isPresent()) {
					LOGGER.debug("{} trial of {} failed after {} successful runs: {}", kind.displayName(), subject, counter.value(), failure.get().message());
					return new TrialResult.Failed(kind, subject, counter.value(), failure.get());
				}
				counter.increment();
			}
			LOGGER.info("✓ {} successful {} runs of {}", counter.value(), kind.displayName(), subject);
			return new TrialResult.Passed(kind, subject, counter.value());
		}
	}

	private TrialResult withSignature(TrialKind kind, FunctionRef function, Function<Signature, TrialResult> trial) {
		Signature signature;
		try {
			signature = signatures.signatureOf(function);
		} catch (SpecNotFoundException e) {
			LOGGER.warn("No signature for {}", function, e);
			return new TrialResult.Failed(kind, function.toString(), 0,
				FailureRecord.beforeDrawing(SPEC_NOT_FOUND, function.toString(), e.getMessage(), e));
		}
		return trial.apply(signature);
	}

	private static FailureRecord implementationError(String subject, List<Object> input, @Nullable TypeDescriptor expected, Exception e) {
		return new FailureRecord(IMPLEMENTATION_ERROR, subject, input, List.of(), expected,
			subject + " threw " + e + " for valid input " + Values.inspect(input), e);
	}

	private static String validationMessage(Object output, TypeDescriptor returnType) {
		return "Output type validation failed: function returned " + Values.inspect(output)
			+ " (" + TypeNamer.nameOf(output) + ") but its signature declares return type " + returnType;
	}

	private void trace(List<Object> input, Object output) {
		if (config.verboseTrace()) {
			LOGGER.info("Input: {} -> Output: {}", Values.inspect(input), Values.inspect(output));
		}
	}

	private void trace(List<Object> input, Object outputA, Object outputB) {
		if (config.verboseTrace()) {
			LOGGER.info("Input: {} -> Outputs: {} | {}", Values.inspect(input), Values.inspect(outputA), Values.inspect(outputB));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TrialHarness.class);
}
