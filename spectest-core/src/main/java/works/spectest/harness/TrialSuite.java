package works.spectest.harness;

import java.util.ArrayList;
import java.util.List;
import works.spectest.descriptor.Signature;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.source.FunctionRef;

import static works.spectest.harness.TrialKind.COMPARISON;
import static works.spectest.harness.TrialKind.CONFORMANCE;
import static works.spectest.harness.TrialKind.RECORD_CONSISTENCY;
import static works.spectest.harness.TrialKind.ROBUSTNESS;

/**
 * An ordered collection of {@link TrialPlan}s sharing one {@link TrialHarness},
 * assembled at runtime.
 */
public final class TrialSuite {
	private final TrialHarness harness;
	private final List<TrialPlan> plans;

	private TrialSuite(TrialHarness harness, List<TrialPlan> plans) {
		this.harness = harness;
		this.plans = List.copyOf(plans);
	}

	public static Builder builder(TrialHarness harness) {
		return new Builder(harness);
	}

	public TrialHarness harness() {
		return harness;
	}

	public List<TrialPlan> plans() {
		return plans;
	}

	public List<TrialResult> runAll() {
		return plans.stream().map(TrialPlan::run).toList();
	}

	public static final class Builder {
		private final TrialHarness harness;
		private final List<TrialPlan> plans = new ArrayList<>();

		private Builder(TrialHarness harness) {
			this.harness = harness;
		}

		public Builder conformance(FunctionRef function, Implementation implementation) {
			return add(new TrialPlan(displayName(CONFORMANCE, function.toString()), CONFORMANCE,
				() -> harness.conformance(function, implementation)));
		}

		public Builder conformance(String subject, Signature signature, Implementation implementation) {
			return add(new TrialPlan(displayName(CONFORMANCE, subject), CONFORMANCE,
				() -> harness.conformance(subject, signature, implementation)));
		}

		public Builder comparison(FunctionRef functionA, Implementation implementationA, FunctionRef functionB, Implementation implementationB) {
			return add(new TrialPlan(displayName(COMPARISON, functionA + " vs " + functionB), COMPARISON,
				() -> harness.comparison(functionA, implementationA, functionB, implementationB)));
		}

		public Builder comparison(
			String subjectA, Signature signatureA, Implementation implementationA,
			String subjectB, Signature signatureB, Implementation implementationB
		) {
			return add(new TrialPlan(displayName(COMPARISON, subjectA + " vs " + subjectB), COMPARISON,
				() -> harness.comparison(subjectA, signatureA, implementationA, subjectB, signatureB, implementationB)));
		}

		public Builder robustness(FunctionRef function, Implementation implementation) {
			return add(new TrialPlan(displayName(ROBUSTNESS, function.toString()), ROBUSTNESS,
				() -> harness.robustness(function, implementation)));
		}

		public Builder robustness(String subject, Signature signature, Implementation implementation) {
			return add(new TrialPlan(displayName(ROBUSTNESS, subject), ROBUSTNESS,
				() -> harness.robustness(subject, signature, implementation)));
		}

		public Builder recordConsistency(FunctionRef function, Implementation implementation, TypeDescriptor recordDefinition) {
			return add(new TrialPlan(displayName(RECORD_CONSISTENCY, function.toString()), RECORD_CONSISTENCY,
				() -> harness.recordConsistency(function, implementation, recordDefinition)));
		}

		public Builder add(TrialPlan plan) {
			plans.add(plan);
			return this;
		}

		public TrialSuite build() {
			return new TrialSuite(harness, plans);
		}

		private static String displayName(TrialKind kind, String subject) {
			return kind.displayName() + ": " + subject;
		}
	}
}
