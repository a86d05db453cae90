package works.spectest.harness;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A trial that has been configured but not yet run.
 * Running it again runs a fresh trial with fresh draws.
 */
public record TrialPlan(
	String displayName,
	TrialKind kind,
	Supplier<TrialResult> execution
) {
	public TrialPlan {
		requireNonNull(displayName);
		requireNonNull(kind);
		requireNonNull(execution);
	}

	public TrialResult run() {
		return execution.get();
	}
}
