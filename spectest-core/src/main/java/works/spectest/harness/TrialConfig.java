package works.spectest.harness;

import java.time.Duration;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class TrialConfig {
	/**
	 * The number of draws per trial.
	 */
	@Default int trialCount = 100;

	/**
	 * Log every input and output at INFO level.
	 */
	@Default boolean verboseTrace = false;

	/**
	 * If set, a trial stops drawing once this much time has elapsed,
	 * and passes if every draw so far has passed.
	 * Useful for slow implementations.
	 */
	@Nullable Duration timeBudget;

	/**
	 * In robustness trials, recognizes a <em>returned</em> value as a rejection of the input.
	 * Thrown exceptions are always rejections.
	 * <p>
	 * By default, returning a {@link Throwable} counts as a rejection,
	 * for implementations that report errors as values.
	 */
	@Default Predicate<Object> rejectionSignal = value -> value instanceof Throwable;

	public static TrialConfig defaults() {
		return TrialConfig.builder().build();
	}

	public void validate() {
		if (trialCount <= 0) {
			throw new IllegalArgumentException("trialCount must be positive: " + trialCount);
		}
		if (timeBudget != null && timeBudget.isNegative()) {
			throw new IllegalArgumentException("timeBudget can't be negative: " + timeBudget);
		}
	}
}
