package works.spectest.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.spectest.descriptor.TypeDescriptor;

import static java.util.Objects.requireNonNull;

/**
 * Describes the first failing draw of a trial.
 *
 * @param subject the function or functions under test
 * @param input the arguments of the failing draw; empty when the trial failed before drawing
 * @param outputs the value each implementation returned, in order; may contain nulls
 * @param expectedDescriptor the descriptor the outputs were checked against, if any
 * @param cause the exception an implementation threw, if any
 */
public record FailureRecord(
	FailureKind kind,
	String subject,
	List<Object> input,
	List<Object> outputs,
	@Nullable TypeDescriptor expectedDescriptor,
	String message,
	@Nullable Throwable cause
) {
	public FailureRecord {
		requireNonNull(kind);
		requireNonNull(subject);
		input = Collections.unmodifiableList(new ArrayList<>(input));
		outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
		requireNonNull(message);
	}

	public static FailureRecord beforeDrawing(FailureKind kind, String subject, String message, @Nullable Throwable cause) {
		return new FailureRecord(kind, subject, List.of(), List.of(), null, message, cause);
	}

	@Override
	public String toString() {
		return kind + " in " + subject + ": " + message;
	}
}
