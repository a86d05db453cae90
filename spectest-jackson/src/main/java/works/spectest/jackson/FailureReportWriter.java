package works.spectest.jackson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.function.Consumer;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.spectest.harness.TrialResult;

import static java.util.Objects.requireNonNull;

/**
 * Writes trial results as JSON lines, one result per line.
 * Can be passed as the listener of {@code SpecTests.dynamicTests}.
 */
public final class FailureReportWriter implements Consumer<TrialResult> {
	private final Writer out;
	private final ObjectMapper mapper;
	private final boolean failuresOnly;

	public FailureReportWriter(Writer out) {
		this(out, defaultMapper(), false);
	}

	/**
	 * @param mapper must have a {@link SpecTestJacksonModule} registered
	 * @param failuresOnly if true, passed results are not written
	 */
	public FailureReportWriter(Writer out, ObjectMapper mapper, boolean failuresOnly) {
		this.out = requireNonNull(out);
		this.mapper = requireNonNull(mapper);
		this.failuresOnly = failuresOnly;
	}

	public static JsonMapper defaultMapper() {
		return JsonMapper.builder()
			.addModule(new SpecTestJacksonModule())
			.build();
	}

	public String toJson(TrialResult result) {
		return mapper.writeValueAsString(result);
	}

	@Override
	public void accept(TrialResult result) {
		if (failuresOnly && result.passed()) {
			return;
		}
		try {
			out.write(toJson(result));
			out.write('\n');
			out.flush();
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to write report for " + result.subject(), e);
		}
	}
}
