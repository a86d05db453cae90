package works.spectest.jackson;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;
import works.spectest.descriptor.BoundedIntegerNode;
import works.spectest.descriptor.PrimitiveKind;
import works.spectest.descriptor.PrimitiveNode;
import works.spectest.descriptor.RecordNode;
import works.spectest.descriptor.SequenceNode;
import works.spectest.harness.FailureKind;
import works.spectest.harness.FailureRecord;
import works.spectest.harness.TrialKind;
import works.spectest.harness.TrialResult;
import works.spectest.values.Atom;
import works.spectest.values.Bitstring;
import works.spectest.values.Struct;
import works.spectest.values.Tuple;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.spectest.descriptor.RecordNode.field;

public class SpecTestJacksonModuleTest {
	final JsonMapper mapper = FailureReportWriter.defaultMapper();

	@Test
	void atom() {
		assertEquals("{\"atom\":\"ok\"}", mapper.writeValueAsString(Atom.of("ok")));
	}

	@Test
	void tuple() {
		Tuple tuple = Tuple.of(1, "a", Atom.of("ok"), null);
		assertEquals("{\"tuple\":[1,\"a\",{\"atom\":\"ok\"},null]}", mapper.writeValueAsString(tuple));
	}

	@Test
	void nestedCollections() {
		List<Object> value = List.of(Tuple.of(Atom.of("x"), 2.5), List.of(true));
		assertEquals("[{\"tuple\":[{\"atom\":\"x\"},2.5]},[true]]", mapper.writeValueAsString(value));
	}

	@Test
	void bitstring() {
		Bitstring bits = Bitstring.of(new byte[]{(byte) 0xAB, (byte) 0xCD}, 12);
		assertEquals("{\"bits\":12,\"bytes\":\"q8A=\"}", mapper.writeValueAsString(bits));
	}

	@Test
	void struct() {
		Map<Object, Object> fields = new LinkedHashMap<>();
		fields.put(Atom.of("name"), "bo");
		fields.put(Atom.of("age"), 7);
		fields.put("legacy", Atom.of("yes"));
		assertEquals("{\"record\":\"User\",\"fields\":{\"name\":\"bo\",\"age\":7,\"\\\"legacy\\\"\":{\"atom\":\"yes\"}}}",
			mapper.writeValueAsString(new Struct("User", fields)));
	}

	@Test
	void descriptors() {
		assertEquals("\"integer[0..]\"", mapper.writeValueAsString(BoundedIntegerNode.nonNegative()));
		assertEquals("\"list<integer>\"", mapper.writeValueAsString(new SequenceNode(PrimitiveNode.of(PrimitiveKind.INTEGER))));
		assertEquals("\"User{name: string}\"", mapper.writeValueAsString(
			RecordNode.of("User", field("name", PrimitiveNode.of(PrimitiveKind.STRING)))));
	}

	@Test
	void passedResult() {
		TrialResult result = new TrialResult.Passed(TrialKind.CONFORMANCE, "Math::add", 100);
		assertEquals("{\"trial\":\"conformance\",\"subject\":\"Math::add\",\"passed\":true,\"successes\":100}",
			mapper.writeValueAsString(result));
	}

	@Test
	void failedResult() {
		FailureRecord failure = new FailureRecord(FailureKind.IMPLEMENTATION_ERROR, "Math::add",
			List.of(1, Atom.of("two")), Arrays.asList((Object) null), PrimitiveNode.of(PrimitiveKind.INTEGER),
			"Math::add threw", new IllegalStateException("boom"));
		TrialResult result = new TrialResult.Failed(TrialKind.ROBUSTNESS, "Math::add", 3, failure);
		assertEquals("{\"trial\":\"robustness\",\"subject\":\"Math::add\",\"passed\":false,\"successes\":3,"
				+ "\"failure\":{\"kind\":\"IMPLEMENTATION_ERROR\",\"subject\":\"Math::add\","
				+ "\"input\":[1,{\"atom\":\"two\"}],\"outputs\":[null],\"expected\":\"integer\","
				+ "\"message\":\"Math::add threw\",\"cause\":\"java.lang.IllegalStateException: boom\"}}",
			mapper.writeValueAsString(result));
	}

	@Test
	void failureBeforeDrawing() {
		String json = mapper.writeValueAsString(FailureRecord.beforeDrawing(FailureKind.SPEC_NOT_FOUND, "Math::gone", "No signature", null));
		assertThat(json, containsString("\"input\":[]"));
		assertThat(json, containsString("\"expected\":null"));
		assertThat(json, containsString("\"cause\":null"));
		assertThat(json, not(containsString("\"successes\"")));
	}
}
