package works.spectest.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.List;
import java.util.Map;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.ser.Serializers;
import works.spectest.descriptor.TypeDescriptor;
import works.spectest.harness.FailureRecord;
import works.spectest.harness.TrialResult;
import works.spectest.values.Atom;
import works.spectest.values.Bitstring;
import works.spectest.values.Struct;
import works.spectest.values.Tuple;
import works.spectest.values.Values;

/**
 * Serializes spectest values, descriptors and trial results as JSON, for reporting.
 * <p>
 * Values that JSON can't represent directly are written as single-member objects
 * tagged with their kind, such as <code>{"atom":"ok"}</code> or <code>{"tuple":[1,2]}</code>.
 * Descriptors are written in their {@code toString} notation.
 * Serialization only; reports are not meant to be read back.
 */
public class SpecTestJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new SpecTestSerializers());
	}

	private static final class SpecTestSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			Class<?> theClass = type.getRawClass();
			if (Atom.class.isAssignableFrom(theClass)) {
				return atomSerializer();
			} else if (Tuple.class.isAssignableFrom(theClass)) {
				return tupleSerializer();
			} else if (Bitstring.class.isAssignableFrom(theClass)) {
				return bitstringSerializer();
			} else if (Struct.class.isAssignableFrom(theClass)) {
				return structSerializer();
			} else if (TypeDescriptor.class.isAssignableFrom(theClass)) {
				return descriptorSerializer();
			} else if (FailureRecord.class.isAssignableFrom(theClass)) {
				return failureRecordSerializer();
			} else if (TrialResult.class.isAssignableFrom(theClass)) {
				return trialResultSerializer();
			} else {
				return null;
			}
		}

		private ValueSerializer<Atom> atomSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Atom value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("atom");
					gen.writeString(value.name());
					gen.writeEndObject();
				}
			};
		}

		private ValueSerializer<Tuple> tupleSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Tuple value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("tuple");
					writeList(value.elements(), gen);
					gen.writeEndObject();
				}
			};
		}

		private ValueSerializer<Bitstring> bitstringSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Bitstring value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("bits");
					gen.writeNumber(value.bitLength());
					gen.writeName("bytes");
					gen.writeBinary(value.bytes());
					gen.writeEndObject();
				}
			};
		}

		private ValueSerializer<Struct> structSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Struct value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("record");
					gen.writeString(value.typeName());
					gen.writeName("fields");
					writeFields(value.fields(), gen);
					gen.writeEndObject();
				}
			};
		}

		private ValueSerializer<TypeDescriptor> descriptorSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(TypeDescriptor value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeString(value.toString());
				}
			};
		}

		private ValueSerializer<FailureRecord> failureRecordSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(FailureRecord value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("kind");
					gen.writeString(value.kind().name());
					gen.writeName("subject");
					gen.writeString(value.subject());
					gen.writeName("input");
					writeList(value.input(), gen);
					gen.writeName("outputs");
					writeList(value.outputs(), gen);
					gen.writeName("expected");
					writeNullableString(value.expectedDescriptor(), gen);
					gen.writeName("message");
					gen.writeString(value.message());
					gen.writeName("cause");
					writeNullableString(value.cause(), gen);
					gen.writeEndObject();
				}
			};
		}

		private ValueSerializer<TrialResult> trialResultSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(TrialResult value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("trial");
					gen.writeString(value.kind().displayName());
					gen.writeName("subject");
					gen.writeString(value.subject());
					gen.writeName("passed");
					gen.writeBoolean(value.passed());
					gen.writeName("successes");
					gen.writeNumber(value.successes());
					if (value instanceof TrialResult.Failed failed) {
						gen.writeName("failure");
						gen.writePOJO(failed.failure());
					}
					gen.writeEndObject();
				}
			};
		}

		private static void writeList(List<?> values, JsonGenerator gen) {
			gen.writeStartArray();
			for (Object value : values) {
				gen.writePOJO(value);
			}
			gen.writeEndArray();
		}

		/**
		 * JSON member names must be strings, so non-atom keys are written in their diagnostic form.
		 */
		private static void writeFields(Map<?, ?> fields, JsonGenerator gen) {
			gen.writeStartObject();
			for (Map.Entry<?, ?> entry : fields.entrySet()) {
				gen.writeName(entry.getKey() instanceof Atom atom ? atom.name() : Values.inspect(entry.getKey()));
				gen.writePOJO(entry.getValue());
			}
			gen.writeEndObject();
		}

		private static void writeNullableString(Object value, JsonGenerator gen) {
			if (value == null) {
				gen.writeNull();
			} else {
				gen.writeString(value.toString());
			}
		}
	}

}
