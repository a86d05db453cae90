package works.spectest.values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A named record value: a field map tagged with the name of its record type.
 * Field values may be {@code null}.
 */
public record Struct(String typeName, Map<Object, Object> fields) {
	public Struct {
		requireNonNull(typeName);
		fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	public Object get(Object key) {
		return fields.get(key);
	}

	@Override
	public String toString() {
		return Values.inspect(this);
	}
}
