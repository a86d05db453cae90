package works.spectest.values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A fixed-arity positional product of values.
 * Elements may be {@code null}.
 */
public record Tuple(List<Object> elements) {
	public Tuple {
		elements = Collections.unmodifiableList(new ArrayList<>(elements));
	}

	public static Tuple of(Object... elements) {
		return new Tuple(Arrays.asList(elements));
	}

	public int size() {
		return elements.size();
	}

	public Object get(int index) {
		return elements.get(index);
	}

	@Override
	public String toString() {
		return Values.inspect(this);
	}
}
