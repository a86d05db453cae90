package works.spectest.descriptor;

import java.util.List;

final class Fields {
	private Fields() {}

	static List<MappingField> checkedCopy(List<MappingField> fields) {
		List<MappingField> result = List.copyOf(fields);
		for (int i = 0; i < result.size(); i++) {
			for (int j = i + 1; j < result.size(); j++) {
				if (Equivalence.equivalent(result.get(i).key(), result.get(j).key())) {
					throw new IllegalArgumentException("Duplicate field key " + result.get(i).key());
				}
			}
		}
		return result;
	}
}
