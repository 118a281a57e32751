package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;

/**
 * Allow-list of record fields to keep before persisting. An empty list keeps records
 * unchanged.
 */
public record FieldProjection(List<String> fields) {

	public FieldProjection {
		fields = List.copyOf(fields);
	}

	public static FieldProjection all() {
		return new FieldProjection(List.of());
	}

	/**
	 * Parse a comma-separated list, ignoring blanks.
	 */
	public static FieldProjection parse(String commaSeparated) {
		return new FieldProjection(
				Arrays.stream(commaSeparated.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList());
	}

	public boolean isAll() {
		return fields.isEmpty();
	}

	/**
	 * Apply the projection. Listed fields missing from the record are skipped.
	 * @return the record itself when the projection keeps everything, otherwise a new
	 * object with the listed fields in list order
	 */
	public JsonNode apply(JsonNode record) {
		if (isAll()) {
			return record;
		}
		ObjectNode projected = JsonNodeFactory.instance.objectNode();
		for (String field : fields) {
			if (record.has(field)) {
				projected.set(field, record.get(field));
			}
		}
		return projected;
	}

}
