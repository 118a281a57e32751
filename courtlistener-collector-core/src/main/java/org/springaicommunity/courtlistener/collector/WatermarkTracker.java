package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Keeps the largest cursor value seen across a fetch session.
 *
 * <p>
 * The cursor field is read from each observed record, cut to a fixed prefix (10
 * characters turns {@code 2024-03-01T12:00:00Z} into {@code 2024-03-01}) and compared as
 * a string. Records without the field are skipped. The value only ever grows.
 */
public class WatermarkTracker {

	public static final int DEFAULT_PREFIX_LENGTH = 10;

	private final String cursorField;

	private final int prefixLength;

	@Nullable
	private String maximum;

	public WatermarkTracker(String cursorField) {
		this(cursorField, DEFAULT_PREFIX_LENGTH);
	}

	/**
	 * @param cursorField record attribute holding the cursor value
	 * @param prefixLength number of leading characters to compare; 0 keeps the whole value
	 */
	public WatermarkTracker(String cursorField, int prefixLength) {
		if (cursorField.isBlank()) {
			throw new IllegalArgumentException("Cursor field must not be blank");
		}
		if (prefixLength < 0) {
			throw new IllegalArgumentException("Prefix length must not be negative (got: " + prefixLength + ")");
		}
		this.cursorField = cursorField;
		this.prefixLength = prefixLength;
	}

	/**
	 * Consider one record. Does not modify it.
	 */
	public void observe(JsonNode record) {
		extract(record).ifPresent(value -> {
			if (maximum == null || value.compareTo(maximum) > 0) {
				maximum = value;
			}
		});
	}

	/**
	 * The largest cursor value observed, empty if no record carried one.
	 */
	public Optional<String> current() {
		return Optional.ofNullable(maximum);
	}

	/**
	 * Extract the cursor value of a record using this tracker's field and prefix.
	 */
	public Optional<String> extract(JsonNode record) {
		JsonNode field = record.path(cursorField);
		if (field.isMissingNode() || field.isNull() || field.isContainerNode()) {
			return Optional.empty();
		}
		String text = field.asText();
		if (text.isEmpty()) {
			return Optional.empty();
		}
		if (prefixLength > 0 && text.length() > prefixLength) {
			text = text.substring(0, prefixLength);
		}
		return Optional.of(text);
	}

	public String getCursorField() {
		return cursorField;
	}

}
