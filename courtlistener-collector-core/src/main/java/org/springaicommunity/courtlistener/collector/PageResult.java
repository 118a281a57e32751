package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * One decoded page of results.
 *
 * @param records the page's records, in the order the server returned them
 * @param next absolute URL of the following page, or {@code null} on the last page
 */
public record PageResult(List<JsonNode> records, @Nullable String next) {

	public PageResult {
		records = List.copyOf(records);
	}

	public Optional<String> nextPage() {
		return Optional.ofNullable(next);
	}

	public boolean hasNext() {
		return next != null;
	}

}
