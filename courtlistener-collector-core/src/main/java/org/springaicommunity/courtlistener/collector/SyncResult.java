package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a sync run.
 *
 * @param records the saved records, after projection
 * @param outputFile the record file written
 * @param indexFile the user index that was updated
 * @param effectiveDateMin lower bound sent with the first page request, if any
 * @param trackedWatermark largest cursor value among the fetched records, if any
 * @param watermarkWritten value written to the watermark file, if any
 * @param pagesFetched number of pages requested from the API
 * @param fetchError error that ended fetching early after some records were collected
 * @param watermarkError error raised while writing the watermark file
 */
public record SyncResult(List<JsonNode> records, Path outputFile, Path indexFile, @Nullable String effectiveDateMin,
		@Nullable String trackedWatermark, @Nullable String watermarkWritten, int pagesFetched,
		@Nullable CourtListenerException fetchError, @Nullable PersistenceException watermarkError) {

	public SyncResult {
		records = List.copyOf(records);
	}

	public int recordCount() {
		return records.size();
	}

	/**
	 * True when fetching stopped on an error and only part of the requested records were
	 * saved.
	 */
	public boolean isPartial() {
		return fetchError != null;
	}

	public Optional<CourtListenerException> fetchFailure() {
		return Optional.ofNullable(fetchError);
	}

	public Optional<String> watermark() {
		return Optional.ofNullable(watermarkWritten);
	}

}
