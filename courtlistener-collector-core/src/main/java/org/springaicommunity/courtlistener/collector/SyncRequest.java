package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Parameters of one incremental sync run.
 *
 * @param username output namespace; names the output file and the index entry
 * @param limit maximum number of records to collect, positive
 * @param dateMin explicit lower bound for the cursor field, or null to fall back to the
 * watermark file
 * @param projection fields to keep in the saved records
 * @param sinceFile watermark file, or null to run without one
 * @param append true to append to the output file instead of replacing it
 */
public record SyncRequest(String username, int limit, @Nullable String dateMin, FieldProjection projection,
		@Nullable Path sinceFile, boolean append) {

	public SyncRequest {
		if (username == null || username.isBlank()) {
			throw new IllegalArgumentException("Username must not be blank");
		}
		if (limit <= 0) {
			throw new IllegalArgumentException("Limit must be positive (got: " + limit + ")");
		}
		if (dateMin != null && dateMin.isBlank()) {
			dateMin = null;
		}
		if (projection == null) {
			projection = FieldProjection.all();
		}
	}

	/**
	 * Request with defaults: no date filter, all fields, no watermark file, replace mode.
	 */
	public static SyncRequest of(String username, int limit) {
		return new SyncRequest(username, limit, null, FieldProjection.all(), null, false);
	}

}
