package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Output namespace
	@Nullable
	public String user;

	public int limit;

	// Lower bound for the cursor field (YYYY-MM-DD)
	@Nullable
	public String dateMin = null;

	// Connection overrides; null keeps the environment value
	@Nullable
	public String token = null;

	@Nullable
	public String userAgent = null;

	public List<String> fields = new ArrayList<>();

	@Nullable
	public String sinceFile = null;

	public boolean append = false; // Default to clean mode

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(CollectorProperties defaultProperties) {
		this.limit = defaultProperties.getDefaultLimit();
	}

	/**
	 * Apply the connection overrides to the given properties.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public CollectorProperties applyTo(CollectorProperties properties) {
		if (token != null) {
			properties.setToken(token);
		}
		if (userAgent != null) {
			properties.setUserAgent(userAgent);
		}
		return properties;
	}

	/**
	 * Convert to a sync request. Only valid after successful validation.
	 */
	public SyncRequest toSyncRequest() {
		if (user == null) {
			throw new IllegalStateException("User is required");
		}
		return new SyncRequest(user, limit, dateMin, new FieldProjection(fields),
				sinceFile != null ? Path.of(sinceFile) : null, append);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "user='" + user + '\'' + ", limit=" + limit + ", dateMin='" + dateMin + '\''
				+ ", token=" + (token != null ? "***" : "null") + ", userAgent='" + userAgent + '\'' + ", fields="
				+ fields + ", sinceFile='" + sinceFile + '\'' + ", append=" + append + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
