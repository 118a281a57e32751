package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a request fails in a way that retrying cannot fix: a non-retryable HTTP
 * status, an undecodable success body, or an unexpected fault.
 *
 * <p>
 * Never retried by {@link ResilientRequestExecutor}.
 */
public class FatalRequestException extends CourtListenerException {

	private final int statusCode;

	@Nullable
	private final String responseExcerpt;

	public FatalRequestException(String message, int statusCode, @Nullable String responseExcerpt) {
		super(message);
		this.statusCode = statusCode;
		this.responseExcerpt = responseExcerpt;
	}

	public FatalRequestException(String message, int statusCode, @Nullable String responseExcerpt,
			@Nullable Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.responseExcerpt = responseExcerpt;
	}

	/**
	 * Returns the HTTP status of the failing response, or -1 when the failure was not an
	 * HTTP status.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * Returns the first characters of the response body, kept for diagnostics.
	 */
	@Nullable
	public String getResponseExcerpt() {
		return responseExcerpt;
	}

}
