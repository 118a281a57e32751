package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

/**
 * A successful HTTP status whose body is not a JSON object carrying a {@code results}
 * array. Treated as a contract mismatch, so it is fatal.
 */
public class MalformedResponseException extends FatalRequestException {

	public MalformedResponseException(String message, int statusCode, @Nullable String responseExcerpt,
			@Nullable Throwable cause) {
		super(message, statusCode, responseExcerpt, cause);
	}

}
