package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when every attempt of a request ended in a retryable failure.
 */
public class ExhaustedRetriesException extends CourtListenerException {

	private final int attempts;

	private final String lastFailure;

	public ExhaustedRetriesException(String url, int attempts, String lastFailure, @Nullable Throwable cause) {
		super("Failed after " + attempts + " attempts to GET " + url + " (last failure: " + lastFailure + ")", cause);
		this.attempts = attempts;
		this.lastFailure = lastFailure;
	}

	public int getAttempts() {
		return attempts;
	}

	public String getLastFailure() {
		return lastFailure;
	}

}
