package org.springaicommunity.courtlistener.collector;

/**
 * Base type for all failures raised by the collector.
 */
public class CourtListenerException extends RuntimeException {

	public CourtListenerException(String message) {
		super(message);
	}

	public CourtListenerException(String message, Throwable cause) {
		super(message, cause);
	}

}
