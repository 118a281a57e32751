package org.springaicommunity.courtlistener.collector;

/**
 * Failure writing or reading local output: record files, the user index or the watermark
 * file.
 */
public class PersistenceException extends CourtListenerException {

	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}

}
