package org.springaicommunity.courtlistener.collector;

/**
 * Thrown when a request is aborted through its {@link CancellationToken} or by thread
 * interruption. Distinct from {@link ExhaustedRetriesException}.
 */
public class RequestCancelledException extends CourtListenerException {

	private final int attempt;

	public RequestCancelledException(String message, int attempt) {
		super(message);
		this.attempt = attempt;
	}

	public RequestCancelledException(String message, int attempt, Throwable cause) {
		super(message, cause);
		this.attempt = attempt;
	}

	/**
	 * The attempt number that was about to run, or was running, when cancellation was
	 * observed.
	 */
	public int getAttempt() {
		return attempt;
	}

}
