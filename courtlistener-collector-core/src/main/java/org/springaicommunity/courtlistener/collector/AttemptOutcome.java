package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

/**
 * Result of classifying one HTTP attempt.
 *
 * <p>
 * A closed set of three cases so that retry decisions stay out of exception handling:
 * {@link Success}, {@link RetryableFailure} and {@link FatalFailure}.
 */
public sealed interface AttemptOutcome
		permits AttemptOutcome.Success, AttemptOutcome.RetryableFailure, AttemptOutcome.FatalFailure {

	/**
	 * The attempt produced a decodable page.
	 */
	record Success(PageResult page) implements AttemptOutcome {
	}

	/**
	 * Transient failure: connection fault, timeout or a 429/5xx status worth retrying.
	 *
	 * @param reason what went wrong, suitable for logs
	 * @param statusCode HTTP status, or -1 for network-level faults
	 * @param fault the underlying exception, if any
	 */
	record RetryableFailure(String reason, int statusCode, @Nullable Throwable fault) implements AttemptOutcome {
	}

	/**
	 * Failure that retrying cannot fix.
	 *
	 * @param error the exception to surface to the caller
	 */
	record FatalFailure(FatalRequestException error) implements AttemptOutcome {
	}

}
