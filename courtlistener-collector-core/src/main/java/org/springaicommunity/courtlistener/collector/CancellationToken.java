package org.springaicommunity.courtlistener.collector;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by {@link ResilientRequestExecutor} before each
 * attempt and before each backoff sleep.
 */
public final class CancellationToken {

	private static final CancellationToken NONE = new CancellationToken();

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	/**
	 * Returns a shared token that is never cancelled.
	 */
	public static CancellationToken none() {
		return NONE;
	}

	/**
	 * Create a fresh, uncancelled token.
	 */
	public static CancellationToken create() {
		return new CancellationToken();
	}

	public void cancel() {
		if (this == NONE) {
			throw new IllegalStateException("The shared 'none' token cannot be cancelled");
		}
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

}
