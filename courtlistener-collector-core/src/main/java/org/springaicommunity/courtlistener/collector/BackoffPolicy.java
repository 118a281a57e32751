package org.springaicommunity.courtlistener.collector;

import java.time.Duration;

/**
 * Exponential backoff without jitter.
 *
 * <p>
 * {@code delay(attempt) = baseFactor * 2^(attempt - 1)} seconds, so the default factor of
 * 1.5 gives 1.5s, 3s, 6s, 12s, ... Deterministic and strictly increasing.
 */
public final class BackoffPolicy {

	/**
	 * Default base factor in seconds.
	 */
	public static final double DEFAULT_BASE_FACTOR = 1.5;

	// 2^62 still fits a long; beyond that the delay is meaningless anyway
	private static final int MAX_EXPONENT = 62;

	private final double baseFactorSeconds;

	public BackoffPolicy(double baseFactorSeconds) {
		if (!(baseFactorSeconds > 0) || Double.isInfinite(baseFactorSeconds)) {
			throw new IllegalArgumentException("Backoff base factor must be positive (got: " + baseFactorSeconds + ")");
		}
		this.baseFactorSeconds = baseFactorSeconds;
	}

	public static BackoffPolicy defaultPolicy() {
		return new BackoffPolicy(DEFAULT_BASE_FACTOR);
	}

	/**
	 * Delay to wait after the given failed attempt.
	 * @param attempt one-based attempt number
	 * @return the wait duration
	 */
	public Duration delay(int attempt) {
		if (attempt < 1) {
			throw new IllegalArgumentException("Attempt must be >= 1 (got: " + attempt + ")");
		}
		double seconds = baseFactorSeconds * Math.pow(2, Math.min(attempt - 1, MAX_EXPONENT));
		long nanos = (long) Math.min(seconds * 1_000_000_000d, (double) Long.MAX_VALUE);
		return Duration.ofNanos(nanos);
	}

	public double getBaseFactorSeconds() {
		return baseFactorSeconds;
	}

	@Override
	public String toString() {
		return "BackoffPolicy{baseFactorSeconds=" + baseFactorSeconds + '}';
	}

}
