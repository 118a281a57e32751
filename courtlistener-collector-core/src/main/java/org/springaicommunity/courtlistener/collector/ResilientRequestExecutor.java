package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Issues one logical GET and retries transient failures with exponential backoff.
 *
 * <p>
 * Each call to {@link #execute(String, Map)} starts a fresh retry session: attempt 1, then
 * up to {@code maxAttempts} attempts in total. Outcomes are classified by
 * {@link RetryClassifier}:
 * <ul>
 * <li>success returns immediately</li>
 * <li>fatal failures are thrown as {@link FatalRequestException} without sleeping</li>
 * <li>retryable failures sleep {@link BackoffPolicy#delay(int)} and try again, or throw
 * {@link ExhaustedRetriesException} once the budget is spent</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * ResilientRequestExecutor executor = ResilientRequestExecutor.builder()
 *     .transport(new JdkHttpTransport(properties))
 *     .classifier(new RetryClassifier(objectMapper))
 *     .maxAttempts(6)
 *     .backoffPolicy(new BackoffPolicy(1.5))
 *     .build();
 *
 * PageResult page = executor.execute("https://host/api/opinions/", Map.of("date_filed_min", "2024-01-01"));
 * }
 * </pre>
 */
public final class ResilientRequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(ResilientRequestExecutor.class);

	private final HttpTransport transport;

	private final RetryClassifier classifier;

	private final BackoffPolicy backoffPolicy;

	private final int maxAttempts;

	private final Sleeper sleeper;

	private final CancellationToken cancellationToken;

	private ResilientRequestExecutor(Builder builder) {
		this.transport = Objects.requireNonNull(builder.transport);
		this.classifier = Objects.requireNonNull(builder.classifier);
		this.backoffPolicy = builder.backoffPolicy;
		this.maxAttempts = builder.maxAttempts;
		this.sleeper = builder.sleeper;
		this.cancellationToken = builder.cancellationToken;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Fetch one page without query parameters.
	 * @param url absolute URL
	 * @return the decoded page
	 */
	public PageResult execute(String url) {
		return execute(url, Map.of());
	}

	/**
	 * Fetch one page, retrying transient failures.
	 * @param url absolute URL, possibly already carrying a query string
	 * @param params query parameters to append, empty for none
	 * @return the decoded page
	 * @throws FatalRequestException on a non-retryable failure, including a URL that is
	 * not a valid URI
	 * @throws ExhaustedRetriesException when every attempt failed transiently
	 * @throws RequestCancelledException when cancelled or interrupted
	 */
	public PageResult execute(String url, Map<String, ?> params) {
		URI uri;
		try {
			uri = buildUri(url, params);
		}
		catch (IllegalArgumentException e) {
			logger.error("Refusing to GET invalid URL '{}': {}", url, e.getMessage());
			throw new FatalRequestException("Invalid request URL '" + url + "': " + e.getMessage(), -1, null, e);
		}

		for (int attempt = 1;; attempt++) {
			checkCancelled(uri, attempt, "before attempt");
			logger.debug("GET {} (attempt {}/{})", uri, attempt, maxAttempts);

			AttemptOutcome outcome = attempt(uri, attempt);

			if (outcome instanceof AttemptOutcome.Success success) {
				if (attempt > 1) {
					logger.info("GET {} succeeded on attempt {}/{}", uri, attempt, maxAttempts);
				}
				return success.page();
			}
			if (outcome instanceof AttemptOutcome.FatalFailure fatal) {
				logger.error("GET {} failed on attempt {}/{} with a non-retryable error: {}", uri, attempt,
						maxAttempts, fatal.error().getMessage());
				throw fatal.error();
			}

			AttemptOutcome.RetryableFailure lastFailure = (AttemptOutcome.RetryableFailure) outcome;
			if (attempt >= maxAttempts) {
				logger.error("GET {} failed after {} attempts; last failure: {}", uri, attempt, lastFailure.reason());
				throw new ExhaustedRetriesException(uri.toString(), attempt, lastFailure.reason(),
						lastFailure.fault());
			}

			Duration delay = backoffPolicy.delay(attempt);
			logger.warn("GET {} failed (attempt {}/{}): {}. Waiting {}ms...", uri, attempt, maxAttempts,
					lastFailure.reason(), delay.toMillis());
			checkCancelled(uri, attempt, "before backoff sleep");
			sleep(delay, attempt);
		}
	}

	private AttemptOutcome attempt(URI uri, int attempt) {
		long start = System.currentTimeMillis();
		try {
			TransportResponse response = transport.get(uri);
			logger.debug("GET {} returned HTTP {} in {}ms ({} chars)", uri, response.statusCode(),
					System.currentTimeMillis() - start, response.body().length());
			return classifier.classify(response);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestCancelledException("Interrupted during GET " + uri, attempt, e);
		}
		catch (Exception e) {
			logger.debug("GET {} raised {} after {}ms", uri, e.getClass().getSimpleName(),
					System.currentTimeMillis() - start);
			return classifier.classify(e);
		}
	}

	private void sleep(Duration delay, int attempt) {
		try {
			sleeper.sleep(delay);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestCancelledException("Retry interrupted", attempt, e);
		}
	}

	private void checkCancelled(URI uri, int attempt, String phase) {
		if (cancellationToken.isCancelled()) {
			logger.info("GET {} cancelled {} {}", uri, phase, attempt);
			throw new RequestCancelledException("GET " + uri + " cancelled " + phase + " " + attempt, attempt);
		}
	}

	static URI buildUri(String url, Map<String, ?> params) {
		if (params.isEmpty()) {
			return URI.create(url);
		}
		StringJoiner query = new StringJoiner("&");
		params.forEach((key, value) -> {
			if (value != null) {
				query.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
						+ URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8));
			}
		});
		if (query.length() == 0) {
			return URI.create(url);
		}
		String separator = url.contains("?") ? "&" : "?";
		return URI.create(url + separator + query);
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public BackoffPolicy getBackoffPolicy() {
		return backoffPolicy;
	}

	/**
	 * Builder for {@link ResilientRequestExecutor}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxAttempts: 6</li>
	 * <li>backoffPolicy: 1.5s base factor</li>
	 * <li>sleeper: {@link Sleeper#THREAD}</li>
	 * <li>cancellationToken: {@link CancellationToken#none()}</li>
	 * </ul>
	 */
	public static class Builder {

		@Nullable
		private HttpTransport transport;

		@Nullable
		private RetryClassifier classifier;

		private BackoffPolicy backoffPolicy = BackoffPolicy.defaultPolicy();

		private int maxAttempts = 6;

		private Sleeper sleeper = Sleeper.THREAD;

		private CancellationToken cancellationToken = CancellationToken.none();

		private Builder() {
		}

		/**
		 * Set the transport that performs the GET requests (required).
		 */
		public Builder transport(HttpTransport transport) {
			this.transport = transport;
			return this;
		}

		/**
		 * Set the classifier that decodes and classifies responses (required).
		 */
		public Builder classifier(RetryClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
			this.backoffPolicy = backoffPolicy;
			return this;
		}

		/**
		 * Set the total number of attempts per request, first attempt included.
		 * @param maxAttempts attempts (default: 6)
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder cancellationToken(CancellationToken cancellationToken) {
			this.cancellationToken = cancellationToken;
			return this;
		}

		/**
		 * Build the executor.
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public ResilientRequestExecutor build() {
			if (transport == null) {
				throw new IllegalStateException("An HttpTransport is required. Call transport() first.");
			}
			if (classifier == null) {
				throw new IllegalStateException("A RetryClassifier is required. Call classifier() first.");
			}
			if (backoffPolicy == null || sleeper == null || cancellationToken == null) {
				throw new IllegalStateException("backoffPolicy, sleeper and cancellationToken must not be null");
			}
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			return new ResilientRequestExecutor(this);
		}

	}

}
