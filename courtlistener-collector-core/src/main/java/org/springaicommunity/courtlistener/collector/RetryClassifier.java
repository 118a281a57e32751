package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps the outcome of one HTTP exchange to an {@link AttemptOutcome}.
 *
 * <p>
 * Classification rules:
 * <ul>
 * <li>2xx with a body that decodes to {@code {"results": [...], "next": ...}} is a
 * {@link AttemptOutcome.Success}</li>
 * <li>429, 500, 502, 503, 504, connection faults and timeouts are
 * {@link AttemptOutcome.RetryableFailure}s</li>
 * <li>everything else, including an undecodable 2xx body, is a
 * {@link AttemptOutcome.FatalFailure}</li>
 * </ul>
 *
 * <p>
 * Holds no mutable state; the same instance can classify any number of exchanges.
 */
public class RetryClassifier {

	/**
	 * Statuses that indicate temporary unavailability.
	 */
	public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

	static final int EXCERPT_LENGTH = 1000;

	private final ObjectMapper objectMapper;

	public RetryClassifier(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Classify a completed HTTP exchange.
	 * @param response status and body returned by the server
	 * @return the outcome
	 */
	public AttemptOutcome classify(TransportResponse response) {
		int status = response.statusCode();
		if (RETRYABLE_STATUSES.contains(status)) {
			return new AttemptOutcome.RetryableFailure("HTTP " + status, status, null);
		}
		if (!response.isSuccessful()) {
			return new AttemptOutcome.FatalFailure(new FatalRequestException(
					"Non-retryable HTTP status " + status, status, excerpt(response.body())));
		}
		try {
			return new AttemptOutcome.Success(decodePage(response));
		}
		catch (MalformedResponseException e) {
			return new AttemptOutcome.FatalFailure(e);
		}
	}

	/**
	 * Classify a fault raised before a response was obtained.
	 * @param fault the exception thrown by the transport
	 * @return the outcome
	 */
	public AttemptOutcome classify(Exception fault) {
		if (fault instanceof HttpTimeoutException) {
			return new AttemptOutcome.RetryableFailure("Timeout: " + fault.getMessage(), -1, fault);
		}
		if (fault instanceof IOException) {
			return new AttemptOutcome.RetryableFailure(
					"Connection failure (" + fault.getClass().getSimpleName() + "): " + fault.getMessage(), -1, fault);
		}
		return new AttemptOutcome.FatalFailure(new FatalRequestException(
				"Request failed: " + fault.getClass().getSimpleName() + ": " + fault.getMessage(), -1, null, fault));
	}

	private PageResult decodePage(TransportResponse response) {
		JsonNode root;
		try {
			root = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw malformed("Response body is not valid JSON", response, e);
		}
		if (root == null || !root.isObject()) {
			throw malformed("Response body is not a JSON object", response, null);
		}

		JsonNode results = root.path("results");
		if (!results.isArray()) {
			throw malformed("Response body has no 'results' array", response, null);
		}
		List<JsonNode> records = new ArrayList<>(results.size());
		for (JsonNode item : results) {
			if (!item.isObject()) {
				throw malformed("Response 'results' contains a non-object element", response, null);
			}
			records.add(item);
		}

		JsonNode next = root.path("next");
		String nextUrl = null;
		if (next.isTextual() && !next.asText().isBlank()) {
			nextUrl = next.asText();
		}
		else if (!next.isMissingNode() && !next.isNull() && !next.isTextual()) {
			throw malformed("Response 'next' is neither a string nor null", response, null);
		}
		return new PageResult(records, nextUrl);
	}

	private static MalformedResponseException malformed(String message, TransportResponse response,
			@Nullable Throwable cause) {
		return new MalformedResponseException(message, response.statusCode(), excerpt(response.body()), cause);
	}

	static String excerpt(@Nullable String body) {
		if (body == null) {
			return "";
		}
		return body.length() <= EXCERPT_LENGTH ? body : body.substring(0, EXCERPT_LENGTH);
	}

}
