package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Sends the configured {@code User-Agent} on every request, plus
 * {@code Authorization: Token <token>} when a token is configured. The underlying client
 * is created once and shared by every request.
 */
public class JdkHttpTransport implements HttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	private final HttpClient httpClient;

	private final String userAgent;

	@Nullable
	private final String token;

	private final Duration requestTimeout;

	public JdkHttpTransport(CollectorProperties properties) {
		this(properties.getUserAgent(), properties.getToken(), toDuration(properties.getRequestTimeoutSeconds()));
	}

	public JdkHttpTransport(String userAgent, @Nullable String token, Duration requestTimeout) {
		if (requestTimeout.isNegative() || requestTimeout.isZero()) {
			throw new IllegalArgumentException("Request timeout must be positive (got: " + requestTimeout + ")");
		}
		this.userAgent = userAgent;
		this.token = (token == null || token.isBlank()) ? null : token.trim();
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public TransportResponse get(URI uri) throws IOException, InterruptedException {
		HttpRequest request = buildRequest(uri);
		long start = System.currentTimeMillis();

		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

		logger.debug("GET {} -> HTTP {} in {}ms", uri, response.statusCode(), System.currentTimeMillis() - start);
		return new TransportResponse(response.statusCode(), response.body() != null ? response.body() : "");
	}

	HttpRequest buildRequest(URI uri) {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(requestTimeout)
			.header("User-Agent", userAgent)
			.header("Accept", "application/json")
			.GET();
		if (token != null) {
			builder.header("Authorization", "Token " + token);
		}
		return builder.build();
	}

	public boolean hasToken() {
		return token != null;
	}

	private static Duration toDuration(double seconds) {
		if (!(seconds > 0)) {
			throw new IllegalArgumentException("Request timeout must be positive (got: " + seconds + ")");
		}
		return Duration.ofMillis(Math.round(seconds * 1000));
	}

}
