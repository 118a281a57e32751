package org.springaicommunity.courtlistener.collector;

import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * Configuration properties for CourtListener collection.
 *
 * <p>
 * Every component receives its settings from an instance of this class; nothing reads the
 * process environment on its own. {@link #fromEnvironment()} applies the
 * {@code COURTLISTENER_*} variables on top of the defaults, which is how the command-line
 * front ends build their configuration.
 *
 * <p>
 * Default values are provided for all properties and match the public CourtListener API.
 */
public class CollectorProperties {

	public static final String ENV_MAX_RETRIES = "COURTLISTENER_MAX_RETRIES";

	public static final String ENV_TIMEOUT = "COURTLISTENER_TIMEOUT";

	public static final String ENV_BACKOFF_FACTOR = "COURTLISTENER_BACKOFF_FACTOR";

	public static final String ENV_USER_AGENT = "COURTLISTENER_UA";

	public static final String ENV_TOKEN = "COURTLISTENER_TOKEN";

	public static final String ENV_BASE_URL = "COURTLISTENER_BASE_URL";

	public static final String DEFAULT_USER_AGENT = "CourtListenerDemo/1.0 (set COURTLISTENER_UA with name/email)";

	/**
	 * REST API root that endpoints are resolved against.
	 */
	private String baseUrl = "https://www.courtlistener.com/api/rest/v3";

	/**
	 * Endpoint listing the records to collect.
	 */
	private String endpoint = "/opinions/";

	/**
	 * Total attempts per request, first attempt included.
	 */
	private int maxAttempts = 6;

	/**
	 * Per-request timeout in seconds.
	 */
	private double requestTimeoutSeconds = 60;

	/**
	 * Backoff base factor in seconds: the delay after attempt n is factor * 2^(n-1).
	 */
	private double backoffFactor = BackoffPolicy.DEFAULT_BASE_FACTOR;

	private String userAgent = DEFAULT_USER_AGENT;

	/**
	 * API token sent as {@code Authorization: Token <token>}; no header when unset.
	 */
	@Nullable
	private String token;

	/**
	 * Record field used for the incremental watermark.
	 */
	private String cursorField = "date_filed";

	/**
	 * Query parameter that receives the watermark as lower bound.
	 */
	private String cursorFilterParameter = "date_filed_min";

	/**
	 * Number of leading characters of the cursor value that are compared.
	 */
	private int watermarkPrefixLength = WatermarkTracker.DEFAULT_PREFIX_LENGTH;

	/**
	 * Directory holding record files and the user index.
	 */
	private String dataDir = "data";

	private String indexFileName = "users.json";

	/**
	 * Records fetched per run when no limit is given.
	 */
	private int defaultLimit = 10;

	/**
	 * Create properties with defaults overridden by the {@code COURTLISTENER_*}
	 * environment variables (including {@code .env} files).
	 */
	public static CollectorProperties fromEnvironment() {
		return fromEnvironment(EnvironmentSupport::get);
	}

	/**
	 * Create properties with defaults overridden by values from the given lookup.
	 * @param lookup returns the value of a variable, or null when unset
	 * @throws IllegalArgumentException if a numeric variable cannot be parsed
	 */
	public static CollectorProperties fromEnvironment(Function<String, @Nullable String> lookup) {
		CollectorProperties properties = new CollectorProperties();

		String maxRetries = lookup.apply(ENV_MAX_RETRIES);
		if (maxRetries != null) {
			properties.setMaxAttempts(parseInt(ENV_MAX_RETRIES, maxRetries));
		}
		String timeout = lookup.apply(ENV_TIMEOUT);
		if (timeout != null) {
			properties.setRequestTimeoutSeconds(parseDouble(ENV_TIMEOUT, timeout));
		}
		String backoff = lookup.apply(ENV_BACKOFF_FACTOR);
		if (backoff != null) {
			properties.setBackoffFactor(parseDouble(ENV_BACKOFF_FACTOR, backoff));
		}
		String userAgent = lookup.apply(ENV_USER_AGENT);
		if (userAgent != null && !userAgent.isBlank()) {
			properties.setUserAgent(userAgent.trim());
		}
		String token = lookup.apply(ENV_TOKEN);
		if (token != null && !token.isBlank()) {
			properties.setToken(token.trim());
		}
		String baseUrl = lookup.apply(ENV_BASE_URL);
		if (baseUrl != null && !baseUrl.isBlank()) {
			properties.setBaseUrl(baseUrl.trim());
		}
		return properties;
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + key + " '" + value + "': must be an integer", e);
		}
	}

	private static double parseDouble(String key, String value) {
		try {
			return Double.parseDouble(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + key + " '" + value + "': must be a number", e);
		}
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	public void setBaseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
	}

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	/**
	 * Returns the total number of attempts per request.
	 * @return the maximum attempts
	 */
	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	/**
	 * Returns the per-request timeout in seconds.
	 * @return the timeout in seconds
	 */
	public double getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(double requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public double getBackoffFactor() {
		return backoffFactor;
	}

	public void setBackoffFactor(double backoffFactor) {
		this.backoffFactor = backoffFactor;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	@Nullable
	public String getToken() {
		return token;
	}

	public void setToken(@Nullable String token) {
		this.token = token;
	}

	public String getCursorField() {
		return cursorField;
	}

	public void setCursorField(String cursorField) {
		this.cursorField = cursorField;
	}

	public String getCursorFilterParameter() {
		return cursorFilterParameter;
	}

	public void setCursorFilterParameter(String cursorFilterParameter) {
		this.cursorFilterParameter = cursorFilterParameter;
	}

	public int getWatermarkPrefixLength() {
		return watermarkPrefixLength;
	}

	public void setWatermarkPrefixLength(int watermarkPrefixLength) {
		this.watermarkPrefixLength = watermarkPrefixLength;
	}

	public String getDataDir() {
		return dataDir;
	}

	public void setDataDir(String dataDir) {
		this.dataDir = dataDir;
	}

	public String getIndexFileName() {
		return indexFileName;
	}

	public void setIndexFileName(String indexFileName) {
		this.indexFileName = indexFileName;
	}

	public int getDefaultLimit() {
		return defaultLimit;
	}

	public void setDefaultLimit(int defaultLimit) {
		this.defaultLimit = defaultLimit;
	}

	@Override
	public String toString() {
		return "CollectorProperties{" + "baseUrl='" + baseUrl + '\'' + ", endpoint='" + endpoint + '\''
				+ ", maxAttempts=" + maxAttempts + ", requestTimeoutSeconds=" + requestTimeoutSeconds
				+ ", backoffFactor=" + backoffFactor + ", userAgent='" + userAgent + '\'' + ", token="
				+ (token != null ? "(set)" : "(not set)") + ", cursorField='" + cursorField + '\''
				+ ", cursorFilterParameter='" + cursorFilterParameter + '\'' + ", dataDir='" + dataDir + '\'' + '}';
	}

}
