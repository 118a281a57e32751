package org.springaicommunity.courtlistener.collector;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Source of the {@code COURTLISTENER_*} settings read by
 * {@link CollectorProperties#fromEnvironment()}.
 *
 * <p>
 * A variable is looked up in the working directory's {@code .env}, then in the process
 * environment, then in {@code ~/.env}. Blank values count as unset, so an empty
 * {@code COURTLISTENER_TOKEN=} line does not hide a token defined further down the
 * chain. Both files are optional and loaded once per process.
 */
public final class EnvironmentSupport {

	/**
	 * Every variable {@link CollectorProperties#fromEnvironment()} understands.
	 */
	public static final List<String> COURTLISTENER_KEYS = List.of(CollectorProperties.ENV_MAX_RETRIES,
			CollectorProperties.ENV_TIMEOUT, CollectorProperties.ENV_BACKOFF_FACTOR, CollectorProperties.ENV_USER_AGENT,
			CollectorProperties.ENV_TOKEN, CollectorProperties.ENV_BASE_URL);

	private static final Dotenv WORKING_DIR = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	@Nullable
	private static final Dotenv HOME = loadFrom(System.getProperty("user.home"));

	private EnvironmentSupport() {
	}

	/**
	 * Load the {@code .env} file of a directory without falling back to anything.
	 * @param directory the directory, or null
	 * @return the parsed file, or null when no directory was given
	 */
	@Nullable
	static Dotenv loadFrom(@Nullable String directory) {
		if (directory == null) {
			return null;
		}
		return Dotenv.configure().directory(directory).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Get a variable. Blank values count as unset.
	 * @param name the variable name
	 * @return the trimmed value, or {@code null} if not set anywhere
	 */
	@Nullable
	public static String get(String name) {
		return resolve(name, WORKING_DIR, HOME);
	}

	/**
	 * Names of the {@link #COURTLISTENER_KEYS} that currently have a value, for
	 * diagnostics. Values are not returned because one of them is the API token.
	 */
	public static List<String> configuredKeys() {
		return COURTLISTENER_KEYS.stream().filter(key -> get(key) != null).collect(Collectors.toList());
	}

	/**
	 * {@link Dotenv#get(String)} already consults the process environment after the file
	 * it was loaded from, so {@code primary} covers the first two steps of the lookup.
	 */
	@Nullable
	static String resolve(String name, Dotenv primary, @Nullable Dotenv fallback) {
		String value = trimToNull(primary.get(name));
		if (value == null && fallback != null) {
			value = trimToNull(fallback.get(name));
		}
		return value;
	}

	@Nullable
	private static String trimToNull(@Nullable String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}

}
