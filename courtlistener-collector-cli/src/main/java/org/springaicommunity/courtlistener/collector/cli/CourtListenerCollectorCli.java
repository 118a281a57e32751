package org.springaicommunity.courtlistener.collector.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.courtlistener.collector.*;

import java.util.List;

/**
 * CourtListener Collector CLI Application
 *
 * Plain Java command-line application that fetches opinions from the CourtListener REST
 * API and saves them as JSON Lines. No Spring dependencies; uses
 * CourtListenerCollectorBuilder for service wiring.
 *
 * Usage: java -jar courtlistener-collector-cli.jar --user NAME [OPTIONS]
 *
 * Environment Variables: COURTLISTENER_TOKEN, COURTLISTENER_UA,
 * COURTLISTENER_MAX_RETRIES, COURTLISTENER_TIMEOUT, COURTLISTENER_BACKOFF_FACTOR
 *
 * Examples: java -jar courtlistener-collector-cli.jar --user alice java -jar
 * courtlistener-collector-cli.jar -u alice --limit 50 --date-min 2024-01-01 java -jar
 * courtlistener-collector-cli.jar -u alice --since-file data/alice.since --append
 */
public class CourtListenerCollectorCli {

	private static final Logger logger = LoggerFactory.getLogger(CourtListenerCollectorCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage());
			System.exit(EXIT_FAILURE);
		}
	}

	public static int run(String[] args) {
		return run(args, CollectorProperties.fromEnvironment());
	}

	/**
	 * Run the collector with the given base properties; command-line overrides are
	 * applied on top.
	 * @return process exit code
	 */
	public static int run(String[] args, CollectorProperties properties) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}
		config.applyTo(properties);
		logConfiguration(config, properties);

		IncrementalSyncService syncService = CourtListenerCollectorBuilder.create()
			.properties(properties)
			.buildSyncService();

		SyncResult result;
		try {
			result = syncService.sync(config.toSyncRequest());
		}
		catch (CourtListenerException e) {
			if (config.verbose) {
				logger.error("Collection failed", e);
			}
			else {
				logger.error("Collection failed: {}", e.getMessage());
			}
			return EXIT_FAILURE;
		}

		logResults(result, config.verbose);
		return EXIT_OK;
	}

	private static void enableVerboseLogging() {
		org.slf4j.Logger root = LoggerFactory.getLogger("org.springaicommunity.courtlistener");
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	static void logConfiguration(ParsedConfiguration config, CollectorProperties properties) {
		logger.info("Configuration:");
		logger.info("  User: {}", config.user);
		logger.info("  Limit: {}", config.limit);
		logger.info("  Date min: {}", config.dateMin != null ? config.dateMin : "(none)");
		logger.info("  Since file: {}", config.sinceFile != null ? config.sinceFile : "(none)");
		logger.info("  Fields: {}", config.fields.isEmpty() ? "(all)" : String.join(",", config.fields));
		logger.info("  Mode: {}", config.append ? "append" : "clean");
		if (config.verbose) {
			logger.info("  Endpoint: {}{}", properties.getBaseUrl(), properties.getEndpoint());
			logger.info("  Max attempts: {}", properties.getMaxAttempts());
			logger.info("  Timeout: {}s", properties.getRequestTimeoutSeconds());
			logger.info("  Backoff factor: {}", properties.getBackoffFactor());
			logger.info("  User-Agent: {}", properties.getUserAgent());
			logger.info("  Token: {}", properties.getToken() != null ? "set" : "not set");
			List<String> fromEnvironment = EnvironmentSupport.configuredKeys();
			logger.info("  Set in environment: {}",
					fromEnvironment.isEmpty() ? "(none)" : String.join(", ", fromEnvironment));
		}
	}

	static void logResults(SyncResult result, boolean verbose) {
		if (result.isPartial()) {
			logger.warn("Collection finished early: {}", result.fetchError().getMessage());
		}
		else {
			logger.info("Collection completed successfully!");
		}
		logger.info("Records saved: {}", result.recordCount());
		logger.info("Output file: {}", result.outputFile());
		logger.info("User index: {}", result.indexFile());
		if (result.watermarkWritten() != null) {
			logger.info("Watermark: {}", result.watermarkWritten());
		}
		if (result.watermarkError() != null) {
			logger.warn("Watermark not saved: {}", result.watermarkError().getMessage());
		}
		if (verbose) {
			logger.info("Pages fetched: {}", result.pagesFetched());
		}

		if (result.records().isEmpty()) {
			logger.info("No records returned");
			return;
		}
		JsonNode first = result.records().get(0);
		logger.info("First record:");
		logger.info("  id: {}", text(first, "id"));
		logger.info("  absolute_url: {}", text(first, "absolute_url"));
		logger.info("  date_filed: {}", text(first, "date_filed"));
		JsonNode plainText = first.get("plain_text");
		if (plainText != null && plainText.isTextual()) {
			logger.info("  plain_text length: {}", plainText.asText().length());
		}
		else {
			logger.info("  plain_text: (not included)");
		}
	}

	private static String text(JsonNode record, String field) {
		JsonNode value = record.get(field);
		return value == null || value.isNull() ? "(none)" : value.asText();
	}

}
