package org.springaicommunity.courtlistener.collector;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the CourtListener collector. Pure Java implementation
 * with no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private static final String DATE_PATTERN = "\\d{4}-\\d{2}-\\d{2}";

	private static final String USER_PATTERN = "^[a-zA-Z0-9._-]+$";

	private final CollectorProperties defaultProperties;

	public ArgumentParser(CollectorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-u", "--user":
					config.user = getRequiredValue(args, i, "user");
					i++; // Skip next argument since we consumed it
					break;

				case "--limit":
					String limitStr = getRequiredValue(args, i, "limit");
					try {
						config.limit = Integer.parseInt(limitStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid limit '" + limitStr + "': must be a positive integer");
					}
					i++;
					break;

				case "--date-min", "--date_min":
					config.dateMin = getRequiredValue(args, i, "date-min");
					i++;
					break;

				case "--token":
					config.token = getRequiredValue(args, i, "token");
					i++;
					break;

				case "--ua":
					config.userAgent = getRequiredValue(args, i, "ua");
					i++;
					break;

				case "--fields":
					config.fields = new ArrayList<>(FieldProjection.parse(getRequiredValue(args, i, "fields")).fields());
					i++;
					break;

				case "--since-file":
					config.sinceFile = getRequiredValue(args, i, "since-file");
					i++;
					break;

				case "--append":
					config.append = true;
					break;

				case "--clean":
					config.append = false;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: courtlistener-collector --user NAME [OPTIONS]\n");
		help.append("\n");
		help.append("Fetch opinions from the CourtListener REST API and save them as JSON Lines.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -u, --user NAME         Output namespace; records go to ")
			.append(defaultProperties.getDataDir())
			.append("/NAME_opinions.jsonl (required)\n");
		help.append("    --limit N               Maximum number of records to fetch (default: ")
			.append(defaultProperties.getDefaultLimit())
			.append(")\n");
		help.append("    --date-min DATE         Only fetch records with ")
			.append(defaultProperties.getCursorField())
			.append(" on or after DATE (YYYY-MM-DD)\n");
		help.append("    --token TOKEN           API token (overrides ")
			.append(CollectorProperties.ENV_TOKEN)
			.append(")\n");
		help.append("    --ua STRING             User-Agent header (overrides ")
			.append(CollectorProperties.ENV_USER_AGENT)
			.append(")\n");
		help.append("    --fields a,b,c          Keep only these fields in saved records\n");
		help.append("    --since-file PATH       Read the lower bound from PATH when --date-min is absent,\n");
		help.append("                            and write the newest ")
			.append(defaultProperties.getCursorField())
			.append(" back after the run\n");
		help.append("    --clean                 Replace the output file (default)\n");
		help.append("    --append                Append to the output file\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ").append(CollectorProperties.ENV_TOKEN).append("     API token (optional)\n");
		help.append("    ").append(CollectorProperties.ENV_USER_AGENT).append("        User-Agent with name/email\n");
		help.append("    ")
			.append(CollectorProperties.ENV_MAX_RETRIES)
			.append("  Attempts per request (default: ")
			.append(defaultProperties.getMaxAttempts())
			.append(")\n");
		help.append("    ")
			.append(CollectorProperties.ENV_TIMEOUT)
			.append("      Request timeout in seconds (default: ")
			.append(formatNumber(defaultProperties.getRequestTimeoutSeconds()))
			.append(")\n");
		help.append("    ")
			.append(CollectorProperties.ENV_BACKOFF_FACTOR)
			.append(" Backoff base in seconds (default: ")
			.append(formatNumber(defaultProperties.getBackoffFactor()))
			.append(")\n");
		help.append("    ").append(CollectorProperties.ENV_BASE_URL).append("     API root URL\n");
		help.append("    Values are also read from a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Ten most recent opinions\n");
		help.append("    courtlistener-collector --user alice\n");
		help.append("\n");
		help.append("    # Opinions filed since a date, selected fields only\n");
		help.append("    courtlistener-collector -u alice --limit 50 --date-min 2024-01-01 --fields id,date_filed\n");
		help.append("\n");
		help.append("    # Incremental runs\n");
		help.append("    courtlistener-collector -u alice --since-file data/alice.since --append\n");
		help.append("\n");

		return help.toString();
	}

	private static String formatNumber(double value) {
		return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.user == null || config.user.trim().isEmpty()) {
			errors.add("User is required (--user NAME)");
		}
		else if (!config.user.matches(USER_PATTERN)) {
			errors.add("User may only contain letters, digits, '.', '_' and '-' (got: " + config.user + ")");
		}

		if (config.limit <= 0) {
			errors.add("Limit must be positive (got: " + config.limit + ")");
		}

		if (config.dateMin != null && !config.dateMin.matches(DATE_PATTERN)) {
			errors.add("Invalid date '" + config.dateMin + "': must be YYYY-MM-DD format");
		}

		if (config.token != null && config.token.isBlank()) {
			errors.add("Token must not be blank");
		}

		if (config.userAgent != null && config.userAgent.isBlank()) {
			errors.add("User-Agent must not be blank");
		}

		if (config.sinceFile != null && config.sinceFile.isBlank()) {
			errors.add("Since-file path must not be blank");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
