package org.springaicommunity.courtlistener.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only. NO Spring context and no network.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private CollectorProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new CollectorProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should parse user with defaults for everything else")
		void shouldParseUserWithDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--user", "alice" });

			assertThat(config.user).isEqualTo("alice");
			assertThat(config.limit).isEqualTo(10);
			assertThat(config.dateMin).isNull();
			assertThat(config.fields).isEmpty();
			assertThat(config.sinceFile).isNull();
			assertThat(config.append).isFalse();
			assertThat(config.verbose).isFalse();
		}

		@Test
		@DisplayName("Should parse all options")
		void shouldParseAllOptions() {
			String[] args = { "-u", "alice", "--limit", "25", "--date-min", "2024-01-01", "--token", "secret", "--ua",
					"Research Bot (me@example.com)", "--fields", "id, date_filed", "--since-file", "state/since.txt",
					"--append", "-v" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.limit).isEqualTo(25);
			assertThat(config.dateMin).isEqualTo("2024-01-01");
			assertThat(config.token).isEqualTo("secret");
			assertThat(config.userAgent).isEqualTo("Research Bot (me@example.com)");
			assertThat(config.fields).containsExactly("id", "date_filed");
			assertThat(config.sinceFile).isEqualTo("state/since.txt");
			assertThat(config.append).isTrue();
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should accept the underscore spelling of date-min")
		void shouldAcceptUnderscoreDateMin() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "-u", "alice", "--date_min", "2023-12-31" });

			assertThat(config.dateMin).isEqualTo("2023-12-31");
		}

		@Test
		@DisplayName("Last of --append and --clean wins")
		void lastModeWins() {
			assertThat(argumentParser.parseAndValidate(new String[] { "-u", "a", "--append", "--clean" }).append)
				.isFalse();
			assertThat(argumentParser.parseAndValidate(new String[] { "-u", "a", "--clean", "--append" }).append)
				.isTrue();
		}

		@Test
		@DisplayName("Default limit follows the properties")
		void defaultLimitFromProperties() {
			defaultProperties.setDefaultLimit(3);

			assertThat(new ArgumentParser(defaultProperties).parseAndValidate(new String[] { "-u", "a" }).limit)
				.isEqualTo(3);
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@Test
		@DisplayName("Should require a user")
		void shouldRequireUser() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--limit", "5" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("User is required");
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-3" })
		@DisplayName("Should reject non-positive limits")
		void shouldRejectNonPositiveLimit(String limit) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "a", "--limit", limit }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Limit must be positive");
		}

		@Test
		@DisplayName("Should reject a non-numeric limit")
		void shouldRejectNonNumericLimit() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "a", "--limit", "ten" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid limit 'ten'");
		}

		@ParameterizedTest
		@ValueSource(strings = { "2024/01/01", "01-01-2024", "yesterday" })
		@DisplayName("Should reject malformed dates")
		void shouldRejectMalformedDate(String date) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "a", "--date-min", date }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("YYYY-MM-DD");
		}

		@Test
		@DisplayName("Should reject users that are unsafe as file names")
		void shouldRejectUnsafeUser() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "../etc" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("User may only contain");
		}

		@Test
		@DisplayName("Should list every validation error")
		void shouldListEveryError() {
			assertThatThrownBy(
					() -> argumentParser.parseAndValidate(new String[] { "--limit", "0", "--date-min", "soon" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("User is required")
				.hasMessageContaining("Limit must be positive")
				.hasMessageContaining("Invalid date 'soon'");
		}

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "a", "--bogus" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown option: --bogus");
		}

		@Test
		@DisplayName("Should reject stray positional arguments")
		void shouldRejectPositional() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "a", "extra" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unexpected argument");
		}

		@Test
		@DisplayName("Should report a missing option value")
		void shouldReportMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "-u", "a", "--since-file" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing value for since-file option");
		}

	}

	@Nested
	@DisplayName("Help and Conversion Tests")
	class HelpTest {

		@Test
		@DisplayName("Help skips validation")
		void helpSkipsValidation() {
			assertThat(argumentParser.isHelpRequested(new String[] { "--limit", "0", "-h" })).isTrue();
			assertThat(argumentParser.parseAndValidate(new String[] { "--help" }).helpRequested).isTrue();
		}

		@Test
		@DisplayName("Help text documents options and environment variables")
		void helpText() {
			String help = argumentParser.generateHelpText();

			assertThat(help).contains("--user", "--limit", "--date-min", "--since-file", "--fields", "--append",
					"COURTLISTENER_TOKEN", "COURTLISTENER_MAX_RETRIES", "(default: 10)");
		}

		@Test
		@DisplayName("Converts to a sync request")
		void toSyncRequest() {
			ParsedConfiguration config = argumentParser.parseAndValidate(
					new String[] { "-u", "alice", "--limit", "4", "--fields", "id", "--since-file", "s.txt" });

			SyncRequest request = config.toSyncRequest();

			assertThat(request.username()).isEqualTo("alice");
			assertThat(request.limit()).isEqualTo(4);
			assertThat(request.projection().fields()).containsExactly("id");
			assertThat(request.sinceFile()).isEqualTo(Path.of("s.txt"));
		}

		@Test
		@DisplayName("Token and User-Agent overrides are applied to properties")
		void appliesOverrides() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "-u", "alice", "--token", "t0k", "--ua", "Bot/2.0" });

			CollectorProperties updated = config.applyTo(new CollectorProperties());

			assertThat(updated.getToken()).isEqualTo("t0k");
			assertThat(updated.getUserAgent()).isEqualTo("Bot/2.0");
			assertThat(config.toString()).doesNotContain("t0k");
		}

	}

}
