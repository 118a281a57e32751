package org.springaicommunity.courtlistener.collector.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.courtlistener.collector.CollectorProperties;
import org.springaicommunity.courtlistener.collector.ObjectMapperFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link CourtListenerCollectorCli} against a local HTTP server
 * standing in for the CourtListener API. Output goes to a temporary data directory.
 */
@DisplayName("CourtListenerCollectorCli Tests")
class CourtListenerCollectorCliTest {

	private static HttpServer server;

	private static String baseUrl;

	private static final AtomicReference<HttpHandler> handler = new AtomicReference<>();

	private static final List<String> requestedQueries = new CopyOnWriteArrayList<>();

	private static final List<String> authorizationHeaders = new CopyOnWriteArrayList<>();

	@TempDir
	Path tempDir;

	private CollectorProperties properties;

	private final ObjectMapper mapper = ObjectMapperFactory.create();

	@BeforeAll
	static void startServer() throws IOException {
		server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		server.createContext("/api/rest/v3/opinions/", exchange -> {
			String query = exchange.getRequestURI().getRawQuery();
			requestedQueries.add(query == null ? "" : query);
			String auth = exchange.getRequestHeaders().getFirst("Authorization");
			authorizationHeaders.add(auth == null ? "" : auth);
			handler.get().handle(exchange);
		});
		server.start();
		baseUrl = "http://localhost:" + server.getAddress().getPort() + "/api/rest/v3";
	}

	@AfterAll
	static void stopServer() {
		server.stop(0);
	}

	@BeforeEach
	void setUp() {
		requestedQueries.clear();
		authorizationHeaders.clear();
		properties = new CollectorProperties();
		properties.setBaseUrl(baseUrl);
		properties.setDataDir(tempDir.resolve("data").toString());
		properties.setBackoffFactor(0.01);
		properties.setMaxAttempts(3);
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	private static String opinion(int id, String dateFiled) {
		return "{\"id\":" + id + ",\"absolute_url\":\"/opinion/" + id + "/case/\",\"date_filed\":\"" + dateFiled
				+ "\",\"plain_text\":\"Opinion text " + id + "\"}";
	}

	/**
	 * Two pages: ids 1-2 on the first, 3-4 on the second.
	 */
	private static void serveTwoPages() {
		handler.set(exchange -> {
			String query = exchange.getRequestURI().getRawQuery();
			if (query != null && query.contains("cursor=p2")) {
				respond(exchange, 200,
						"{\"results\":[" + opinion(3, "2024-03-03") + "," + opinion(4, "2024-03-01") + "],\"next\":null}");
			}
			else {
				respond(exchange, 200, "{\"results\":[" + opinion(1, "2024-03-05") + "," + opinion(2, "2024-03-02")
						+ "],\"next\":\"" + baseUrl + "/opinions/?cursor=p2\"}");
			}
		});
	}

	private Path outputFile(String user) {
		return tempDir.resolve("data/" + user + "_opinions.jsonl");
	}

	@Nested
	@DisplayName("Successful Runs")
	class SuccessfulRunTest {

		@Test
		@DisplayName("Collects across pages up to the limit and writes output, index and watermark")
		void collectsAndPersists() throws Exception {
			serveTwoPages();
			Path sinceFile = tempDir.resolve("alice.since");

			int exitCode = CourtListenerCollectorCli.run(
					new String[] { "--user", "alice", "--limit", "3", "--since-file", sinceFile.toString() }, properties);

			assertThat(exitCode).isZero();
			List<String> lines = Files.readAllLines(outputFile("alice"));
			assertThat(lines).hasSize(3);
			assertThat(mapper.readTree(lines.get(2)).get("id").asInt()).isEqualTo(3);
			assertThat(Files.readString(sinceFile)).isEqualTo("2024-03-05");

			JsonNode index = mapper.readTree(tempDir.resolve("data/users.json").toFile());
			assertThat(index.path("users").get(0).path("username").asText()).isEqualTo("alice");
			assertThat(index.path("users").get(0).path("saved_files").get(0).asText())
				.isEqualTo(outputFile("alice").toString());
		}

		@Test
		@DisplayName("Second run uses the since-file as lower bound")
		void incrementalRun() throws Exception {
			serveTwoPages();
			Path sinceFile = tempDir.resolve("alice.since");
			Files.writeString(sinceFile, "2024-02-01\n");

			int exitCode = CourtListenerCollectorCli
				.run(new String[] { "-u", "alice", "--limit", "1", "--since-file", sinceFile.toString() }, properties);

			assertThat(exitCode).isZero();
			assertThat(requestedQueries).containsExactly("date_filed_min=2024-02-01");
		}

		@Test
		@DisplayName("Field projection and token override are honoured")
		void fieldsAndToken() throws Exception {
			serveTwoPages();

			int exitCode = CourtListenerCollectorCli.run(
					new String[] { "-u", "bob", "--limit", "2", "--fields", "id,date_filed", "--token", "cli-token" },
					properties);

			assertThat(exitCode).isZero();
			assertThat(Files.readAllLines(outputFile("bob"))).containsExactly(
					"{\"id\":1,\"date_filed\":\"2024-03-05\"}", "{\"id\":2,\"date_filed\":\"2024-03-02\"}");
			assertThat(authorizationHeaders).containsOnly("Token cli-token");
		}

		@Test
		@DisplayName("Without a token no Authorization header is sent")
		void noToken() {
			serveTwoPages();

			CourtListenerCollectorCli.run(new String[] { "-u", "bob", "--limit", "1" }, properties);

			assertThat(authorizationHeaders).containsOnly("");
		}

		@Test
		@DisplayName("Rate limiting is retried transparently")
		void retriesRateLimit() throws Exception {
			AtomicReference<Integer> calls = new AtomicReference<>(0);
			handler.set(exchange -> {
				calls.set(calls.get() + 1);
				if (calls.get() <= 2) {
					respond(exchange, 429, "{\"detail\":\"Request was throttled.\"}");
				}
				else {
					respond(exchange, 200, "{\"results\":[" + opinion(1, "2024-01-01") + "],\"next\":null}");
				}
			});

			int exitCode = CourtListenerCollectorCli.run(new String[] { "-u", "carol" }, properties);

			assertThat(exitCode).isZero();
			assertThat(calls.get()).isEqualTo(3);
			assertThat(Files.readAllLines(outputFile("carol"))).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Failure Handling")
	class FailureHandlingTest {

		@Test
		@DisplayName("Fatal error before any record exits 1 and writes no output")
		void fatalWithoutRecords() {
			handler.set(exchange -> respond(exchange, 401, "{\"detail\":\"Invalid token.\"}"));

			int exitCode = CourtListenerCollectorCli.run(new String[] { "-u", "dave" }, properties);

			assertThat(exitCode).isEqualTo(1);
			assertThat(outputFile("dave")).doesNotExist();
			assertThat(requestedQueries).hasSize(1);
		}

		@Test
		@DisplayName("Exhausted retries before any record exit 1")
		void exhaustedWithoutRecords() {
			handler.set(exchange -> respond(exchange, 503, "unavailable"));

			int exitCode = CourtListenerCollectorCli.run(new String[] { "-u", "dave" }, properties);

			assertThat(exitCode).isEqualTo(1);
			assertThat(requestedQueries).hasSize(3);
		}

		@Test
		@DisplayName("Failure after some records keeps them and exits 0")
		void partialFailure() throws Exception {
			handler.set(exchange -> {
				String query = exchange.getRequestURI().getRawQuery();
				if (query != null && query.contains("cursor=p2")) {
					respond(exchange, 400, "{\"detail\":\"bad cursor\"}");
				}
				else {
					respond(exchange, 200, "{\"results\":[" + opinion(1, "2024-01-02") + "],\"next\":\"" + baseUrl
							+ "/opinions/?cursor=p2\"}");
				}
			});

			int exitCode = CourtListenerCollectorCli.run(new String[] { "-u", "erin", "--limit", "5" }, properties);

			assertThat(exitCode).isZero();
			assertThat(Files.readAllLines(outputFile("erin"))).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Argument Handling")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Help exits 0 without contacting the server")
		void help() {
			int exitCode = CourtListenerCollectorCli.run(new String[] { "--help" }, properties);

			assertThat(exitCode).isZero();
			assertThat(requestedQueries).isEmpty();
		}

		@Test
		@DisplayName("Invalid arguments exit 2 without contacting the server")
		void invalidArguments() {
			int exitCode = CourtListenerCollectorCli.run(new String[] { "--limit", "0" }, properties);

			assertThat(exitCode).isEqualTo(2);
			assertThat(requestedQueries).isEmpty();
		}

	}

}
