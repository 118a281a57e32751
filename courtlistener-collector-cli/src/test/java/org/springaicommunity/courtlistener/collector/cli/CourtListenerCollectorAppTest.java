package org.springaicommunity.courtlistener.collector.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import org.springaicommunity.courtlistener.collector.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the Spring Boot entry point's run summary. The sync service is mocked; log
 * output is captured from the shared CLI logger.
 */
@DisplayName("CourtListenerCollectorApp Tests")
@ExtendWith(MockitoExtension.class)
class CourtListenerCollectorAppTest {

	@Mock
	private IncrementalSyncService syncService;

	@Mock
	private RecordWriter recordWriter;

	@Mock
	private UserIndexRepository userIndexRepository;

	private final ObjectMapper mapper = ObjectMapperFactory.create();

	private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

	private Logger cliLogger;

	private CourtListenerCollectorApp app;

	@BeforeEach
	void setUp() {
		cliLogger = (Logger) LoggerFactory.getLogger(CourtListenerCollectorCli.class);
		appender.start();
		cliLogger.addAppender(appender);
		CollectorProperties properties = new CollectorProperties();
		app = new CourtListenerCollectorApp(syncService, new ArgumentParser(properties), properties, recordWriter,
				userIndexRepository);
	}

	@AfterEach
	void tearDown() {
		cliLogger.detachAppender(appender);
	}

	private List<String> messages() {
		return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
	}

	@Test
	@DisplayName("Logs the first record summary and a failed watermark write")
	void logsSummaryAndWatermarkError() throws Exception {
		JsonNode first = mapper.readTree(
				"{\"id\":42,\"absolute_url\":\"/opinion/42/case/\",\"date_filed\":\"2024-03-05\",\"plain_text\":\"abcde\"}");
		PersistenceException watermarkError = new PersistenceException("Failed to write since.txt",
				new IOException("disk full"));
		when(syncService.sync(any())).thenReturn(new SyncResult(List.of(first), Path.of("data/alice_opinions.jsonl"),
				Path.of("data/users.json"), null, "2024-03-05", null, 1, null, watermarkError));

		app.run("--user", "alice");

		assertThat(messages()).contains("Records saved: 1", "First record:", "  id: 42",
				"  absolute_url: /opinion/42/case/", "  date_filed: 2024-03-05", "  plain_text length: 5",
				"Watermark not saved: Failed to write since.txt");
		verify(syncService).sync(any(SyncRequest.class));
	}

}
