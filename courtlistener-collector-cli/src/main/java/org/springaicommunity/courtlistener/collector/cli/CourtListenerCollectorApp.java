package org.springaicommunity.courtlistener.collector.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.courtlistener.collector.*;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * CourtListener Collector Spring Boot Application
 *
 * Spring Boot command-line application wired from {@link CollectorConfig}. Accepts the
 * same options as {@link CourtListenerCollectorCli}.
 *
 * Usage: java -cp courtlistener-collector-cli.jar
 * org.springaicommunity.courtlistener.collector.cli.CourtListenerCollectorApp --user NAME
 * [OPTIONS]
 */
@SpringBootApplication
@ComponentScan(basePackages = { "org.springaicommunity.courtlistener.collector",
		"org.springaicommunity.courtlistener.collector.cli" })
public class CourtListenerCollectorApp implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(CourtListenerCollectorApp.class);

	private final IncrementalSyncService syncService;

	private final ArgumentParser argumentParser;

	private final CollectorProperties properties;

	private final RecordWriter recordWriter;

	private final UserIndexRepository userIndexRepository;

	public CourtListenerCollectorApp(IncrementalSyncService syncService, ArgumentParser argumentParser,
			CollectorProperties properties, RecordWriter recordWriter, UserIndexRepository userIndexRepository) {
		this.syncService = syncService;
		this.argumentParser = argumentParser;
		this.properties = properties;
		this.recordWriter = recordWriter;
		this.userIndexRepository = userIndexRepository;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(CourtListenerCollectorApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		app.run(args);
	}

	@Override
	public void run(String... args) throws Exception {
		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);

		CourtListenerCollectorCli.logConfiguration(config, properties);

		try {
			SyncResult result = resolveSyncService(config).sync(config.toSyncRequest());
			CourtListenerCollectorCli.logResults(result, config.verbose);
		}
		catch (CourtListenerException e) {
			logger.error("Collection failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			System.exit(1);
		}
	}

	/**
	 * The injected service uses the environment's token and User-Agent; command-line
	 * overrides need a transport built from the updated properties.
	 */
	private IncrementalSyncService resolveSyncService(ParsedConfiguration config) {
		if (config.token == null && config.userAgent == null) {
			return syncService;
		}
		return CourtListenerCollectorBuilder.create()
			.properties(config.applyTo(properties))
			.recordWriter(recordWriter)
			.userIndexRepository(userIndexRepository)
			.buildSyncService();
	}

}
