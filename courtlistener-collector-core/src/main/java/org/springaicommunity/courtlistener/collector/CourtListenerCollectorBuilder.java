package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Builder for creating CourtListener collector components without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Configuration from COURTLISTENER_* environment variables
 * IncrementalSyncService sync = CourtListenerCollectorBuilder.create()
 *     .propertiesFromEnv()
 *     .buildSyncService();
 *
 * SyncResult result = sync.sync(SyncRequest.of("alice", 25));
 *
 * // Streaming records directly
 * PaginatedStream stream = CourtListenerCollectorBuilder.create()
 *     .token("xxxx")
 *     .buildPaginatedStream();
 * stream.stream("/opinions/", Map.of("date_filed_min", "2024-01-01")).limit(5).forEach(...);
 *
 * // For testing with a mock transport and a recording sleeper
 * HttpTransport transport = mock(HttpTransport.class);
 * PaginatedStream testStream = CourtListenerCollectorBuilder.create()
 *     .transport(transport)
 *     .sleeper(delays::add)
 *     .buildPaginatedStream();
 * }
 * </pre>
 */
public class CourtListenerCollectorBuilder {

	private CollectorProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private HttpTransport transport;

	@Nullable
	private Sleeper sleeper;

	@Nullable
	private CancellationToken cancellationToken;

	@Nullable
	private RecordWriter recordWriter;

	@Nullable
	private UserIndexRepository userIndexRepository;

	private CourtListenerCollectorBuilder() {
		this.properties = new CollectorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CourtListenerCollectorBuilder
	 */
	public static CourtListenerCollectorBuilder create() {
		return new CourtListenerCollectorBuilder();
	}

	/**
	 * Load properties from the {@code COURTLISTENER_*} environment variables.
	 * @return this builder
	 * @throws IllegalArgumentException if a numeric variable is malformed
	 */
	public CourtListenerCollectorBuilder propertiesFromEnv() {
		this.properties = CollectorProperties.fromEnvironment();
		return this;
	}

	/**
	 * Set collector properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder properties(@Nullable CollectorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the API token on the current properties.
	 * @param token CourtListener API token
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder token(@Nullable String token) {
		this.properties.setToken(token);
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom HttpTransport. Useful for testing with mocks or a local server.
	 * @param transport custom transport (null to use {@link JdkHttpTransport})
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder transport(@Nullable HttpTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Set the sleeper used between retries.
	 * @param sleeper custom sleeper (null to use {@link Sleeper#THREAD})
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder sleeper(@Nullable Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Set a cancellation token checked before each attempt and each backoff sleep.
	 * @param cancellationToken token (null for none)
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder cancellationToken(@Nullable CancellationToken cancellationToken) {
		this.cancellationToken = cancellationToken;
		return this;
	}

	/**
	 * Set a custom RecordWriter.
	 * @param recordWriter writer (null to use {@link JsonLinesRecordWriter})
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder recordWriter(@Nullable RecordWriter recordWriter) {
		this.recordWriter = recordWriter;
		return this;
	}

	/**
	 * Set a custom UserIndexRepository.
	 * @param userIndexRepository repository (null to use the index file under the data
	 * directory)
	 * @return this builder
	 */
	public CourtListenerCollectorBuilder userIndexRepository(@Nullable UserIndexRepository userIndexRepository) {
		this.userIndexRepository = userIndexRepository;
		return this;
	}

	/**
	 * Build the request executor.
	 * @return configured ResilientRequestExecutor
	 */
	public ResilientRequestExecutor buildExecutor() {
		ObjectMapper mapper = mapper();
		return ResilientRequestExecutor.builder()
			.transport(this.transport != null ? this.transport : new JdkHttpTransport(properties))
			.classifier(new RetryClassifier(mapper))
			.backoffPolicy(new BackoffPolicy(properties.getBackoffFactor()))
			.maxAttempts(properties.getMaxAttempts())
			.sleeper(this.sleeper != null ? this.sleeper : Sleeper.THREAD)
			.cancellationToken(this.cancellationToken != null ? this.cancellationToken : CancellationToken.none())
			.build();
	}

	/**
	 * Build a paginated stream over the configured base URL.
	 * @return configured PaginatedStream
	 */
	public PaginatedStream buildPaginatedStream() {
		return new PaginatedStream(buildExecutor(), properties.getBaseUrl());
	}

	/**
	 * Build the incremental sync service.
	 * @return configured IncrementalSyncService
	 */
	public IncrementalSyncService buildSyncService() {
		ObjectMapper mapper = mapper();
		RecordWriter writer = this.recordWriter != null ? this.recordWriter : new JsonLinesRecordWriter(mapper);
		UserIndexRepository index = this.userIndexRepository != null ? this.userIndexRepository
				: new FileSystemUserIndexRepository(mapper,
						Path.of(properties.getDataDir()).resolve(properties.getIndexFileName()));
		return new IncrementalSyncService(buildPaginatedStream(), writer, index, FileWatermarkStore::new, properties);
	}

	public CollectorProperties getProperties() {
		return properties;
	}

	private ObjectMapper mapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

}
