package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;

/**
 * Spring configuration for the CourtListener client and sync beans. Settings are
 * resolved from the Spring {@link Environment} using the same {@code COURTLISTENER_*}
 * keys as {@link CollectorProperties#fromEnvironment()}.
 */
@Configuration
public class CollectorConfig {

	@Bean
	public CollectorProperties collectorProperties(Environment environment) {
		return CollectorProperties.fromEnvironment(environment::getProperty);
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public HttpTransport httpTransport(CollectorProperties properties) {
		return new JdkHttpTransport(properties);
	}

	@Bean
	public ResilientRequestExecutor resilientRequestExecutor(HttpTransport httpTransport, ObjectMapper objectMapper,
			CollectorProperties properties) {
		return ResilientRequestExecutor.builder()
			.transport(httpTransport)
			.classifier(new RetryClassifier(objectMapper))
			.backoffPolicy(new BackoffPolicy(properties.getBackoffFactor()))
			.maxAttempts(properties.getMaxAttempts())
			.build();
	}

	@Bean
	public PaginatedStream paginatedStream(ResilientRequestExecutor executor, CollectorProperties properties) {
		return new PaginatedStream(executor, properties.getBaseUrl());
	}

	@Bean
	public RecordWriter recordWriter(ObjectMapper objectMapper) {
		return new JsonLinesRecordWriter(objectMapper);
	}

	@Bean
	public UserIndexRepository userIndexRepository(ObjectMapper objectMapper, CollectorProperties properties) {
		return new FileSystemUserIndexRepository(objectMapper,
				Path.of(properties.getDataDir()).resolve(properties.getIndexFileName()));
	}

	@Bean
	public IncrementalSyncService incrementalSyncService(PaginatedStream paginatedStream, RecordWriter recordWriter,
			UserIndexRepository userIndexRepository, CollectorProperties properties) {
		return new IncrementalSyncService(paginatedStream, recordWriter, userIndexRepository, FileWatermarkStore::new,
				properties);
	}

	@Bean
	public ArgumentParser argumentParser(CollectorProperties properties) {
		return new ArgumentParser(properties);
	}

}
