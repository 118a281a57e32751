package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs one incremental collection: resolve the lower bound, stream records up to the
 * limit, save them, register the output file and advance the watermark.
 *
 * <p>
 * Failure policy:
 * <ul>
 * <li>a fetch error before any record was collected fails the run</li>
 * <li>a fetch error after at least one record keeps and saves the partial set; the error
 * is reported in the {@link SyncResult}</li>
 * <li>the written watermark is the larger of the stored and the tracked value, so it never
 * moves backwards</li>
 * <li>a watermark write failure is reported but does not fail the run</li>
 * </ul>
 */
public class IncrementalSyncService {

	private static final Logger logger = LoggerFactory.getLogger(IncrementalSyncService.class);

	private final PaginatedStream paginatedStream;

	private final RecordWriter recordWriter;

	private final UserIndexRepository userIndexRepository;

	private final Function<Path, WatermarkStore> watermarkStores;

	private final CollectorProperties properties;

	public IncrementalSyncService(PaginatedStream paginatedStream, RecordWriter recordWriter,
			UserIndexRepository userIndexRepository, Function<Path, WatermarkStore> watermarkStores,
			CollectorProperties properties) {
		this.paginatedStream = paginatedStream;
		this.recordWriter = recordWriter;
		this.userIndexRepository = userIndexRepository;
		this.watermarkStores = watermarkStores;
		this.properties = properties;
	}

	/**
	 * Execute a sync run.
	 * @param request run parameters
	 * @return what was saved
	 * @throws CourtListenerException if fetching failed before any record was collected
	 * @throws PersistenceException if the record file or the index cannot be written
	 */
	public SyncResult sync(SyncRequest request) {
		WatermarkStore watermarkStore = request.sinceFile() != null ? watermarkStores.apply(request.sinceFile())
				: null;
		Optional<String> storedWatermark = watermarkStore != null ? watermarkStore.read() : Optional.empty();

		String effectiveDateMin = request.dateMin();
		if (effectiveDateMin == null && storedWatermark.isPresent()) {
			effectiveDateMin = storedWatermark.get();
			logger.info("Using since-file {} from {}: {}", properties.getCursorFilterParameter(), request.sinceFile(),
					effectiveDateMin);
		}

		Map<String, Object> filters = new LinkedHashMap<>();
		if (effectiveDateMin != null) {
			filters.put(properties.getCursorFilterParameter(), effectiveDateMin);
		}
		if (!request.projection().isAll()) {
			logger.info("Saving only fields: {}", request.projection().fields());
		}

		logger.info("Fetching up to {} records from {} ...", request.limit(), properties.getEndpoint());

		WatermarkTracker tracker = new WatermarkTracker(properties.getCursorField(),
				properties.getWatermarkPrefixLength());
		List<JsonNode> collected = new ArrayList<>();
		PaginatedStream.RecordCursor cursor = paginatedStream.open(properties.getEndpoint(), filters);
		CourtListenerException fetchError = null;

		try {
			while (collected.size() < request.limit() && cursor.hasNext()) {
				JsonNode record = cursor.next();
				tracker.observe(record);
				collected.add(request.projection().apply(record));
			}
		}
		catch (CourtListenerException e) {
			if (collected.isEmpty()) {
				logger.error("Error while fetching, no records collected: {}", e.getMessage());
				throw e;
			}
			logger.warn("Error while fetching after {} records; keeping the partial result: {}", collected.size(),
					e.getMessage());
			fetchError = e;
		}

		Path outputFile = outputFile(request.username());
		recordWriter.write(outputFile, collected, request.append());
		userIndexRepository.addFile(request.username(), outputFile);

		logger.info("Saved {} records to {}", collected.size(), outputFile);
		logger.info("User data index updated: {}", userIndexRepository.location());

		String tracked = tracker.current().orElse(null);
		String written = null;
		PersistenceException watermarkError = null;
		if (watermarkStore != null && tracked != null) {
			String next = laterOf(storedWatermark.orElse(null), tracked);
			try {
				watermarkStore.write(next);
				written = next;
				logger.info("Wrote newest {} '{}' to since-file: {}", properties.getCursorField(), next,
						request.sinceFile());
			}
			catch (PersistenceException e) {
				logger.error("Failed to write since-file {}: {}", request.sinceFile(), e.getMessage());
				watermarkError = e;
			}
		}

		return new SyncResult(collected, outputFile, userIndexRepository.location(), effectiveDateMin, tracked,
				written, cursor.pagesFetched(), fetchError, watermarkError);
	}

	Path outputFile(String username) {
		return Path.of(properties.getDataDir()).resolve(username + "_" + collectionName() + ".jsonl");
	}

	/**
	 * Collection name derived from the endpoint: {@code /opinions/} gives
	 * {@code opinions}.
	 */
	String collectionName() {
		String name = properties.getEndpoint().replaceAll("^/+|/+$", "").replace('/', '_');
		return name.isEmpty() ? "records" : name;
	}

	private static String laterOf(@Nullable String stored, String tracked) {
		if (stored != null && stored.compareTo(tracked) > 0) {
			logger.info("Tracked watermark {} is older than stored {}; keeping stored value", tracked, stored);
			return stored;
		}
		return tracked;
	}

}
