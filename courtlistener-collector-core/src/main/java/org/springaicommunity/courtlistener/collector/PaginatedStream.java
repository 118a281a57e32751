package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns a filtered list request into a lazy sequence of records spanning every page.
 *
 * <p>
 * The first page is requested with the caller's filters. Every following page is
 * requested through the absolute {@code next} URL returned by the server, with no extra
 * parameters. Pages are fetched on demand, so a consumer that stops early causes no
 * further requests.
 */
public class PaginatedStream {

	private static final Logger logger = LoggerFactory.getLogger(PaginatedStream.class);

	private final ResilientRequestExecutor executor;

	private final String baseUrl;

	public PaginatedStream(ResilientRequestExecutor executor, String baseUrl) {
		this.executor = executor;
		this.baseUrl = baseUrl;
	}

	/**
	 * Open a cursor over all records matching the filters.
	 * @param endpoint path relative to the base URL (e.g. {@code /opinions/})
	 * @param filters query parameters for the first page only
	 * @return a forward-only cursor; nothing is fetched until it is first advanced
	 */
	public RecordCursor open(String endpoint, Map<String, ?> filters) {
		return new RecordCursor(resolve(endpoint), new LinkedHashMap<>(filters));
	}

	/**
	 * Same as {@link #open(String, Map)}, exposed as a sequential {@link Stream}.
	 * Short-circuiting operations such as {@code limit} stop page fetching.
	 */
	public Stream<JsonNode> stream(String endpoint, Map<String, ?> filters) {
		RecordCursor cursor = open(endpoint, filters);
		return StreamSupport
			.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	String resolve(String endpoint) {
		String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
		return base + "/" + path;
	}

	/**
	 * Lazy iterator over the records of every page. Not restartable.
	 *
	 * <p>
	 * A failed page fetch surfaces from {@link #hasNext()} as the executor's exception.
	 * Records returned before the failure stay with the caller.
	 */
	public final class RecordCursor implements Iterator<JsonNode> {

		@Nullable
		private String nextUrl;

		private Map<String, ?> pendingFilters;

		private Iterator<JsonNode> current = List.<JsonNode>of().iterator();

		private int pagesFetched;

		private long recordsEmitted;

		private RecordCursor(String firstUrl, Map<String, ?> filters) {
			this.nextUrl = firstUrl;
			this.pendingFilters = filters;
		}

		@Override
		public boolean hasNext() {
			while (!current.hasNext()) {
				if (nextUrl == null) {
					return false;
				}
				fetchNextPage();
			}
			return true;
		}

		@Override
		public JsonNode next() {
			if (!hasNext()) {
				throw new NoSuchElementException("No more records");
			}
			recordsEmitted++;
			return current.next();
		}

		private void fetchNextPage() {
			String url = nextUrl;
			// Filters belong to the first request only; the server's next URL carries the
			// full query state.
			Map<String, ?> params = pendingFilters;
			pendingFilters = Map.of();

			PageResult page = executor.execute(url, params);
			pagesFetched++;
			logger.info("Page {}: {} records (next: {})", pagesFetched, page.records().size(),
					page.hasNext() ? "present" : "none");

			nextUrl = page.next();
			current = page.records().iterator();
		}

		/**
		 * Number of pages fetched so far.
		 */
		public int pagesFetched() {
			return pagesFetched;
		}

		/**
		 * Number of records handed out so far.
		 */
		public long recordsEmitted() {
			return recordsEmitted;
		}

	}

}
