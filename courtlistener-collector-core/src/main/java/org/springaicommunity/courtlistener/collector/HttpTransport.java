package org.springaicommunity.courtlistener.collector;

import java.io.IOException;
import java.net.URI;

/**
 * Performs a single HTTP GET. No retries, no status interpretation.
 *
 * <p>
 * Abstracts the network so the retry and pagination logic can be tested without a
 * server, and so decorators can be layered on top.
 */
public interface HttpTransport {

	/**
	 * Execute one GET request.
	 * @param uri absolute request URI, query string included
	 * @return the response, whatever its status
	 * @throws IOException on connection failures and timeouts
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	TransportResponse get(URI uri) throws IOException, InterruptedException;

}
