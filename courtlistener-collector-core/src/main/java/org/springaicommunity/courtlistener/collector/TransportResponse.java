package org.springaicommunity.courtlistener.collector;

/**
 * Raw HTTP response as seen by the transport: status code and body text.
 */
public record TransportResponse(int statusCode, String body) {

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
