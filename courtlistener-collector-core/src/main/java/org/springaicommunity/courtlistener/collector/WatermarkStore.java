package org.springaicommunity.courtlistener.collector;

import java.util.Optional;

/**
 * Persists the watermark between runs.
 */
public interface WatermarkStore {

	/**
	 * Read the stored watermark.
	 * @return the stored value, empty when nothing usable is stored
	 */
	Optional<String> read();

	/**
	 * Replace the stored watermark.
	 * @throws PersistenceException if the value cannot be written
	 */
	void write(String watermark);

}
