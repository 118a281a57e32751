package org.springaicommunity.courtlistener.collector;

import java.nio.file.Path;

/**
 * Repository for the per-user index of saved output files.
 */
public interface UserIndexRepository {

	/**
	 * Load the index, or an empty one if none exists yet.
	 * @throws PersistenceException if the index exists but cannot be read
	 */
	UserIndex load();

	/**
	 * Register an output file for a user (read-modify-write).
	 * @param username output namespace identifier
	 * @param file path of the file that was written
	 * @return the updated index
	 * @throws PersistenceException if the index cannot be read or written
	 */
	UserIndex addFile(String username, Path file);

	/**
	 * Location of the index file.
	 */
	Path location();

}
