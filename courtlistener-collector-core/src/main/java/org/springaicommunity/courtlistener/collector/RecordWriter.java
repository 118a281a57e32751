package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes collected records to local storage.
 *
 * <p>
 * Abstracts file system operations to enable testability and alternative output formats.
 */
public interface RecordWriter {

	/**
	 * Write records to a file, creating parent directories as needed.
	 * @param file destination file
	 * @param records records in the order they should appear
	 * @param append true to add to an existing file, false to replace it
	 * @return the file written
	 * @throws PersistenceException if the file cannot be written
	 */
	Path write(Path file, List<JsonNode> records, boolean append);

}
