package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File system implementation of {@link UserIndexRepository}, storing the index as a
 * pretty-printed JSON file.
 */
public class FileSystemUserIndexRepository implements UserIndexRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemUserIndexRepository.class);

	private final ObjectMapper objectMapper;

	private final Path indexFile;

	public FileSystemUserIndexRepository(ObjectMapper objectMapper, Path indexFile) {
		this.objectMapper = objectMapper;
		this.indexFile = indexFile;
	}

	@Override
	public UserIndex load() {
		if (!Files.exists(indexFile)) {
			return UserIndex.empty();
		}
		try {
			return objectMapper.readValue(indexFile.toFile(), UserIndex.class);
		}
		catch (IOException e) {
			throw new PersistenceException("Failed to read user index " + indexFile, e);
		}
	}

	@Override
	public UserIndex addFile(String username, Path file) {
		UserIndex updated = load().withFile(username, file.toString());
		save(updated);
		logger.info("User index updated: {} -> {}", username, file);
		return updated;
	}

	@Override
	public Path location() {
		return indexFile;
	}

	private void save(UserIndex index) {
		try {
			Path parent = indexFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(indexFile.toFile(), index);
		}
		catch (IOException e) {
			throw new PersistenceException("Failed to write user index " + indexFile, e);
		}
	}

}
