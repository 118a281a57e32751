package org.springaicommunity.courtlistener.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link WatermarkStore} holding the value as the single line of a text file.
 */
public class FileWatermarkStore implements WatermarkStore {

	private static final Logger logger = LoggerFactory.getLogger(FileWatermarkStore.class);

	private final Path file;

	public FileWatermarkStore(Path file) {
		this.file = file;
	}

	/**
	 * Missing, blank and unreadable files all read as empty; an unreadable file is logged.
	 */
	@Override
	public Optional<String> read() {
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			String text = Files.readString(file, StandardCharsets.UTF_8).strip();
			return text.isEmpty() ? Optional.empty() : Optional.of(text);
		}
		catch (IOException e) {
			logger.warn("Ignoring unreadable watermark file {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void write(String watermark) {
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(file, watermark.strip(), StandardCharsets.UTF_8);
			logger.info("Wrote watermark '{}' to {}", watermark.strip(), file);
		}
		catch (IOException e) {
			throw new PersistenceException("Failed to write watermark file " + file, e);
		}
	}

	public Path getFile() {
		return file;
	}

}
