package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * {@link RecordWriter} producing JSON Lines: one compact JSON object per line, UTF-8,
 * non-ASCII characters written as-is.
 */
public class JsonLinesRecordWriter implements RecordWriter {

	private static final Logger logger = LoggerFactory.getLogger(JsonLinesRecordWriter.class);

	private final ObjectMapper objectMapper;

	public JsonLinesRecordWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public Path write(Path file, List<JsonNode> records, boolean append) {
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}

			StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
			try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
					StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode)) {
				for (JsonNode record : records) {
					writer.write(objectMapper.writeValueAsString(record));
					writer.write('\n');
				}
			}

			logger.info("{} {} records to {}", append ? "Appended" : "Wrote", records.size(), file);
			return file;
		}
		catch (IOException e) {
			throw new PersistenceException("Failed to write records to " + file, e);
		}
	}

}
