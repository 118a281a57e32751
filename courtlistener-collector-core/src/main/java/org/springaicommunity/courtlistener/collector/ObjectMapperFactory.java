package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Builds the {@link ObjectMapper} shared by page decoding, the JSON Lines writer and the
 * user index.
 *
 * <ul>
 * <li>Opinion records stay {@code JsonNode}s. Decimals are read as {@code BigDecimal}
 * so numbers are written back exactly as the API sent them, and non-ASCII text is kept
 * unescaped.</li>
 * <li>Output is compact, one record per line; the index applies its own pretty
 * printer.</li>
 * <li>A page body with content after the top-level object is rejected rather than
 * silently truncated.</li>
 * <li>Typed files ({@code users.json}) use snake_case keys
 * (e.g.&nbsp;{@code savedFiles} &rarr; {@code saved_files}) and tolerate keys added by
 * other tools.</li>
 * </ul>
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		return JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
			.disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.disable(SerializationFeature.INDENT_OUTPUT)
			.disable(JsonWriteFeature.ESCAPE_NON_ASCII)
			.build();
	}

}
