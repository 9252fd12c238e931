package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured Jackson mappers.
 *
 * <p>
 * The JSON mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that Java camelCase
 * record fields are serialized as snake_case JSON keys (e.g.&nbsp;{@code jobId} &rarr;
 * {@code job_id}), matching the GitHub API and the audit log format.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

	/**
	 * Create a {@link CsvMapper} for the row records. Column names and order come from the
	 * annotations on each row type; values are quoted only when they need it.
	 * @return configured CsvMapper
	 */
	public static CsvMapper createCsvMapper() {
		CsvMapper mapper = new CsvMapper();
		mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
		return mapper;
	}

}
