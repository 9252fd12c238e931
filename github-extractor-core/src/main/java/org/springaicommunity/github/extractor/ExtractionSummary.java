package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * One line of a job's {@code extraction-summary.jsonl}: what a task extracted and how
 * long it took. Written by the task itself, next to its CSV files.
 */
@JsonPropertyOrder({ "ts", "tool", "params", "rows_written", "duration_sec" })
public record ExtractionSummary(@JsonProperty("ts") Instant ts, @JsonProperty("tool") String tool,
		@JsonProperty("params") Map<String, @Nullable Object> params, @JsonProperty("rows_written") int rowsWritten,
		@JsonProperty("duration_sec") double durationSec) {
}
