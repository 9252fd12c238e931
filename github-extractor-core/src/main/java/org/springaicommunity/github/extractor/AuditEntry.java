package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One line of the audit log. Each job produces a start record (with
 * {@code cmd_preview}) and an end record (with duration, progress, outputs and last
 * message). Only the masked credential is ever recorded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "ts", "job_id", "tool", "args", "token_masked", "status", "cmd_preview", "duration_sec",
		"progress", "outputs", "last_message" })
public record AuditEntry(@JsonProperty("ts") Instant ts, @JsonProperty("job_id") String jobId,
		@JsonProperty("tool") String tool, @JsonProperty("args") Map<String, Object> args,
		@JsonProperty("token_masked") String tokenMasked, @JsonProperty("status") String status,
		@JsonProperty("cmd_preview") @Nullable List<String> cmdPreview,
		@JsonProperty("duration_sec") @Nullable Double durationSec, @JsonProperty("progress") @Nullable Integer progress,
		@JsonProperty("outputs") @Nullable List<String> outputs,
		@JsonProperty("last_message") @Nullable String lastMessage) {

	public static final String STATUS_STARTED = "started";

	public static AuditEntry started(Job job, Instant now, List<String> cmdPreview) {
		return new AuditEntry(now, job.id(), job.tool().id(), job.args(), job.credentialMasked(), STATUS_STARTED,
				List.copyOf(cmdPreview), null, null, null, null);
	}

	public static AuditEntry finished(Job job, JobSnapshot snapshot, Instant now) {
		Duration duration = snapshot.duration(now);
		return new AuditEntry(now, job.id(), job.tool().id(), job.args(), job.credentialMasked(),
				snapshot.status().wireValue(), null, duration.toMillis() / 1000.0, snapshot.progress(),
				snapshot.outputs(), snapshot.message());
	}

}
