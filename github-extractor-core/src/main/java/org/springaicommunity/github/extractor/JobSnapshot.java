package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable point-in-time copy of a {@link Job}.
 *
 * @param jobId job identifier
 * @param tool tool the job runs
 * @param status lifecycle state
 * @param progress 0 to 100
 * @param message latest human-readable status line
 * @param log most recent worker log lines, oldest first
 * @param outputs announced output files, relative to the job's output directory
 * @param createdAt submission time
 * @param startedAt when the job started running, or null
 * @param endedAt when the job reached a terminal state, or null
 */
public record JobSnapshot(String jobId, ExtractorTool tool, JobStatus status, int progress, String message,
		List<String> log, List<String> outputs, Instant createdAt, @Nullable Instant startedAt,
		@Nullable Instant endedAt) {

	public JobSnapshot {
		log = List.copyOf(log);
		outputs = List.copyOf(outputs);
	}

	@JsonIgnore
	public boolean isTerminal() {
		return status.isTerminal();
	}

	/**
	 * Running time, up to {@code now} while the job has not ended; zero before it
	 * started.
	 */
	public Duration duration(Instant now) {
		if (startedAt == null) {
			return Duration.ZERO;
		}
		return Duration.between(startedAt, endedAt != null ? endedAt : now);
	}

}
