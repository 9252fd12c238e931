package org.springaicommunity.github.extractor.server;

import org.springaicommunity.github.extractor.JobSnapshot;

import java.util.List;

/**
 * Body of {@code GET /api/status/{jobId}}.
 */
public record JobStatusResponse(String jobId, String tool, String status, int progress, String message,
		List<String> log, List<String> outputs) {

	static JobStatusResponse from(JobSnapshot snapshot) {
		return new JobStatusResponse(snapshot.jobId(), snapshot.tool().id(), snapshot.status().wireValue(),
				snapshot.progress(), snapshot.message(), snapshot.log(), snapshot.outputs());
	}

}
