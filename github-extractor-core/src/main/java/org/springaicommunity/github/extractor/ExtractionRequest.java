package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Validated scope of one extraction job.
 */
public interface ExtractionRequest {

	ExtractorTool tool();

	String org();

	List<String> repos();

	/**
	 * Whether every API request is echoed into the job's log.
	 */
	boolean verbose();

	/**
	 * The effective scope as named parameters, for the run summary written next to the
	 * outputs. Absent optional values map to {@code null}.
	 */
	Map<String, @Nullable Object> params();

	/**
	 * The equivalent worker invocation, with {@code --token [TOKEN]} in place of the
	 * credential. Recorded in the audit log only.
	 */
	List<String> commandPreview(Path outputDir);

	/**
	 * Validate {@code args} for {@code tool}.
	 * @throws ExtractionValidationException on missing or malformed arguments
	 */
	static ExtractionRequest parse(ExtractorTool tool, Map<String, ?> args) {
		return switch (tool) {
			case PULL_REQUEST_EXTRACTOR -> PullRequestExtractionRequest.from(args);
			case FILE_COMMIT_HISTORY -> FileHistoryExtractionRequest.from(args);
		};
	}

}
