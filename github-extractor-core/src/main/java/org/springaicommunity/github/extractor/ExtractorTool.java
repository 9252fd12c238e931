package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The extraction tools a job can run.
 */
public enum ExtractorTool {

	PULL_REQUEST_EXTRACTOR("pull-request-extractor", "pr-extractor"),

	FILE_COMMIT_HISTORY("file-commit-history", "file-history-extractor");

	private final String id;

	private final List<String> aliases;

	ExtractorTool(String id, String... aliases) {
		this.id = id;
		this.aliases = List.of(aliases);
	}

	/**
	 * Identifier used on the wire and in audit records.
	 */
	@JsonValue
	public String id() {
		return id;
	}

	/**
	 * Resolve a tool from its identifier or one of its aliases.
	 * @throws ExtractionValidationException if {@code value} names no tool
	 */
	public static ExtractorTool fromId(@Nullable String value) {
		if (value != null) {
			String candidate = value.trim();
			for (ExtractorTool tool : values()) {
				if (tool.id.equals(candidate) || tool.aliases.contains(candidate)) {
					return tool;
				}
			}
		}
		throw new ExtractionValidationException("Invalid 'type'");
	}

}
