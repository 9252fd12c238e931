package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * One row of {@code <repo>-<path>-file-history.csv}: a commit that touched the target
 * file, with the line counts of that file within that commit.
 */
@JsonPropertyOrder({ "repo", "file_path", "commit_sha", "html_url", "commit_url", "commit_date", "author_login",
		"author_name", "author_email", "committer_login", "message", "status", "previous_filename", "additions",
		"deletions", "changes" })
public record FileHistoryRow(@JsonProperty("repo") String repo, @JsonProperty("file_path") String filePath,
		@JsonProperty("commit_sha") String commitSha, @JsonProperty("html_url") String htmlUrl,
		@JsonProperty("commit_url") String commitUrl, @JsonProperty("commit_date") String commitDate,
		@JsonProperty("author_login") String authorLogin, @JsonProperty("author_name") String authorName,
		@JsonProperty("author_email") String authorEmail, @JsonProperty("committer_login") String committerLogin,
		@JsonProperty("message") String message, @JsonProperty("status") String status,
		@JsonProperty("previous_filename") String previousFilename, @JsonProperty("additions") int additions,
		@JsonProperty("deletions") int deletions, @JsonProperty("changes") int changes) {

	/**
	 * Commit date as an instant for ordering, or null when absent or unparseable.
	 */
	@JsonIgnore
	@Nullable
	public OffsetDateTime commitTime() {
		if (commitDate.isEmpty()) {
			return null;
		}
		try {
			return OffsetDateTime.parse(commitDate);
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

}
