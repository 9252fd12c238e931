package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

/**
 * One row of {@code <repo>-pull-requests.csv}. Columns are only ever appended, never
 * reordered.
 */
@JsonPropertyOrder({ "number", "title", "state", "created_at", "merged_at", "author", "merge_commit_sha",
		"commits_count", "reviews_count", "description", "url" })
public record PullRequestRow(@JsonProperty("number") int number, @JsonProperty("title") String title,
		@JsonProperty("state") String state, @JsonProperty("created_at") @Nullable String createdAt,
		@JsonProperty("merged_at") @Nullable String mergedAt, @JsonProperty("author") String author,
		@JsonProperty("merge_commit_sha") @Nullable String mergeCommitSha,
		@JsonProperty("commits_count") int commitsCount, @JsonProperty("reviews_count") int reviewsCount,
		@JsonProperty("description") String description, @JsonProperty("url") String url) {

	public static PullRequestRow of(PullRequestSummary pr, int commitsCount, int reviewsCount) {
		return new PullRequestRow(pr.number(), pr.title(), pr.state(), pr.createdAt(), pr.mergedAt(), pr.author(),
				pr.mergeCommitSha(), commitsCount, reviewsCount, normalizeNewlines(pr.body()), pr.htmlUrl());
	}

	static String normalizeNewlines(String text) {
		return text.replace("\r\n", "\n").replace('\r', '\n');
	}

}
