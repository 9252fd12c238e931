package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * The fields of a pull request the extractor carries into its CSV. Timestamps are kept
 * as the exact strings GitHub returned so output is byte-stable.
 */
public record PullRequestSummary(int number, String title, String state, @Nullable String createdAt,
		@Nullable String mergedAt, String author, @Nullable String mergeCommitSha, String body, String htmlUrl) {

	/**
	 * Parse an item of {@code GET /repos/{owner}/{repo}/pulls}.
	 */
	public static PullRequestSummary fromListItem(JsonNode node) {
		return new PullRequestSummary(node.path("number").asInt(), node.path("title").asText(""),
				node.path("state").asText(""), textOrNull(node.path("created_at")), textOrNull(node.path("merged_at")),
				node.path("user").path("login").asText(""), textOrNull(node.path("merge_commit_sha")),
				node.path("body").asText(""), node.path("html_url").asText(""));
	}

	/**
	 * Parse an item of {@code GET /search/issues}. Search results do not carry a merge
	 * timestamp or merge commit: merged pull requests are reported as closed with
	 * {@code closed_at} standing in for {@code merged_at}.
	 */
	public static PullRequestSummary fromSearchItem(JsonNode node) {
		return new PullRequestSummary(node.path("number").asInt(), node.path("title").asText(""), "closed",
				textOrNull(node.path("created_at")), textOrNull(node.path("closed_at")),
				node.path("user").path("login").asText(""), "", node.path("body").asText(""),
				node.path("html_url").asText(""));
	}

	public boolean isMerged() {
		return mergedAt != null && !mergedAt.isEmpty();
	}

	@Nullable
	public OffsetDateTime mergedAtTime() {
		if (!isMerged()) {
			return null;
		}
		try {
			return OffsetDateTime.parse(mergedAt);
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

	@Nullable
	private static String textOrNull(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

}
