package org.springaicommunity.github.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.function.Predicate;

/**
 * Chooses how pull requests are retrieved for a repository.
 *
 * <p>
 * The list path ({@code GET /repos/{owner}/{repo}/pulls}) returns the whole collection and
 * filters client-side. It is complete regardless of volume and is the default.
 *
 * <p>
 * The search path ({@code GET /search/issues}) is used only when merged-only is requested
 * together with both window bounds. GitHub pre-filters the results, but a single query
 * never returns more than the search result ceiling (1,000). Callers extracting busy
 * repositories should split large windows into smaller segments; the planner neither
 * detects nor reports truncation.
 */
public class ScopePlanner {

	private static final Logger logger = LoggerFactory.getLogger(ScopePlanner.class);

	public static final int DEFAULT_SEARCH_RESULT_CEILING = 1000;

	private final int searchResultCeiling;

	public ScopePlanner() {
		this(DEFAULT_SEARCH_RESULT_CEILING);
	}

	public ScopePlanner(int searchResultCeiling) {
		if (searchResultCeiling <= 0) {
			throw new IllegalArgumentException("searchResultCeiling must be positive, got: " + searchResultCeiling);
		}
		this.searchResultCeiling = searchResultCeiling;
	}

	public RetrievalPath choosePath(PullRequestFilter filter) {
		if (filter.mergedOnly() && filter.window().isFullyBounded()) {
			return RetrievalPath.SEARCH;
		}
		return RetrievalPath.LIST;
	}

	public RetrievalPlan plan(String owner, String repo, PullRequestFilter filter) {
		RetrievalPath path = choosePath(filter);
		logger.debug("{}/{}: using {} path", owner, repo, path);
		if (path == RetrievalPath.SEARCH) {
			return searchPlan(owner, repo, filter.window());
		}
		return listPlan(owner, repo, filter);
	}

	String buildMergedSearchQuery(String owner, String repo, ExtractionWindow window) {
		return String.format("repo:%s/%s is:pr is:merged merged:%s..%s", owner, repo, dateOf(window.since()),
				dateOf(window.until()));
	}

	private RetrievalPlan searchPlan(String owner, String repo, ExtractionWindow window) {
		PageRequest request = PageRequest.of("/search/issues")
			.with("q", buildMergedSearchQuery(owner, repo, window))
			.itemsIn("items")
			.limitedTo(searchResultCeiling);
		return new RetrievalPlan(RetrievalPath.SEARCH, request, PullRequestSummary::fromSearchItem, pr -> true);
	}

	private RetrievalPlan listPlan(String owner, String repo, PullRequestFilter filter) {
		PageRequest request = PageRequest.of("/repos/" + owner + "/" + repo + "/pulls")
			.with("state", filter.state())
			.with("sort", "updated")
			.with("direction", "desc");

		Predicate<PullRequestSummary> keep = pr -> true;
		if (filter.mergedOnly()) {
			keep = keep.and(PullRequestSummary::isMerged);
		}
		ExtractionWindow window = filter.window();
		if (!window.isUnbounded()) {
			keep = keep.and(pr -> {
				OffsetDateTime mergedAt = pr.mergedAtTime();
				return mergedAt != null && window.contains(mergedAt);
			});
		}
		return new RetrievalPlan(RetrievalPath.LIST, request, PullRequestSummary::fromListItem, keep);
	}

	private static String dateOf(OffsetDateTime time) {
		return time.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().toString();
	}

}
