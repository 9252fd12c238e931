package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code <repo>-pull-requests.csv} for each requested repository: the pull
 * requests in scope with their commit and review counts.
 */
public class PullRequestExtractionTask extends AbstractRepositoryExtractionTask {

	private final PullRequestExtractionRequest request;

	private final ScopePlanner planner;

	public PullRequestExtractionTask(PullRequestExtractionRequest request, GitHubClient client,
			ObjectMapper objectMapper, ScopePlanner planner, CsvTableWriter csvWriter, Path outputDir) {
		super(request, client, objectMapper, csvWriter, outputDir);
		this.request = request;
		this.planner = planner;
	}

	public static String outputFileName(String repo) {
		return repo + "-pull-requests.csv";
	}

	@Override
	protected void describeScope(EventSink sink) {
		PullRequestFilter filter = request.filter();
		sink.log("=== Filters ===");
		sink.log("  type:       is:pr");
		sink.log("  org:        " + request.org());
		sink.log("  repos:      " + String.join(", ", request.repos()));
		sink.log("  state:      " + filter.state());
		sink.log("  is:merged:  " + filter.mergedOnly());
		sink.log("  merged_at:  " + filter.window().describe());
		sink.log("===============");
	}

	@Override
	protected int extractRepository(String repo, RepositoryProgress progress, EventSink sink) {
		sink.log("[" + repo + "] fetching PRs...");
		RetrievalPlan plan = planner.plan(org(), repo, request.filter());
		List<PullRequestSummary> pullRequests = plan.retrieve(paginator);
		progress.report(5, repo + ": " + pullRequests.size() + " PRs to process");

		List<PullRequestRow> rows = new ArrayList<>(pullRequests.size());
		int total = pullRequests.size();
		for (int i = 0; i < total; i++) {
			PullRequestSummary pr = pullRequests.get(i);
			String base = repoPath(repo) + "/pulls/" + pr.number();
			int commits = paginator.count(PageRequest.of(base + "/commits"));
			int reviews = paginator.count(PageRequest.of(base + "/reviews"));
			rows.add(PullRequestRow.of(pr, commits, reviews));
			progress.report(RepositoryProgress.scaled(5, 90, i + 1, total),
					repo + ": processing " + (i + 1) + "/" + total);
		}

		Path file = csvWriter.write(outputDir, outputFileName(repo), PullRequestRow.class, rows);
		sink.outputAnnounced(file);
		sink.log("[" + repo + "] " + rows.size() + " PRs written to " + file.getFileName());
		return rows.size();
	}

}
