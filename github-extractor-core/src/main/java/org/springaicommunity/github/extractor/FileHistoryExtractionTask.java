package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Writes {@code <repo>-<path>-file-history.csv} for each requested repository: every
 * commit that touched the tracked file, newest first.
 *
 * <p>
 * Commits are listed with the server-side {@code path} filter, then each commit is
 * fetched individually to read the per-file line counts. A rename is matched through
 * {@code previous_filename}.
 */
public class FileHistoryExtractionTask extends AbstractRepositoryExtractionTask {

	static final Comparator<FileHistoryRow> NEWEST_FIRST = Comparator.comparing(FileHistoryRow::commitTime,
			Comparator.nullsLast(Comparator.reverseOrder()));

	private final FileHistoryExtractionRequest request;

	private final String webBaseUrl;

	public FileHistoryExtractionTask(FileHistoryExtractionRequest request, GitHubClient client,
			ObjectMapper objectMapper, CsvTableWriter csvWriter, Path outputDir, String webBaseUrl) {
		super(request, client, objectMapper, csvWriter, outputDir);
		this.request = request;
		this.webBaseUrl = webBaseUrl.endsWith("/") ? webBaseUrl.substring(0, webBaseUrl.length() - 1) : webBaseUrl;
	}

	@Override
	protected void describeScope(EventSink sink) {
		sink.log("=== Filters ===");
		sink.log("  type:        commits (per-file)");
		sink.log("  org:         " + request.org());
		sink.log("  repos:       " + String.join(", ", request.repos()));
		sink.log("  file_path:   " + request.filePath());
		if (request.sha() != null) {
			sink.log("  sha:         " + request.sha());
		}
		sink.log("  date:        " + request.window().describe());
		sink.log("===============");
		sink.progress(1, "Listing commits...");
	}

	@Override
	protected int extractRepository(String repo, RepositoryProgress progress, EventSink sink) {
		sink.log("[" + repo + "] listing commits touching " + request.filePath() + "...");
		ExtractionWindow window = request.window();
		PageRequest listing = PageRequest.of(repoPath(repo) + "/commits")
			.with("path", request.filePath())
			.with("since", window.sinceParam())
			.with("until", window.untilParam())
			.with("sha", request.sha());

		List<JsonNode> commits = new ArrayList<>();
		paginator.fetchAll(listing).forEach(commits::add);
		progress.report(10, repo + ": " + commits.size() + " commits found");

		List<FileHistoryRow> rows = new ArrayList<>();
		int total = commits.size();
		for (int i = 0; i < total; i++) {
			JsonNode summary = commits.get(i);
			String sha = summary.path("sha").asText("");
			if (!sha.isEmpty()) {
				JsonNode detail = getJson(repoPath(repo) + "/commits/" + sha);
				toRow(repo, summary, detail).ifPresent(rows::add);
			}
			progress.report(RepositoryProgress.scaled(10, 80, i + 1, total),
					repo + ": processing " + (i + 1) + "/" + total);
		}
		rows.sort(NEWEST_FIRST);

		Path file = csvWriter.write(outputDir, request.outputFileName(repo), FileHistoryRow.class, rows);
		sink.outputAnnounced(file);
		sink.log("[" + repo + "] " + rows.size() + " commits written to " + file.getFileName());
		return rows.size();
	}

	/**
	 * Build the row for one commit, or empty when the commit's file list has no record
	 * for the tracked path.
	 */
	Optional<FileHistoryRow> toRow(String repo, JsonNode summary, JsonNode detail) {
		String filePath = request.filePath();
		JsonNode fileRecord = null;
		for (JsonNode file : detail.path("files")) {
			if (filePath.equals(file.path("filename").asText(null))
					|| filePath.equals(file.path("previous_filename").asText(null))) {
				fileRecord = file;
				break;
			}
		}
		if (fileRecord == null) {
			return Optional.empty();
		}

		String sha = summary.path("sha").asText("");
		JsonNode commit = summary.path("commit");
		JsonNode author = commit.path("author");
		String message = commit.path("message").asText("").replace("\r\n", " ").replace('\n', ' ');

		return Optional.of(new FileHistoryRow(repo, filePath, sha, summary.path("html_url").asText(""),
				webBaseUrl + "/" + org() + "/" + repo + "/commit/" + sha, author.path("date").asText(""),
				summary.path("author").path("login").asText(""), author.path("name").asText(""),
				author.path("email").asText(""), summary.path("committer").path("login").asText(""), message,
				fileRecord.path("status").asText(""), fileRecord.path("previous_filename").asText(""),
				fileRecord.path("additions").asInt(0), fileRecord.path("deletions").asInt(0),
				fileRecord.path("changes").asInt(0)));
	}

}
