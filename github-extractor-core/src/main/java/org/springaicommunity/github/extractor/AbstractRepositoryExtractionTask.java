package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Base class for tasks that extract one CSV per repository.
 *
 * <p>
 * Repositories are processed serially in the order given. A failure confined to one
 * repository is logged and the remaining repositories are still processed; the task then
 * exits with {@link ExtractionTask#EXIT_PARTIAL}. Authentication failures abort the whole
 * task since no later repository can succeed either.
 *
 * <p>
 * A finished run appends an {@link ExtractionSummary} to {@value #SUMMARY_FILE} in the
 * output directory. That file is not announced as an output.
 */
public abstract class AbstractRepositoryExtractionTask implements ExtractionTask {

	private static final Logger logger = LoggerFactory.getLogger(AbstractRepositoryExtractionTask.class);

	public static final String SUMMARY_FILE = "extraction-summary.jsonl";

	private final ExtractionRequest request;

	private final GitHubClient client;

	protected final ObjectMapper objectMapper;

	protected final CsvTableWriter csvWriter;

	protected final Path outputDir;

	private GitHubClient requestClient;

	protected Paginator paginator;

	protected AbstractRepositoryExtractionTask(ExtractionRequest request, GitHubClient client,
			ObjectMapper objectMapper, CsvTableWriter csvWriter, Path outputDir) {
		this.request = request;
		this.client = client;
		this.objectMapper = objectMapper;
		this.csvWriter = csvWriter;
		this.outputDir = outputDir;
		this.requestClient = client;
		this.paginator = new Paginator(client, objectMapper);
	}

	/**
	 * Report the effective scope before any request is made.
	 */
	protected abstract void describeScope(EventSink sink);

	/**
	 * Extract one repository, write its CSV and announce it.
	 * @return number of rows written
	 */
	protected abstract int extractRepository(String repo, RepositoryProgress progress, EventSink sink);

	@Override
	public final int run(EventSink sink) {
		Instant started = Instant.now();
		if (request.verbose()) {
			requestClient = new RequestEchoingGitHubClient(client, sink::log);
			paginator = new Paginator(requestClient, objectMapper);
		}
		describeScope(sink);

		List<String> repos = request.repos();
		int totalRows = 0;
		int failed = 0;
		for (int i = 0; i < repos.size(); i++) {
			String repo = repos.get(i);
			try {
				totalRows += extractRepository(repo, new RepositoryProgress(sink, i, repos.size()), sink);
			}
			catch (GitHubAuthException e) {
				throw e;
			}
			catch (RuntimeException e) {
				failed++;
				logger.warn("Extraction of {}/{} failed", request.org(), repo, e);
				sink.log("[" + repo + "] Error: " + e.getMessage());
			}
		}

		sink.progress(100, "Completed");
		Instant finished = Instant.now();
		writeSummary(new ExtractionSummary(finished, request.tool().id(), request.params(), totalRows,
				Duration.between(started, finished).toMillis() / 1000.0));
		if (failed > 0) {
			sink.log("Finished with errors: " + failed + " of " + repos.size() + " repositories failed. Rows written: "
					+ totalRows);
			return EXIT_PARTIAL;
		}
		sink.log("Done. Rows written: " + totalRows);
		return EXIT_SUCCESS;
	}

	private void writeSummary(ExtractionSummary summary) {
		Path file = outputDir.resolve(SUMMARY_FILE);
		try {
			String line = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(summary);
			Files.createDirectories(outputDir);
			Files.writeString(file, line + "\n", StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
		}
		catch (IOException e) {
			logger.warn("Failed to write run summary {}", file, e);
		}
	}

	protected String org() {
		return request.org();
	}

	protected String repoPath(String repo) {
		return "/repos/" + request.org() + "/" + repo;
	}

	/**
	 * GET a single JSON document.
	 */
	protected JsonNode getJson(String path) {
		String body = requestClient.get(path);
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubApiException("Malformed JSON from " + path, e);
		}
	}

}
