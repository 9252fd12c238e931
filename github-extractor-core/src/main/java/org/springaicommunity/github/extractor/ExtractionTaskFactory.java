package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Creates the {@link ExtractionTask} for a validated request.
 */
public class ExtractionTaskFactory {

	private final Function<String, GitHubClient> clientFactory;

	private final ObjectMapper objectMapper;

	private final ScopePlanner scopePlanner;

	private final CsvTableWriter csvWriter;

	private final ExtractorProperties properties;

	/**
	 * @param clientFactory creates the client for a job from its credential
	 */
	public ExtractionTaskFactory(Function<String, GitHubClient> clientFactory, ObjectMapper objectMapper,
			ScopePlanner scopePlanner, CsvTableWriter csvWriter, ExtractorProperties properties) {
		this.clientFactory = clientFactory;
		this.objectMapper = objectMapper;
		this.scopePlanner = scopePlanner;
		this.csvWriter = csvWriter;
		this.properties = properties;
	}

	public ExtractionTask create(ExtractionRequest request, String credential, Path outputDir) {
		GitHubClient client = clientFactory.apply(credential);
		if (request instanceof PullRequestExtractionRequest pullRequests) {
			return new PullRequestExtractionTask(pullRequests, client, objectMapper, scopePlanner, csvWriter,
					outputDir);
		}
		if (request instanceof FileHistoryExtractionRequest fileHistory) {
			return new FileHistoryExtractionTask(fileHistory, client, objectMapper, csvWriter, outputDir,
					properties.getWebBaseUrl());
		}
		throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getName());
	}

}
