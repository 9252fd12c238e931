package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/**
 * Builder for wiring a {@link JobRegistry} without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: api.github.com, ./output, ./audit-log.jsonl
 * JobRegistry registry = GitHubExtractorBuilder.create().buildJobRegistry();
 *
 * String jobId = registry.submit(ExtractorTool.PULL_REQUEST_EXTRACTOR,
 *     Map.of("org", "spring-projects", "repos", "spring-ai", "since", "2024-01-01", "until", "2024-03-31"),
 *     EnvironmentSupport.credentialOrEnv(null));
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * JobRegistry testRegistry = GitHubExtractorBuilder.create()
 *     .httpClient(mockClient)
 *     .buildJobRegistry();
 * }
 * </pre>
 */
public class GitHubExtractorBuilder {

	private ExtractorProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private Function<String, GitHubClient> clientFactory;

	@Nullable
	private AuditLog auditLog;

	private Clock clock = Clock.systemUTC();

	private GitHubExtractorBuilder() {
		this.properties = new ExtractorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubExtractorBuilder
	 */
	public static GitHubExtractorBuilder create() {
		return new GitHubExtractorBuilder();
	}

	/**
	 * Set extractor properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubExtractorBuilder properties(@Nullable ExtractorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubExtractorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use the same client for every job regardless of credential. Useful for testing
	 * with mocks.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubExtractorBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.clientFactory = httpClient != null ? credential -> httpClient : null;
		return this;
	}

	/**
	 * Set how a job's client is created from its credential. The default is a
	 * {@link GitHubHttpClient} wrapped in a {@link RateLimitWaitingGitHubClient}.
	 * @param clientFactory credential to client (null to use default)
	 * @return this builder
	 */
	public GitHubExtractorBuilder clientFactory(@Nullable Function<String, GitHubClient> clientFactory) {
		this.clientFactory = clientFactory;
		return this;
	}

	/**
	 * Set a custom audit log.
	 * @param auditLog audit log (null for a JSON-lines file at the configured path)
	 * @return this builder
	 */
	public GitHubExtractorBuilder auditLog(@Nullable AuditLog auditLog) {
		this.auditLog = auditLog;
		return this;
	}

	public GitHubExtractorBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build a JobRegistry with its supervisor.
	 * @return configured JobRegistry
	 */
	public JobRegistry buildJobRegistry() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		Function<String, GitHubClient> clients = this.clientFactory != null ? this.clientFactory
				: this::createDefaultClient;
		AuditLog audit = this.auditLog != null ? this.auditLog
				: new JsonLinesAuditLog(Path.of(properties.getAuditLogFile()), mapper);

		ExtractionTaskFactory taskFactory = new ExtractionTaskFactory(clients, mapper,
				new ScopePlanner(properties.getSearchResultCeiling()), new CsvTableWriter(), properties);
		JobSupervisor supervisor = new JobSupervisor(taskFactory, audit, clock);
		return new JobRegistry(Path.of(properties.getOutputRoot()), properties.getLogTailLimit(), audit, supervisor,
				clock);
	}

	private GitHubClient createDefaultClient(String credential) {
		return RateLimitWaitingGitHubClient.builder()
			.wrapping(new GitHubHttpClient(credential, properties))
			.buffer(Duration.ofSeconds(properties.getRateLimitBufferSeconds()))
			.build();
	}

}
