package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for submitting extraction jobs and querying their state.
 *
 * <p>
 * Submissions are validated completely before anything runs: a request with missing or
 * malformed scope fails with {@link ExtractionValidationException} and no job is
 * created. Status queries read snapshots and never wait on a running worker.
 *
 * <p>
 * Jobs are kept in memory for the lifetime of the registry; only the audit log and the
 * per-job output directories outlive it.
 */
public class JobRegistry implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

	private final Map<String, Job> jobs = new ConcurrentHashMap<>();

	private final Map<String, CompletableFuture<JobSnapshot>> completions = new ConcurrentHashMap<>();

	private final Path outputRoot;

	private final int logTailLimit;

	private final AuditLog auditLog;

	private final JobSupervisor supervisor;

	private final Clock clock;

	public JobRegistry(Path outputRoot, int logTailLimit, AuditLog auditLog, JobSupervisor supervisor, Clock clock) {
		this.outputRoot = outputRoot;
		this.logTailLimit = logTailLimit;
		this.auditLog = auditLog;
		this.supervisor = supervisor;
		this.clock = clock;
	}

	/**
	 * Validate and start a job.
	 * @param tool the extraction to run
	 * @param args scope arguments as decoded from JSON
	 * @param credential bearer credential for the GitHub API
	 * @return the new job's id
	 * @throws ExtractionValidationException if the credential or a required scope field is
	 * missing or malformed
	 */
	public String submit(ExtractorTool tool, Map<String, Object> args, @Nullable String credential) {
		String token = credential != null ? GitHubHttpClient.sanitizeToken(credential) : "";
		if (token.isEmpty()) {
			throw new ExtractionValidationException("GitHub token is required");
		}
		ExtractionRequest request = ExtractionRequest.parse(tool, args);

		String jobId = newJobId();
		Path outputDir = outputRoot.resolve(jobId);
		try {
			Files.createDirectories(outputDir);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to create output directory " + outputDir, e);
		}

		Job job = new Job(jobId, request, args, CredentialMasker.mask(token), outputDir, logTailLimit,
				clock.instant());
		auditLog.append(AuditEntry.started(job, clock.instant(), request.commandPreview(job.outputDir())));
		jobs.put(jobId, job);
		logger.info("Submitted job {} ({}) for {} repos {} with credential {}", jobId, tool.id(), request.org(),
				request.repos(), job.credentialMasked());

		completions.put(jobId, supervisor.supervise(job, token));
		return jobId;
	}

	public Optional<JobSnapshot> status(String jobId) {
		return Optional.ofNullable(jobs.get(jobId)).map(Job::snapshot);
	}

	/**
	 * Announced output file names of a job, relative to its output directory.
	 */
	public Optional<List<String>> outputs(String jobId) {
		return status(jobId).map(JobSnapshot::outputs);
	}

	/**
	 * Resolve a downloadable file. Only names the job has announced resolve.
	 */
	public Optional<Path> resolveOutput(String jobId, String fileName) {
		return Optional.ofNullable(jobs.get(jobId)).flatMap(job -> job.resolveOutput(fileName));
	}

	/**
	 * Wait up to {@code timeout} for a job to finish.
	 * @return the latest snapshot, terminal unless the timeout elapsed; empty for an
	 * unknown id
	 */
	public Optional<JobSnapshot> awaitCompletion(String jobId, Duration timeout) {
		CompletableFuture<JobSnapshot> completion = completions.get(jobId);
		if (completion == null) {
			return Optional.empty();
		}
		try {
			return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
		}
		catch (TimeoutException e) {
			return status(jobId);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return status(jobId);
		}
		catch (ExecutionException e) {
			throw new IllegalStateException("Supervision of job " + jobId + " failed", e.getCause());
		}
	}

	/**
	 * Snapshots of all known jobs, oldest first.
	 */
	public List<JobSnapshot> list() {
		return jobs.values()
			.stream()
			.map(Job::snapshot)
			.sorted(Comparator.comparing(JobSnapshot::createdAt).thenComparing(JobSnapshot::jobId))
			.toList();
	}

	public List<AuditEntry> recentAudit(int limit) {
		return auditLog.tail(limit);
	}

	@Override
	public void close() {
		supervisor.close();
	}

	static String newJobId() {
		return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
	}

}
