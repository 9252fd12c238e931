package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One submitted extraction and its mutable progress state.
 *
 * <p>
 * Identity, scope and output directory are fixed at construction. Status, progress,
 * message, log tail and outputs are guarded by the job's monitor: the supervisor thread
 * writes them while status queries take {@link #snapshot() snapshots}.
 */
public final class Job {

	private final String id;

	private final ExtractionRequest request;

	private final Map<String, Object> args;

	private final String credentialMasked;

	private final Path outputDir;

	private final int logTailLimit;

	private final Instant createdAt;

	private JobStatus status = JobStatus.QUEUED;

	private int progress;

	private String message = "Queued";

	private final Deque<String> log = new ArrayDeque<>();

	private final Set<String> outputFiles = new LinkedHashSet<>();

	@Nullable
	private Instant startedAt;

	@Nullable
	private Instant endedAt;

	public Job(String id, ExtractionRequest request, Map<String, Object> args, String credentialMasked,
			Path outputDir, int logTailLimit, Instant createdAt) {
		if (logTailLimit <= 0) {
			throw new IllegalArgumentException("logTailLimit must be positive, got: " + logTailLimit);
		}
		this.id = id;
		this.request = request;
		this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
		this.credentialMasked = credentialMasked;
		this.outputDir = outputDir.toAbsolutePath().normalize();
		this.logTailLimit = logTailLimit;
		this.createdAt = createdAt;
	}

	public String id() {
		return id;
	}

	public ExtractorTool tool() {
		return request.tool();
	}

	public ExtractionRequest request() {
		return request;
	}

	/**
	 * The arguments as submitted, for audit records.
	 */
	public Map<String, Object> args() {
		return args;
	}

	public String credentialMasked() {
		return credentialMasked;
	}

	public Path outputDir() {
		return outputDir;
	}

	public synchronized void markRunning(Instant now) {
		requireStatus(JobStatus.QUEUED, JobStatus.RUNNING);
		status = JobStatus.RUNNING;
		startedAt = now;
		progress = Math.max(progress, 1);
		message = "Starting...";
	}

	/**
	 * Record reported progress. The value is clamped to 0..100 and never lowers the
	 * current progress. A blank message keeps the current one.
	 */
	public synchronized void applyProgress(int percent, @Nullable String newMessage) {
		int clamped = Math.max(0, Math.min(100, percent));
		progress = Math.max(progress, clamped);
		if (newMessage != null && !newMessage.isBlank()) {
			message = newMessage;
		}
	}

	/**
	 * Append a worker log line, dropping the oldest lines beyond the tail limit. Blank
	 * lines are ignored.
	 */
	public synchronized void appendLog(String line) {
		if (line.isBlank()) {
			return;
		}
		log.addLast(line);
		while (log.size() > logTailLimit) {
			log.removeFirst();
		}
	}

	/**
	 * Record an announced output. Only existing regular files inside the job's output
	 * directory are accepted; they are stored relative to that directory.
	 * @return whether the file was accepted
	 */
	public synchronized boolean announceOutput(Path file) {
		Path absolute = (file.isAbsolute() ? file : outputDir.resolve(file)).normalize();
		if (!absolute.startsWith(outputDir) || !Files.isRegularFile(absolute)) {
			return false;
		}
		outputFiles.add(outputDir.relativize(absolute).toString().replace('\\', '/'));
		return true;
	}

	public synchronized void succeed(Instant now) {
		requireStatus(JobStatus.RUNNING, JobStatus.SUCCEEDED);
		status = JobStatus.SUCCEEDED;
		progress = 100;
		message = "Done.";
		endedAt = now;
	}

	/**
	 * Mark the job failed. The message becomes the last captured log line, or
	 * {@code fallbackMessage} when nothing was logged.
	 */
	public synchronized void fail(String fallbackMessage, Instant now) {
		requireStatus(JobStatus.RUNNING, JobStatus.FAILED);
		status = JobStatus.FAILED;
		message = log.isEmpty() ? fallbackMessage : log.getLast();
		endedAt = now;
	}

	public synchronized JobStatus status() {
		return status;
	}

	/**
	 * Resolve an announced output name to its file. Names that were never announced
	 * resolve to nothing.
	 */
	public synchronized Optional<Path> resolveOutput(String fileName) {
		if (!outputFiles.contains(fileName)) {
			return Optional.empty();
		}
		Path resolved = outputDir.resolve(fileName).normalize();
		return resolved.startsWith(outputDir) ? Optional.of(resolved) : Optional.empty();
	}

	public synchronized JobSnapshot snapshot() {
		return new JobSnapshot(id, request.tool(), status, progress, message, new ArrayList<>(log),
				List.copyOf(outputFiles), createdAt, startedAt, endedAt);
	}

	private void requireStatus(JobStatus expected, JobStatus target) {
		if (status != expected) {
			throw new IllegalStateException(
					"Job " + id + " cannot move from " + status + " to " + target + " (expected " + expected + ")");
		}
	}

}
