package org.springaicommunity.github.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each job on its own worker and applies the worker's events to the job as they
 * arrive.
 *
 * <p>
 * Every job gets a supervising thread and a worker thread from an unbounded cached pool;
 * there is no limit on concurrently running jobs. A fault in one job, including one in
 * its supervising thread, fails only that job.
 */
public class JobSupervisor implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JobSupervisor.class);

	private final ExtractionTaskFactory taskFactory;

	private final AuditLog auditLog;

	private final Clock clock;

	private final ExecutorService executor;

	public JobSupervisor(ExtractionTaskFactory taskFactory, AuditLog auditLog, Clock clock) {
		this.taskFactory = taskFactory;
		this.auditLog = auditLog;
		this.clock = clock;
		this.executor = Executors.newCachedThreadPool(new JobThreadFactory());
	}

	/**
	 * Start supervising {@code job}.
	 * @param credential raw credential, handed to the job's client only
	 * @return completes with the terminal snapshot once the end audit record is written
	 */
	public CompletableFuture<JobSnapshot> supervise(Job job, String credential) {
		CompletableFuture<JobSnapshot> completion = new CompletableFuture<>();
		executor.execute(() -> {
			try {
				runJob(job, credential);
			}
			finally {
				completion.complete(job.snapshot());
			}
		});
		return completion;
	}

	void runJob(Job job, String credential) {
		job.markRunning(clock.instant());
		logger.info("Job {} ({}) started", job.id(), job.tool().id());
		try {
			ExtractionTask task = taskFactory.create(job.request(), credential, job.outputDir());
			Worker worker = ThreadWorker.start("job-" + job.id(), task, executor);

			Iterator<WorkerEvent> events = worker.events();
			while (events.hasNext()) {
				apply(job, events.next());
			}

			WorkerExit exit = worker.awaitExit();
			if (exit.isSuccess()) {
				job.succeed(clock.instant());
				logger.info("Job {} succeeded with {} outputs", job.id(), job.snapshot().outputs().size());
			}
			else {
				job.fail("Exited with code " + exit.exitCode(), clock.instant());
				logger.error("Job {} failed with exit code {}: {}", job.id(), exit.exitCode(), job.snapshot().message());
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			failFromSupervisor(job, e);
		}
		catch (RuntimeException e) {
			failFromSupervisor(job, e);
		}
		finally {
			writeEndRecord(job);
		}
	}

	private void apply(Job job, WorkerEvent event) {
		switch (event.kind()) {
			case PROGRESS -> job.applyProgress(event.percent(), event.payload());
			case OUTPUT_ANNOUNCED -> {
				if (!job.announceOutput(Path.of(event.payload()))) {
					logger.warn("Job {} announced {} which is not a file in {}", job.id(), event.payload(),
							job.outputDir());
				}
			}
			case LOG_LINE -> job.appendLog(event.payload());
		}
	}

	private void failFromSupervisor(Job job, Exception e) {
		logger.error("Supervision of job {} failed", job.id(), e);
		if (!job.status().isTerminal()) {
			job.appendLog("Error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
			job.fail("Supervisor error", clock.instant());
		}
	}

	private void writeEndRecord(Job job) {
		try {
			auditLog.append(AuditEntry.finished(job, job.snapshot(), clock.instant()));
		}
		catch (RuntimeException e) {
			logger.error("Failed to write end audit record for job {}", job.id(), e);
		}
	}

	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.warn("Jobs still running at shutdown; they are abandoned");
				executor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			executor.shutdownNow();
		}
	}

	private static final class JobThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "extractor-job-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
