package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * {@link Worker} that runs its task on a thread of the given executor.
 *
 * <p>
 * Events are handed over through an unbounded queue so the task never blocks on its
 * reader. An exception escaping the task is turned into a final {@code "Error: ..."} log
 * line and exit code {@link ExtractionTask#EXIT_FAILURE}; an {@link Error} is rethrown on
 * the worker thread once the event stream is closed.
 */
public final class ThreadWorker implements Worker {

	private static final Logger logger = LoggerFactory.getLogger(ThreadWorker.class);

	private static final WorkerEvent END_OF_STREAM = WorkerEvent.logLine("<end-of-stream>");

	private final String name;

	private final ExtractionTask task;

	private final BlockingQueue<WorkerEvent> queue = new LinkedBlockingQueue<>();

	private final CompletableFuture<WorkerExit> exit = new CompletableFuture<>();

	private ThreadWorker(String name, ExtractionTask task) {
		this.name = name;
		this.task = task;
	}

	/**
	 * Start {@code task} on {@code executor}.
	 * @param name used in log output
	 */
	public static ThreadWorker start(String name, ExtractionTask task, Executor executor) {
		ThreadWorker worker = new ThreadWorker(name, task);
		executor.execute(worker::run);
		return worker;
	}

	@Override
	public Iterator<WorkerEvent> events() {
		return new Iterator<>() {

			private @Nullable WorkerEvent next;

			private boolean ended;

			@Override
			public boolean hasNext() {
				if (next == null && !ended) {
					try {
						WorkerEvent event = queue.take();
						if (event == END_OF_STREAM) {
							ended = true;
						}
						else {
							next = event;
						}
					}
					catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						throw new IllegalStateException("Interrupted while reading events of worker " + name, e);
					}
				}
				return next != null;
			}

			@Override
			public WorkerEvent next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				WorkerEvent result = next;
				next = null;
				return result;
			}

		};
	}

	@Override
	public WorkerExit awaitExit() throws InterruptedException {
		try {
			return exit.get();
		}
		catch (ExecutionException e) {
			return new WorkerExit(ExtractionTask.EXIT_FAILURE, e.getCause());
		}
	}

	private void run() {
		logger.debug("Worker {} started", name);
		Error error = null;
		try {
			int code = task.run(new QueueSink());
			exit.complete(new WorkerExit(code, null));
			logger.debug("Worker {} exited with code {}", name, code);
		}
		catch (Throwable t) {
			logger.error("Worker {} failed", name, t);
			queue.add(WorkerEvent.logLine("Error: " + describe(t)));
			exit.complete(new WorkerExit(ExtractionTask.EXIT_FAILURE, t));
			if (t instanceof Error e) {
				error = e;
			}
		}
		finally {
			if (!exit.isDone()) {
				exit.complete(new WorkerExit(ExtractionTask.EXIT_FAILURE, null));
			}
			queue.add(END_OF_STREAM);
		}
		// only after the end-of-stream marker
		if (error != null) {
			throw error;
		}
	}

	private static String describe(Throwable t) {
		return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
	}

	private final class QueueSink implements EventSink {

		@Override
		public void progress(int percent, String message) {
			queue.add(WorkerEvent.progress(percent, message));
		}

		@Override
		public void outputAnnounced(Path file) {
			queue.add(WorkerEvent.outputAnnounced(file.toString()));
		}

		@Override
		public void log(String line) {
			logger.info("[{}] {}", name, line);
			queue.add(WorkerEvent.logLine(line));
		}

	}

}
