package org.springaicommunity.github.extractor;

import java.util.Iterator;

/**
 * An isolated execution of one {@link ExtractionTask}.
 *
 * <p>
 * {@link #events()} is a lazy, finite sequence: {@code hasNext()} blocks until the task
 * emits the next event or terminates. After the sequence ends, {@link #awaitExit()}
 * returns the terminal signal. The sequence ends on every exit path, including a crash.
 */
public interface Worker {

	/**
	 * The worker's event stream. Single consumer.
	 */
	Iterator<WorkerEvent> events();

	/**
	 * Block until the task has terminated.
	 * @return exit code and escaping fault, if any
	 */
	WorkerExit awaitExit() throws InterruptedException;

}
