package org.springaicommunity.github.extractor;

/**
 * A unit of extraction work run by a {@link Worker}.
 */
@FunctionalInterface
public interface ExtractionTask {

	int EXIT_SUCCESS = 0;

	int EXIT_FAILURE = 1;

	/**
	 * Some repositories failed; outputs of the others were written and announced.
	 */
	int EXIT_PARTIAL = 2;

	/**
	 * Run the task to completion, reporting through {@code sink}.
	 * @return process-style exit code, {@link #EXIT_SUCCESS} on success
	 * @throws Exception any fault; the worker reports it as a failed exit
	 */
	int run(EventSink sink) throws Exception;

}
