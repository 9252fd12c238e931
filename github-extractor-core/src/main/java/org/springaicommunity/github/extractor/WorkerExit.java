package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Terminal signal of a worker.
 *
 * @param exitCode 0 on success
 * @param fault the exception that escaped the task, if any
 */
public record WorkerExit(int exitCode, @Nullable Throwable fault) {

	public boolean isSuccess() {
		return exitCode == ExtractionTask.EXIT_SUCCESS && fault == null;
	}

}
