package org.springaicommunity.github.extractor;

/**
 * One event emitted by a running extraction task.
 *
 * @param kind what the event reports
 * @param percent progress percentage, meaningful for {@link Kind#PROGRESS} only
 * @param payload progress message, announced file path, or log line
 */
public record WorkerEvent(Kind kind, int percent, String payload) {

	public enum Kind {

		PROGRESS,

		/**
		 * A deliverable file is completely written and safe to expose.
		 */
		OUTPUT_ANNOUNCED,

		LOG_LINE

	}

	public static WorkerEvent progress(int percent, String message) {
		return new WorkerEvent(Kind.PROGRESS, percent, message);
	}

	public static WorkerEvent outputAnnounced(String path) {
		return new WorkerEvent(Kind.OUTPUT_ANNOUNCED, 0, path);
	}

	public static WorkerEvent logLine(String line) {
		return new WorkerEvent(Kind.LOG_LINE, 0, line);
	}

}
