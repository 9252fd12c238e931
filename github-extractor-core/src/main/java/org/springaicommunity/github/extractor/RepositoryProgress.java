package org.springaicommunity.github.extractor;

/**
 * Maps progress within one repository onto the overall percentage of a multi-repository
 * task.
 */
public final class RepositoryProgress {

	private final EventSink sink;

	private final int index;

	private final int count;

	RepositoryProgress(EventSink sink, int index, int count) {
		this.sink = sink;
		this.index = index;
		this.count = Math.max(1, count);
	}

	/**
	 * @param repositoryPercent completion of the current repository, 0 to 100
	 */
	public void report(int repositoryPercent, String message) {
		int clamped = Math.max(0, Math.min(100, repositoryPercent));
		sink.progress((index * 100 + clamped) / count, message);
	}

	/**
	 * {@code base + span * done / total}, with an empty total counted as one.
	 */
	public static int scaled(int base, int span, int done, int total) {
		return base + span * done / Math.max(1, total);
	}

}
