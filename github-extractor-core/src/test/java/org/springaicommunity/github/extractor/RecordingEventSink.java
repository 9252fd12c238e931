package org.springaicommunity.github.extractor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link EventSink} that keeps every event for assertions.
 */
class RecordingEventSink implements EventSink {

	final List<Integer> percents = new ArrayList<>();

	final List<Path> outputs = new ArrayList<>();

	final List<String> lines = new ArrayList<>();

	@Override
	public void progress(int percent, String message) {
		percents.add(percent);
	}

	@Override
	public void outputAnnounced(Path file) {
		outputs.add(file);
	}

	@Override
	public void log(String line) {
		lines.add(line);
	}

}
