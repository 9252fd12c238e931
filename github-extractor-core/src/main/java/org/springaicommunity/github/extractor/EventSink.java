package org.springaicommunity.github.extractor;

import java.nio.file.Path;

/**
 * Receiver for the events an {@link ExtractionTask} produces.
 */
public interface EventSink {

	void progress(int percent, String message);

	/**
	 * Announce a deliverable. Call only once the file is completely written.
	 */
	void outputAnnounced(Path file);

	void log(String line);

}
