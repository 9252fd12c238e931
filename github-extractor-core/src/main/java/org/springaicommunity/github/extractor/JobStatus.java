package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a {@link Job}. The only transitions are {@code QUEUED -> RUNNING}
 * and {@code RUNNING -> SUCCEEDED | FAILED}.
 */
public enum JobStatus {

	QUEUED, RUNNING, SUCCEEDED, FAILED;

	public boolean isTerminal() {
		return this == SUCCEEDED || this == FAILED;
	}

	@JsonValue
	public String wireValue() {
		return name().toLowerCase(Locale.ROOT);
	}

}
