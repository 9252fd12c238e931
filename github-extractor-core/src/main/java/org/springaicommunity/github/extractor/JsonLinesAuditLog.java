package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link AuditLog} backed by a JSON-lines file: one record per line, appended under a
 * lock so concurrent writers never interleave partial records.
 */
public class JsonLinesAuditLog implements AuditLog {

	private static final Logger logger = LoggerFactory.getLogger(JsonLinesAuditLog.class);

	private final Path file;

	private final ObjectMapper objectMapper;

	private final ReentrantLock lock = new ReentrantLock();

	public JsonLinesAuditLog(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
	}

	public Path file() {
		return file;
	}

	@Override
	public void append(AuditEntry entry) {
		String line;
		try {
			line = objectMapper.writeValueAsString(entry) + "\n";
		}
		catch (JsonProcessingException e) {
			throw new RuntimeException("Failed to serialize audit record for job " + entry.jobId(), e);
		}

		lock.lock();
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
			logger.debug("Audit {} record for job {}", entry.status(), entry.jobId());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to append audit record to " + file, e);
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public List<AuditEntry> tail(int limit) {
		if (limit <= 0) {
			return List.of();
		}
		List<String> lines;
		lock.lock();
		try {
			if (!Files.exists(file)) {
				return List.of();
			}
			lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read audit log " + file, e);
		}
		finally {
			lock.unlock();
		}

		List<AuditEntry> entries = new ArrayList<>();
		for (String line : lines) {
			if (line.isBlank()) {
				continue;
			}
			try {
				entries.add(objectMapper.readValue(line, AuditEntry.class));
			}
			catch (JsonProcessingException e) {
				logger.warn("Skipping malformed audit line in {}: {}", file, e.getOriginalMessage());
			}
		}
		return entries.size() <= limit ? entries : List.copyOf(entries.subList(entries.size() - limit, entries.size()));
	}

}
