package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonLinesAuditLog Tests")
class JsonLinesAuditLogTest {

	@TempDir
	Path tempDir;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private static AuditEntry entry(String jobId, String status) {
		return new AuditEntry(Instant.parse("2024-05-01T12:00:00Z"), jobId, "pull-request-extractor",
				Map.of("org", "acme", "repos", "widgets"), "ghp_****MNOP", status, null, 1.5, 100, List.of("a.csv"),
				"Done.");
	}

	@Test
	@DisplayName("Should write one snake_case JSON object per line without absent fields")
	void shouldWriteJsonLines() throws Exception {
		JsonLinesAuditLog log = new JsonLinesAuditLog(tempDir.resolve("logs/audit-log.jsonl"), objectMapper);

		log.append(entry("job1", "succeeded"));

		List<String> lines = Files.readAllLines(tempDir.resolve("logs/audit-log.jsonl"));
		assertThat(lines).hasSize(1);
		JsonNode record = objectMapper.readTree(lines.get(0));
		assertThat(record.path("job_id").asText()).isEqualTo("job1");
		assertThat(record.path("token_masked").asText()).isEqualTo("ghp_****MNOP");
		assertThat(record.path("duration_sec").asDouble()).isEqualTo(1.5);
		assertThat(record.has("cmd_preview")).isFalse();
	}

	@Test
	@DisplayName("Should keep every line complete under concurrent appends")
	void shouldSerializeConcurrentAppends() throws Exception {
		JsonLinesAuditLog log = new JsonLinesAuditLog(tempDir.resolve("audit-log.jsonl"), objectMapper);
		ExecutorService executor = Executors.newFixedThreadPool(8);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<?>> futures = new ArrayList<>();
		try {
			for (int t = 0; t < 8; t++) {
				int thread = t;
				futures.add(executor.submit(() -> {
					start.await();
					for (int i = 0; i < 50; i++) {
						log.append(entry("job-" + thread + "-" + i, "started"));
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> future : futures) {
				future.get();
			}
		}
		finally {
			executor.shutdownNow();
		}

		List<String> lines = Files.readAllLines(tempDir.resolve("audit-log.jsonl"));
		assertThat(lines).hasSize(400);
		for (String line : lines) {
			assertThat(objectMapper.readTree(line).path("job_id").asText()).startsWith("job-");
		}
	}

	@Test
	@DisplayName("Should return the most recent records oldest first")
	void shouldTailRecords() {
		JsonLinesAuditLog log = new JsonLinesAuditLog(tempDir.resolve("audit-log.jsonl"), objectMapper);
		for (int i = 0; i < 5; i++) {
			log.append(entry("job" + i, "started"));
		}

		List<AuditEntry> tail = log.tail(2);

		assertThat(tail).extracting(AuditEntry::jobId).containsExactly("job3", "job4");
		assertThat(tail.get(0).args()).containsEntry("org", "acme");
	}

	@Test
	@DisplayName("Should return nothing when the file does not exist yet")
	void shouldTailMissingFile() {
		assertThat(new JsonLinesAuditLog(tempDir.resolve("none.jsonl"), objectMapper).tail(100)).isEmpty();
	}

}
