package org.springaicommunity.github.extractor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Job Tests")
class JobTest {

	private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

	@TempDir
	Path outputDir;

	private Job job;

	@BeforeEach
	void setUp() {
		ExtractionRequest request = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
				Map.of("org", "acme", "repos", "widgets"));
		job = new Job("0123456789ab", request, Map.of("org", "acme", "repos", "widgets"), "ghp_****MNOP", outputDir,
				3, T0);
	}

	@Nested
	@DisplayName("Status transitions")
	class TransitionTest {

		@Test
		@DisplayName("Should start queued and succeed with progress 100")
		void shouldSucceed() {
			assertThat(job.snapshot().status()).isEqualTo(JobStatus.QUEUED);

			job.markRunning(T0);
			job.applyProgress(40, "halfway");
			job.succeed(T0.plusSeconds(5));

			JobSnapshot snapshot = job.snapshot();
			assertThat(snapshot.status()).isEqualTo(JobStatus.SUCCEEDED);
			assertThat(snapshot.progress()).isEqualTo(100);
			assertThat(snapshot.message()).isEqualTo("Done.");
			assertThat(snapshot.duration(T0.plusSeconds(60))).hasSeconds(5);
		}

		@Test
		@DisplayName("Should refuse to skip or reverse a transition")
		void shouldRejectInvalidTransitions() {
			assertThatThrownBy(() -> job.succeed(T0)).isInstanceOf(IllegalStateException.class);

			job.markRunning(T0);
			job.fail("Exited with code 1", T0);

			assertThatThrownBy(() -> job.markRunning(T0)).isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> job.succeed(T0)).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should take the failure message from the last log line")
		void shouldUseLastLogLineOnFailure() {
			job.markRunning(T0);
			job.appendLog("[widgets] fetching PRs...");
			job.appendLog("Error: boom");
			job.fail("Exited with code 1", T0);

			assertThat(job.snapshot().message()).isEqualTo("Error: boom");
		}

		@Test
		@DisplayName("Should fall back to the given message when nothing was logged")
		void shouldUseFallbackWithoutLog() {
			job.markRunning(T0);
			job.fail("Exited with code 2", T0);

			assertThat(job.snapshot().message()).isEqualTo("Exited with code 2");
		}

	}

	@Test
	@DisplayName("Should clamp progress and never lower it")
	void shouldKeepProgressMonotonic() {
		job.markRunning(T0);
		job.applyProgress(60, "a");
		job.applyProgress(30, "b");
		job.applyProgress(250, "");

		JobSnapshot snapshot = job.snapshot();
		assertThat(snapshot.progress()).isEqualTo(100);
		assertThat(snapshot.message()).isEqualTo("b");
	}

	@Test
	@DisplayName("Should keep only the most recent log lines")
	void shouldBoundLogTail() {
		for (int i = 1; i <= 5; i++) {
			job.appendLog("line " + i);
		}
		job.appendLog("  ");

		assertThat(job.snapshot().log()).containsExactly("line 3", "line 4", "line 5");
	}

	@Nested
	@DisplayName("Outputs")
	class OutputTest {

		@Test
		@DisplayName("Should record announced files relative to the output directory, once each")
		void shouldRecordOutputs() throws Exception {
			Path csv = Files.writeString(outputDir.resolve("widgets-pull-requests.csv"), "number\n");

			assertThat(job.announceOutput(csv)).isTrue();
			assertThat(job.announceOutput(csv)).isTrue();

			assertThat(job.snapshot().outputs()).containsExactly("widgets-pull-requests.csv");
			assertThat(job.resolveOutput("widgets-pull-requests.csv")).contains(csv.toAbsolutePath().normalize());
		}

		@Test
		@DisplayName("Should ignore files outside the output directory or not yet written")
		void shouldRejectForeignFiles(@TempDir Path elsewhere) throws Exception {
			Path foreign = Files.writeString(elsewhere.resolve("secrets.csv"), "x");

			assertThat(job.announceOutput(foreign)).isFalse();
			assertThat(job.announceOutput(outputDir.resolve("missing.csv"))).isFalse();
			assertThat(job.snapshot().outputs()).isEmpty();
		}

		@Test
		@DisplayName("Should not resolve names that were never announced")
		void shouldRefuseUnannouncedNames() throws Exception {
			Files.writeString(outputDir.resolve("unannounced.csv"), "x");

			assertThat(job.resolveOutput("unannounced.csv")).isEmpty();
			assertThat(job.resolveOutput("../etc/passwd")).isEmpty();
		}

	}

}
