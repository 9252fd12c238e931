package org.springaicommunity.github.extractor.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.github.extractor.AuditEntry;
import org.springaicommunity.github.extractor.ExtractionValidationException;
import org.springaicommunity.github.extractor.ExtractorTool;
import org.springaicommunity.github.extractor.JobRegistry;
import org.springaicommunity.github.extractor.JobSnapshot;
import org.springaicommunity.github.extractor.JobStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExtractionController.class)
@DisplayName("ExtractionController Tests")
class ExtractionControllerTest {

	private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

	@Autowired
	private MockMvc mockMvc;

	@MockBean
	private JobRegistry jobRegistry;

	private static JobSnapshot runningSnapshot() {
		return new JobSnapshot("0123456789ab", ExtractorTool.PULL_REQUEST_EXTRACTOR, JobStatus.RUNNING, 40,
				"widgets: processing 2/5", List.of("[widgets] fetching PRs..."), List.of("widgets-pull-requests.csv"),
				T0, T0, null);
	}

	@Nested
	@DisplayName("POST /api/extract")
	class ExtractTest {

		@Test
		@DisplayName("Should submit the job and return its id")
		void shouldSubmitJob() throws Exception {
			when(jobRegistry.submit(eq(ExtractorTool.PULL_REQUEST_EXTRACTOR), anyMap(), eq("ghp_ABCDEFGHIJKLMNOP")))
				.thenReturn("0123456789ab");

			mockMvc
				.perform(post("/api/extract").contentType(MediaType.APPLICATION_JSON)
					.content("{\"type\":\"pull-request-extractor\",\"token\":\"ghp_ABCDEFGHIJKLMNOP\","
							+ "\"args\":{\"org\":\"acme\",\"repos\":\"widgets\",\"merged_only\":true}}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.job_id").value("0123456789ab"));

			verify(jobRegistry).submit(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets", "merged_only", true), "ghp_ABCDEFGHIJKLMNOP");
		}

		@Test
		@DisplayName("Should reject an unknown tool type with 400")
		void shouldRejectUnknownType() throws Exception {
			mockMvc
				.perform(post("/api/extract").contentType(MediaType.APPLICATION_JSON)
					.content("{\"type\":\"issue-extractor\",\"token\":\"t\",\"args\":{}}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.error").value("Invalid 'type'"));

			verifyNoInteractions(jobRegistry);
		}

		@Test
		@DisplayName("Should map validation failures to 400")
		void shouldMapValidationFailure() throws Exception {
			when(jobRegistry.submit(any(), anyMap(), any()))
				.thenThrow(new ExtractionValidationException("'file_path' is required"));

			mockMvc
				.perform(post("/api/extract").contentType(MediaType.APPLICATION_JSON)
					.content("{\"type\":\"file-commit-history\",\"token\":\"t\",\"args\":{\"org\":\"acme\"}}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.error").value("'file_path' is required"));
		}

	}

	@Nested
	@DisplayName("Job queries")
	class QueryTest {

		@Test
		@DisplayName("Should return the status snapshot of a known job")
		void shouldReturnStatus() throws Exception {
			when(jobRegistry.status("0123456789ab")).thenReturn(Optional.of(runningSnapshot()));

			mockMvc.perform(get("/api/status/0123456789ab"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.job_id").value("0123456789ab"))
				.andExpect(jsonPath("$.tool").value("pull-request-extractor"))
				.andExpect(jsonPath("$.status").value("running"))
				.andExpect(jsonPath("$.progress").value(40))
				.andExpect(jsonPath("$.message").value("widgets: processing 2/5"))
				.andExpect(jsonPath("$.log[0]").value("[widgets] fetching PRs..."))
				.andExpect(jsonPath("$.outputs[0]").value("widgets-pull-requests.csv"));
		}

		@Test
		@DisplayName("Should return 404 for an unknown job")
		void shouldReturnNotFound() throws Exception {
			when(jobRegistry.status("missing")).thenReturn(Optional.empty());
			when(jobRegistry.outputs("missing")).thenReturn(Optional.empty());

			mockMvc.perform(get("/api/status/missing"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.error").value("Unknown job_id"));
			mockMvc.perform(get("/api/outputs/missing")).andExpect(status().isNotFound());
		}

		@Test
		@DisplayName("Should list announced outputs")
		void shouldListOutputs() throws Exception {
			when(jobRegistry.outputs("0123456789ab")).thenReturn(Optional.of(List.of("widgets-pull-requests.csv")));

			mockMvc.perform(get("/api/outputs/0123456789ab"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0]").value("widgets-pull-requests.csv"));
		}

		@Test
		@DisplayName("Should return the most recent audit records")
		void shouldReturnAudit() throws Exception {
			when(jobRegistry.recentAudit(ExtractionController.AUDIT_LIMIT)).thenReturn(List.of(new AuditEntry(T0,
					"0123456789ab", "pull-request-extractor", Map.of("org", "acme"), "ghp_****MNOP", "started",
					List.of("pull-request-extractor", "--token", "[TOKEN]"), null, null, null, null)));

			mockMvc.perform(get("/api/audit"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].job_id").value("0123456789ab"))
				.andExpect(jsonPath("$[0].token_masked").value("ghp_****MNOP"))
				.andExpect(jsonPath("$[0].cmd_preview[2]").value("[TOKEN]"))
				.andExpect(jsonPath("$[0].last_message").doesNotExist());
		}

	}

	@Nested
	@DisplayName("GET /api/download")
	class DownloadTest {

		@Test
		@DisplayName("Should serve an announced file as an attachment")
		void shouldServeAnnouncedFile(@TempDir Path tempDir) throws Exception {
			Path csv = Files.writeString(tempDir.resolve("widgets-pull-requests.csv"), "number,title\n1,One\n");
			when(jobRegistry.status("0123456789ab")).thenReturn(Optional.of(runningSnapshot()));
			when(jobRegistry.resolveOutput("0123456789ab", "widgets-pull-requests.csv")).thenReturn(Optional.of(csv));

			mockMvc.perform(get("/api/download/0123456789ab/widgets-pull-requests.csv"))
				.andExpect(status().isOk())
				.andExpect(header().string("Content-Disposition",
						"attachment; filename=\"widgets-pull-requests.csv\""))
				.andExpect(content().string("number,title\n1,One\n"));
		}

		@Test
		@DisplayName("Should return 404 for a file that was never announced")
		void shouldRefuseUnannouncedFile() throws Exception {
			when(jobRegistry.status("0123456789ab")).thenReturn(Optional.of(runningSnapshot()));
			when(jobRegistry.resolveOutput("0123456789ab", "stray.csv")).thenReturn(Optional.empty());

			mockMvc.perform(get("/api/download/0123456789ab/stray.csv"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.error").value("File not found"));
		}

	}

}
