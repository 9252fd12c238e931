package org.springaicommunity.github.extractor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExtractionRequest Tests")
class ExtractionRequestTest {

	@Nested
	@DisplayName("Pull request arguments")
	class PullRequestArgsTest {

		@Test
		@DisplayName("Should apply closed and merged-only defaults")
		void shouldApplyDefaults() {
			ExtractionRequest request = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets"));

			assertThat(request).isInstanceOfSatisfying(PullRequestExtractionRequest.class, pr -> {
				assertThat(pr.filter().state()).isEqualTo("closed");
				assertThat(pr.filter().mergedOnly()).isTrue();
				assertThat(pr.filter().window().isUnbounded()).isTrue();
			});
		}

		@Test
		@DisplayName("Should split repositories on commas and spaces")
		void shouldSplitRepositories() {
			ExtractionRequest request = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", " widgets, gadgets  gizmos,"));

			assertThat(request.repos()).containsExactly("widgets", "gadgets", "gizmos");
		}

		@Test
		@DisplayName("Should accept repositories as a list and merged_only as a string")
		void shouldAcceptListAndStringFlag() {
			PullRequestExtractionRequest request = (PullRequestExtractionRequest) ExtractionRequest.parse(
					ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", List.of("widgets", "gadgets"), "merged_only", "false"));

			assertThat(request.repos()).containsExactly("widgets", "gadgets");
			assertThat(request.filter().mergedOnly()).isFalse();
		}

		@Test
		@DisplayName("Should reject an unknown state")
		void shouldRejectUnknownState() {
			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets", "state", "merged")))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessageContaining("Invalid state: merged");
		}

		@Test
		@DisplayName("Should require org and repos")
		void shouldRequireScope() {
			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("repos", "widgets")))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessage("'org' is required");
			assertThatThrownBy(
					() -> ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR, Map.of("org", "acme", "repos", " ,")))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessage("'repos' is required");
		}

		@Test
		@DisplayName("Should reject owner and repository names that are not GitHub names")
		void shouldRejectPathLikeNames() {
			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets ../escape")))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessage("Invalid name in 'repos': ../escape");
			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", List.of("acme/widgets"))))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessage("Invalid name in 'repos': acme/widgets");
			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.FILE_COMMIT_HISTORY,
					Map.of("org", "..", "repos", "widgets", "file_path", "README.md")))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessage("Invalid name in 'org': ..");
			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", ".")))
				.isInstanceOf(ExtractionValidationException.class);
		}

		@Test
		@DisplayName("Should accept dots, dashes and underscores inside names")
		void shouldAcceptGitHubNames() {
			ExtractionRequest request = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme-labs", "repos", "my.repo_1 .github"));

			assertThat(request.org()).isEqualTo("acme-labs");
			assertThat(request.repos()).containsExactly("my.repo_1", ".github");
		}

		@Test
		@DisplayName("Should carry the verbose flag into the command preview and the parameters")
		void shouldCarryVerbose() {
			ExtractionRequest quiet = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets"));
			ExtractionRequest verbose = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets", "verbose", true));

			assertThat(quiet.verbose()).isFalse();
			assertThat(quiet.commandPreview(Path.of("out"))).doesNotContain("--verbose");
			assertThat(verbose.verbose()).isTrue();
			assertThat(verbose.commandPreview(Path.of("out"))).contains("--verbose");
			assertThat(verbose.params()).containsEntry("org", "acme")
				.containsEntry("repos", List.of("widgets"))
				.containsEntry("state", "closed")
				.containsEntry("merged_only", true)
				.containsEntry("since", null);
		}

		@Test
		@DisplayName("Should redact the credential in the command preview")
		void shouldRedactCommandPreview() {
			ExtractionRequest request = ExtractionRequest.parse(ExtractorTool.PULL_REQUEST_EXTRACTOR,
					Map.of("org", "acme", "repos", "widgets gadgets", "since", "2024-01-01"));

			List<String> preview = request.commandPreview(Path.of("output", "abc"));

			assertThat(preview).startsWith("pull-request-extractor", "--output-dir")
				.containsSubsequence("--repos", "widgets", "gadgets")
				.containsSubsequence("--since", "2024-01-01T00:00:00Z")
				.contains("--merged-only")
				.endsWith("--token", "[TOKEN]");
		}

	}

	@Nested
	@DisplayName("File history arguments")
	class FileHistoryArgsTest {

		@Test
		@DisplayName("Should require a file path")
		void shouldRequireFilePath() {
			Map<String, Object> args = new HashMap<>();
			args.put("org", "acme");
			args.put("repos", "widgets");
			args.put("file_path", null);

			assertThatThrownBy(() -> ExtractionRequest.parse(ExtractorTool.FILE_COMMIT_HISTORY, args))
				.isInstanceOf(ExtractionValidationException.class)
				.hasMessage("'file_path' is required");
		}

		@Test
		@DisplayName("Should derive the output file name from the path")
		void shouldDeriveOutputFileName() {
			FileHistoryExtractionRequest request = (FileHistoryExtractionRequest) ExtractionRequest
				.parse(ExtractorTool.FILE_COMMIT_HISTORY, Map.of("org", "acme", "repos", "widgets", "file_path",
						"/src/main/App.java", "sha", "release"));

			assertThat(request.outputFileName("widgets")).isEqualTo("widgets-src-main-App.java-file-history.csv");
			assertThat(request.sha()).isEqualTo("release");
		}

	}

	@Test
	@DisplayName("Should resolve tool ids and aliases and reject unknown ones")
	void shouldResolveToolIds() {
		assertThat(ExtractorTool.fromId("pull-request-extractor")).isEqualTo(ExtractorTool.PULL_REQUEST_EXTRACTOR);
		assertThat(ExtractorTool.fromId("file-history-extractor")).isEqualTo(ExtractorTool.FILE_COMMIT_HISTORY);
		assertThatThrownBy(() -> ExtractorTool.fromId("issue-extractor"))
			.isInstanceOf(ExtractionValidationException.class)
			.hasMessage("Invalid 'type'");
	}

}
