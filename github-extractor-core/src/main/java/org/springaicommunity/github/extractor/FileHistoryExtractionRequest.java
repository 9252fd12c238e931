package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scope of a per-file commit history extraction.
 *
 * @param org organization or user owning the repositories
 * @param repos repository names, processed in order
 * @param filePath repository-relative path of the tracked file
 * @param window commit date window, applied server-side
 * @param sha branch or commit to start listing from, or null for the default branch
 * @param verbose echo every API request into the job's log
 */
public record FileHistoryExtractionRequest(String org, List<String> repos, String filePath,
		ExtractionWindow window, @Nullable String sha, boolean verbose) implements ExtractionRequest {

	public FileHistoryExtractionRequest {
		repos = List.copyOf(repos);
		if (filePath.isBlank()) {
			throw new ExtractionValidationException("'file_path' is required");
		}
	}

	static FileHistoryExtractionRequest from(Map<String, ?> values) {
		ExtractionArgs args = new ExtractionArgs(values);
		String org = args.name("org");
		List<String> repos = args.repositories("repos");
		String filePath = args.required("file_path");
		ExtractionWindow window = ExtractionWindow.parse(args.optional("since"), args.optional("until"));
		return new FileHistoryExtractionRequest(org, repos, filePath, window, args.optional("sha"),
				args.flag("verbose", false));
	}

	@Override
	public ExtractorTool tool() {
		return ExtractorTool.FILE_COMMIT_HISTORY;
	}

	/**
	 * Name of the CSV written for {@code repo}: the path with its slashes turned into
	 * dashes.
	 */
	public String outputFileName(String repo) {
		String suffix = filePath.replaceAll("^/+|/+$", "").replace('/', '-');
		return repo + "-" + suffix + "-file-history.csv";
	}

	@Override
	public Map<String, @Nullable Object> params() {
		Map<String, @Nullable Object> params = new LinkedHashMap<>();
		params.put("org", org);
		params.put("repos", repos);
		params.put("file_path", filePath);
		params.put("since", window.sinceParam());
		params.put("until", window.untilParam());
		params.put("sha", sha);
		return params;
	}

	@Override
	public List<String> commandPreview(Path outputDir) {
		List<String> command = new ArrayList<>(List.of(tool().id(), "--output-dir", outputDir.toString(), "--org", org,
				"--repos"));
		command.addAll(repos);
		command.add("--file-path");
		command.add(filePath);
		if (window.since() != null) {
			command.add("--since");
			command.add(window.sinceParam());
		}
		if (window.until() != null) {
			command.add("--until");
			command.add(window.untilParam());
		}
		if (sha != null) {
			command.add("--sha");
			command.add(sha);
		}
		if (verbose) {
			command.add("--verbose");
		}
		command.add("--token");
		command.add("[TOKEN]");
		return command;
	}

}
