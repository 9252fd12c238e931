package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scope of a pull request extraction.
 *
 * @param org organization or user owning the repositories
 * @param repos repository names, processed in order
 * @param filter state, merged-only flag and merge window
 * @param verbose echo every API request into the job's log
 */
public record PullRequestExtractionRequest(String org, List<String> repos, PullRequestFilter filter,
		boolean verbose) implements ExtractionRequest {

	public static final String DEFAULT_STATE = "closed";

	private static final Set<String> STATES = Set.of("open", "closed", "all");

	public PullRequestExtractionRequest {
		repos = List.copyOf(repos);
		if (!STATES.contains(filter.state())) {
			throw new ExtractionValidationException("Invalid state: " + filter.state() + ". Use open, closed or all.");
		}
	}

	static PullRequestExtractionRequest from(Map<String, ?> values) {
		ExtractionArgs args = new ExtractionArgs(values);
		String org = args.name("org");
		List<String> repos = args.repositories("repos");
		ExtractionWindow window = ExtractionWindow.parse(args.optional("since"), args.optional("until"));
		String state = args.optional("state");
		boolean mergedOnly = args.flag("merged_only", true);
		return new PullRequestExtractionRequest(org, repos,
				new PullRequestFilter(state != null ? state : DEFAULT_STATE, mergedOnly, window),
				args.flag("verbose", false));
	}

	@Override
	public ExtractorTool tool() {
		return ExtractorTool.PULL_REQUEST_EXTRACTOR;
	}

	@Override
	public Map<String, @Nullable Object> params() {
		Map<String, @Nullable Object> params = new LinkedHashMap<>();
		params.put("org", org);
		params.put("repos", repos);
		params.put("since", filter.window().sinceParam());
		params.put("until", filter.window().untilParam());
		params.put("state", filter.state());
		params.put("merged_only", filter.mergedOnly());
		return params;
	}

	@Override
	public List<String> commandPreview(Path outputDir) {
		List<String> command = new ArrayList<>(List.of(tool().id(), "--output-dir", outputDir.toString(), "--org", org,
				"--repos"));
		command.addAll(repos);
		ExtractionWindow window = filter.window();
		if (window.since() != null) {
			command.add("--since");
			command.add(window.sinceParam());
		}
		if (window.until() != null) {
			command.add("--until");
			command.add(window.untilParam());
		}
		command.add("--state");
		command.add(filter.state());
		command.add(filter.mergedOnly() ? "--merged-only" : "--no-merged-only");
		if (verbose) {
			command.add("--verbose");
		}
		command.add("--token");
		command.add("[TOKEN]");
		return command;
	}

}
