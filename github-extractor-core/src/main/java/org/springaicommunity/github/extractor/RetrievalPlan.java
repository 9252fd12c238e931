package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * How to retrieve the pull requests of one repository: the request to paginate, how to
 * read each item, and which items to keep.
 */
public record RetrievalPlan(RetrievalPath path, PageRequest request, Function<JsonNode, PullRequestSummary> parser,
		Predicate<PullRequestSummary> filter) {

	/**
	 * Enumerate the request to exhaustion and apply the client-side filter, preserving
	 * the order GitHub returned.
	 */
	public List<PullRequestSummary> retrieve(Paginator paginator) {
		return StreamSupport.stream(paginator.fetchAll(request).spliterator(), false)
			.map(parser)
			.filter(filter)
			.collect(Collectors.toList());
	}

}
