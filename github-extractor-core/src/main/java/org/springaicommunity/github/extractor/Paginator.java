package org.springaicommunity.github.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Drives repeated list requests to exhaustion.
 *
 * <p>
 * Pages are requested with {@code per_page=100} starting at {@code page=1}. Enumeration
 * stops after the first page holding fewer than 100 items; that partial (or empty) page
 * is still yielded. No item is skipped regardless of total volume, unless the request
 * carries an explicit item limit, in which case no page beyond that limit is requested.
 *
 * <p>
 * {@link #fetchAll(PageRequest)} is lazy: a page is requested only when the previous one
 * has been consumed. Each new iteration starts again at page 1 and re-issues the calls.
 * Rate limit waits happen inside the {@link GitHubClient} for the page being fetched, so
 * earlier pages are never yielded twice.
 */
public class Paginator {

	private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

	public static final int PAGE_SIZE = 100;

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	public Paginator(GitHubClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	/**
	 * Lazy sequence of every item behind {@code request}.
	 * @param request the list request template
	 * @return iterable whose iterators each perform a fresh enumeration
	 */
	public Iterable<JsonNode> fetchAll(PageRequest request) {
		return () -> new PageIterator(request);
	}

	/**
	 * Enumerate everything behind {@code request} and return the number of items.
	 */
	public int count(PageRequest request) {
		int count = 0;
		for (JsonNode ignored : fetchAll(request)) {
			count++;
		}
		return count;
	}

	List<JsonNode> fetchPage(PageRequest request, int page) {
		String body = client.getWithQuery(request.path(), request.queryString(page, PAGE_SIZE));
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubApiException("Malformed JSON from " + request.path() + " page " + page, e);
		}

		JsonNode array = request.itemsField() != null ? root.path(request.itemsField()) : root;
		if (array.isMissingNode() || array.isNull()) {
			return List.of();
		}
		if (!array.isArray()) {
			throw new GitHubApiException("Expected a JSON array from " + request.path() + " page " + page, 200, body);
		}

		List<JsonNode> items = new ArrayList<>(array.size());
		array.forEach(items::add);
		logger.debug("{} page {}: {} items", request.path(), page, items.size());
		return items;
	}

	private final class PageIterator implements Iterator<JsonNode> {

		private final PageRequest request;

		private int nextPage = 1;

		private int yielded = 0;

		private boolean lastPageSeen = false;

		private Iterator<JsonNode> current = Collections.emptyIterator();

		private PageIterator(PageRequest request) {
			this.request = request;
		}

		@Override
		public boolean hasNext() {
			if (request.isLimited() && yielded >= request.maxItems()) {
				return false;
			}
			while (!current.hasNext() && !lastPageSeen) {
				List<JsonNode> items = fetchPage(request, nextPage);
				nextPage++;
				if (items.size() < PAGE_SIZE) {
					lastPageSeen = true;
				}
				current = items.iterator();
			}
			return current.hasNext();
		}

		@Override
		public JsonNode next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			yielded++;
			return current.next();
		}

	}

}
