package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Template for a paginated list request: the API path, its fixed query parameters, and
 * where the item array lives in the response.
 *
 * @param path API path without query string, e.g. {@code /repos/owner/repo/pulls}
 * @param params query parameters in the order they are sent
 * @param itemsField field holding the item array (e.g. {@code items} for the Search API),
 * or null when the response body is the array itself
 * @param maxItems stop after this many items, or {@link #UNLIMITED}
 */
public record PageRequest(String path, Map<String, String> params, @Nullable String itemsField, int maxItems) {

	public static final int UNLIMITED = -1;

	public PageRequest {
		params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
	}

	public static PageRequest of(String path) {
		return new PageRequest(path, Map.of(), null, UNLIMITED);
	}

	/**
	 * Copy with one more query parameter. Null values are skipped so optional scope
	 * fields can be chained without checks.
	 */
	public PageRequest with(String name, @Nullable String value) {
		if (value == null) {
			return this;
		}
		Map<String, String> copy = new LinkedHashMap<>(params);
		copy.put(name, value);
		return new PageRequest(path, copy, itemsField, maxItems);
	}

	public PageRequest itemsIn(String field) {
		return new PageRequest(path, params, field, maxItems);
	}

	public PageRequest limitedTo(int maxItems) {
		return new PageRequest(path, params, itemsField, maxItems);
	}

	public boolean isLimited() {
		return maxItems != UNLIMITED;
	}

	/**
	 * Encoded query string for one page.
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return query string without leading {@code ?}
	 */
	public String queryString(int page, int perPage) {
		StringJoiner joiner = new StringJoiner("&");
		params.forEach((name, value) -> joiner.add(encode(name) + "=" + encode(value)));
		joiner.add("per_page=" + perPage);
		joiner.add("page=" + page);
		return joiner.toString();
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
