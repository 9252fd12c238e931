package org.springaicommunity.github.extractor;

/**
 * The two ways pull requests can be retrieved.
 */
public enum RetrievalPath {

	/**
	 * List the whole collection and filter client-side. Always complete.
	 */
	LIST,

	/**
	 * Pre-filtered Search API query. Fewer calls, but capped at the search result ceiling.
	 */
	SEARCH

}
