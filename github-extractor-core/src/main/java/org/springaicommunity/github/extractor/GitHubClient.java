package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST API, enabling testability and decorator
 * implementations such as {@link RateLimitWaitingGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), already URL-encoded
	 * @return Response body as String
	 * @throws GitHubApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Get the rate limit state from the most recent API response. Returns null if no rate
	 * limit headers have been observed yet.
	 * @return last observed RateLimitState, or null
	 */
	@Nullable
	default RateLimitState getLastRateLimitState() {
		return null;
	}

}
