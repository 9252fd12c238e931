package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

/**
 * The request was rejected because the quota is exhausted: a 403 with
 * {@code X-RateLimit-Remaining: 0}, or a 429.
 *
 * <p>
 * {@link RateLimitWaitingGitHubClient} recovers from this transparently by waiting for
 * the reset epoch, so it is not expected to surface as a job failure.
 */
public class RateLimitExceededException extends GitHubApiException {

	public RateLimitExceededException(String message, int statusCode, @Nullable String responseBody,
			int rateLimitRemaining, long resetEpochSeconds) {
		super(message, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds);
	}

}
