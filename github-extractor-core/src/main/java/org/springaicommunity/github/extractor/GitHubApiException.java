package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a GitHub API call fails.
 *
 * <p>
 * Carries the HTTP status and the rate limit headers of the failed response when
 * available. Subclasses distinguish the failures the extractor reacts to differently:
 * {@link GitHubAuthException}, {@link RateLimitExceededException} and
 * {@link GitHubTransportException}.
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

}
