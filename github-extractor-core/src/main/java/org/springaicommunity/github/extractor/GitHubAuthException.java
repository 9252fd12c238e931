package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

/**
 * The credential was rejected (HTTP 401). Fatal to the job and never retried.
 */
public class GitHubAuthException extends GitHubApiException {

	public GitHubAuthException(String message, @Nullable String responseBody) {
		super(message, 401, responseBody);
	}

}
