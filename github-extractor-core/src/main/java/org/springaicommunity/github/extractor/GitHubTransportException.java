package org.springaicommunity.github.extractor;

/**
 * Network failure while talking to GitHub. Not retried inside a worker.
 */
public class GitHubTransportException extends GitHubApiException {

	public GitHubTransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
