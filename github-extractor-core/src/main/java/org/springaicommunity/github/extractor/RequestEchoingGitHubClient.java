package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;

import java.util.function.Consumer;

/**
 * {@link GitHubClient} decorator that reports every GET before delegating it. Used for
 * verbose jobs, where each request shows up in the job's log.
 */
public class RequestEchoingGitHubClient implements GitHubClient {

	private final GitHubClient delegate;

	private final Consumer<String> echo;

	public RequestEchoingGitHubClient(GitHubClient delegate, Consumer<String> echo) {
		this.delegate = delegate;
		this.echo = echo;
	}

	@Override
	public String get(String path) {
		echo.accept("GET " + path);
		return delegate.get(path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		echo.accept(queryString == null || queryString.isEmpty() ? "GET " + path : "GET " + path + "?" + queryString);
		return delegate.getWithQuery(path, queryString);
	}

	@Override
	@Nullable
	public RateLimitState getLastRateLimitState() {
		return delegate.getLastRateLimitState();
	}

}
