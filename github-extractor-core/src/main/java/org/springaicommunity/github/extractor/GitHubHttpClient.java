package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for GitHub REST calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Authenticates with an opaque bearer credential, extracts rate limit headers from all
 * responses (available via {@link #getLastRateLimitState()}) and maps error statuses
 * onto the {@link GitHubApiException} hierarchy.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String API_VERSION = "2022-11-28";

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	private final String userAgent;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitState lastRateLimitState;

	public GitHubHttpClient(String token, ExtractorProperties properties) {
		this.token = sanitizeToken(token);
		this.baseUrl = stripTrailingSlash(properties.getApiBaseUrl());
		this.userAgent = properties.getUserAgent();
		this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	@Nullable
	public RateLimitState getLastRateLimitState() {
		return lastRateLimitState;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("X-GitHub-Api-Version", API_VERSION)
			.header("User-Agent", userAgent)
			.GET()
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = baseUrl + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				this.lastRateLimitState = new RateLimitState(limit, remaining, reset, used);
				if (remaining < 100) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubAuthException("Unauthorized: Bad credentials.", response.body());
			}
			else if (statusCode == 403 && remaining == 0) {
				throw new RateLimitExceededException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 429) {
				throw new RateLimitExceededException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403) {
				throw new GitHubApiException("Forbidden: " + response.body(), statusCode, response.body(), remaining,
						reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body(), remaining,
						reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubTransportException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubTransportException("HTTP request interrupted", e);
		}
	}

	static String sanitizeToken(String token) {
		String trimmed = token.trim();
		while (trimmed.length() >= 1 && (trimmed.startsWith("\"") || trimmed.startsWith("'"))) {
			trimmed = trimmed.substring(1);
		}
		while (trimmed.length() >= 1 && (trimmed.endsWith("\"") || trimmed.endsWith("'"))) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		return trimmed;
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
