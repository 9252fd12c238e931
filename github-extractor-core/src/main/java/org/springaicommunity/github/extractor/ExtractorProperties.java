package org.springaicommunity.github.extractor;

/**
 * Configuration properties for the extractor.
 *
 * <p>
 * Properties can be set directly via setters, passed to {@link GitHubExtractorBuilder},
 * or bound from {@code extractor.*} by the server application. Defaults are suitable for
 * github.com.
 */
public class ExtractorProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Base URL used to build the {@code commit_url} column.
	 */
	private String webBaseUrl = "https://github.com";

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "github-extractor";

	/**
	 * Per-request timeout in seconds.
	 */
	private int requestTimeoutSeconds = 60;

	/**
	 * Seconds added after the rate limit reset epoch before retrying.
	 */
	private int rateLimitBufferSeconds = 1;

	/**
	 * Root directory under which each job gets its own output directory.
	 */
	private String outputRoot = "output";

	/**
	 * Append-only JSON-lines audit file.
	 */
	private String auditLogFile = "audit-log.jsonl";

	/**
	 * Number of worker log lines retained per job.
	 */
	private int logTailLimit = 400;

	/**
	 * Maximum number of results the Search API returns for one query.
	 */
	private int searchResultCeiling = 1000;

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public String getWebBaseUrl() {
		return webBaseUrl;
	}

	public void setWebBaseUrl(String webBaseUrl) {
		this.webBaseUrl = webBaseUrl;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public int getRateLimitBufferSeconds() {
		return rateLimitBufferSeconds;
	}

	public void setRateLimitBufferSeconds(int rateLimitBufferSeconds) {
		this.rateLimitBufferSeconds = rateLimitBufferSeconds;
	}

	public String getOutputRoot() {
		return outputRoot;
	}

	public void setOutputRoot(String outputRoot) {
		this.outputRoot = outputRoot;
	}

	public String getAuditLogFile() {
		return auditLogFile;
	}

	public void setAuditLogFile(String auditLogFile) {
		this.auditLogFile = auditLogFile;
	}

	public int getLogTailLimit() {
		return logTailLimit;
	}

	public void setLogTailLimit(int logTailLimit) {
		this.logTailLimit = logTailLimit;
	}

	public int getSearchResultCeiling() {
		return searchResultCeiling;
	}

	public void setSearchResultCeiling(int searchResultCeiling) {
		this.searchResultCeiling = searchResultCeiling;
	}

}
