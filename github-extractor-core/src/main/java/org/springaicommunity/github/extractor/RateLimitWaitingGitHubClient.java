package org.springaicommunity.github.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decorator that waits out quota exhaustion on a {@link GitHubClient}.
 *
 * <p>
 * When the wrapped call fails with {@link RateLimitExceededException}, the calling thread
 * sleeps until the reported {@code X-RateLimit-Reset} epoch plus a small buffer and then
 * issues the identical call again. There is no retry limit: long-running batch
 * extractions prefer eventual completion over fast failure. Every wait is logged.
 *
 * <p>
 * Nothing else is retried here. {@link GitHubAuthException} and any other
 * {@link GitHubApiException} (including {@link GitHubTransportException}) propagate on the
 * first occurrence.
 *
 * <pre>
 * {@code
 * GitHubClient client = RateLimitWaitingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token, properties))
 *     .buffer(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class RateLimitWaitingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitWaitingGitHubClient.class);

	private final GitHubClient delegate;

	private final Duration buffer;

	private final Clock clock;

	private final Sleeper sleeper;

	private final AtomicLong rateLimitWaits = new AtomicLong();

	private RateLimitWaitingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.buffer = builder.buffer;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWaitingOnRateLimit(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWaitingOnRateLimit(() -> delegate.getWithQuery(path, queryString), desc);
	}

	@Override
	@Nullable
	public RateLimitState getLastRateLimitState() {
		return delegate.getLastRateLimitState();
	}

	/**
	 * Number of rate limit waits performed by this client so far.
	 * @return total waits across all calls
	 */
	public long getRateLimitWaitCount() {
		return rateLimitWaits.get();
	}

	private String executeWaitingOnRateLimit(RequestSupplier supplier, String description) {
		int attempt = 0;
		while (true) {
			attempt++;
			try {
				return supplier.get();
			}
			catch (RateLimitExceededException e) {
				Duration wait = computeWait(e);
				rateLimitWaits.incrementAndGet();
				logger.warn("[rate limit] {} rejected (attempt {}), sleeping {}s until reset at epoch {}", description,
						attempt, wait.toSeconds(), e.getResetEpochSeconds());
				sleeper.sleep(wait);
			}
		}
	}

	/**
	 * {@code max(0, reset - now) + buffer}. An unknown reset epoch waits for the buffer
	 * only.
	 */
	Duration computeWait(RateLimitExceededException e) {
		long seconds = 0;
		if (e.getResetEpochSeconds() > 0) {
			seconds = Math.max(0, e.getResetEpochSeconds() - clock.instant().getEpochSecond());
		}
		return Duration.ofSeconds(seconds).plus(buffer);
	}

	@FunctionalInterface
	private interface RequestSupplier {

		String get();

	}

	/**
	 * Suspends the calling thread. Replaceable so tests can observe waits without
	 * sleeping.
	 */
	@FunctionalInterface
	public interface Sleeper {

		void sleep(Duration duration);

		static Sleeper threadSleep() {
			return duration -> {
				try {
					Thread.sleep(duration.toMillis());
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException("Rate limit wait interrupted", e);
				}
			};
		}

	}

	/**
	 * Builder for {@link RateLimitWaitingGitHubClient}.
	 *
	 * <p>
	 * Defaults: buffer 1 second, system UTC clock, {@link Thread#sleep(long)}.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private Duration buffer = Duration.ofSeconds(1);

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.threadSleep();

		private Builder() {
		}

		/**
		 * Set the client to wrap.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Extra time added after the reset epoch before retrying.
		 * @param buffer non-negative buffer (default: 1 second)
		 * @return this builder
		 */
		public Builder buffer(Duration buffer) {
			this.buffer = buffer;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the client.
		 * @return configured RateLimitWaitingGitHubClient
		 * @throws IllegalStateException if no client to wrap was set or the buffer is
		 * negative
		 */
		public RateLimitWaitingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (buffer.isNegative()) {
				throw new IllegalStateException("buffer must not be negative");
			}
			return new RateLimitWaitingGitHubClient(this);
		}

	}

}
