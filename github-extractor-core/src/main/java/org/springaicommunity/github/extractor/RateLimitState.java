package org.springaicommunity.github.extractor;

import java.time.Instant;

/**
 * Rate limit observation taken from the {@code X-RateLimit-*} headers of one response.
 *
 * <p>
 * Held in memory only; a restarted process starts without any observation.
 *
 * @param limit the maximum number of requests allowed in the window, or -1 if absent
 * @param remaining the number of requests remaining in the current window
 * @param resetEpochSeconds when the window resets (epoch seconds), or -1 if absent
 * @param used the number of requests used in the current window, or -1 if absent
 */
public record RateLimitState(int limit, int remaining, long resetEpochSeconds, int used) {

	public Instant resetTime() {
		return Instant.ofEpochSecond(resetEpochSeconds);
	}

	public boolean isExhausted() {
		return remaining == 0;
	}

	/**
	 * Seconds from {@code now} until the reset epoch, never negative.
	 * @param now the current instant
	 * @return seconds to wait for the quota to reset
	 */
	public long secondsUntilReset(Instant now) {
		if (resetEpochSeconds < 0) {
			return 0;
		}
		return Math.max(0, resetEpochSeconds - now.getEpochSecond());
	}

}
