package org.guardian.ratelimit.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitDecision {

	private boolean allowed;
	/** Requests still allowed in the current window after this one, 0 when denied. */
	private long remaining;
	/** Seconds until the oldest request leaves the window, 0 when allowed. */
	private long retryAfterSeconds;

	public static RateLimitDecision allow(long remaining) {
		return new RateLimitDecision(true, remaining, 0);
	}

	public static RateLimitDecision deny(long retryAfterSeconds) {
		return new RateLimitDecision(false, 0, retryAfterSeconds);
	}

}
