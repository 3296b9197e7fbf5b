package org.guardian.ratelimit;

import java.time.Clock;
import java.util.UUID;

import org.guardian.ratelimit.dto.RateLimitDecision;
import org.guardian.token.db.AuthTokenRepository;
import org.guardian.user.UserService;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Sliding window throttle on login code requests, counted from the codes issued to a user.
 * Checking does not reserve anything: the caller issues a code only if the decision allows it.
 */
@Service
@RequiredArgsConstructor
public class RateLimitService {

	private final AuthTokenRepository tokenRepo;
	private final UserService userService;
	private final RateLimitProperties properties;
	private final Clock clock;

	/** An unknown email is never limited. */
	public Mono<RateLimitDecision> check(String email) {
		return userService.resolve(email)
		.flatMap(user -> check(user.getId()))
		.switchIfEmpty(Mono.fromSupplier(() -> RateLimitDecision.allow(properties.getRequests() - 1L)));
	}

	public Mono<RateLimitDecision> check(UUID userId) {
		return Mono.defer(() -> {
			long now = clock.millis();
			long window = properties.getWindow().toMillis();
			long since = now - window;
			int limit = properties.getRequests();
			return tokenRepo.countByUserIdAndCreatedAtGreaterThanEqual(userId, since)
			.flatMap(count -> {
				if (count < limit) return Mono.just(RateLimitDecision.allow(limit - count - 1));
				return tokenRepo.findFirstByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(userId, since)
				.map(oldest -> RateLimitDecision.deny(retryAfterSeconds(oldest.getCreatedAt() + window - now)))
				.defaultIfEmpty(RateLimitDecision.deny(1));
			});
		});
	}

	static long retryAfterSeconds(long millis) {
		return Math.max(1, (millis + 999) / 1000);
	}

}
