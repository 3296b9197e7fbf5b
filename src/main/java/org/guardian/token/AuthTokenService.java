package org.guardian.token;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

import org.guardian.global.GuardianUtils;
import org.guardian.token.db.AuthTokenEntity;
import org.guardian.token.db.AuthTokenRepository;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Lifecycle of login codes: generation, hashed storage, single redemption and expiry.
 * <p>
 * The plaintext code is never stored, only its SHA-256 hash. A code is valid while it is not used and not expired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthTokenService {

	private final AuthTokenRepository repo;
	private final R2dbcEntityTemplate r2dbc;
	private final SecureRandom random;
	private final TokenProperties properties;
	private final Clock clock;

	/** Returns exactly {@code length} random decimal digits, leading zeros included. */
	public String generateCode() {
		int length = properties.getLength();
		StringBuilder s = new StringBuilder(length);
		while (s.length() < length) s.append((char) ('0' + random.nextInt(10)));
		return s.toString();
	}

	public boolean isWellFormed(String code) {
		if (code == null || code.length() != properties.getLength()) return false;
		for (int i = 0; i < code.length(); i++) {
			char c = code.charAt(i);
			if (c < '0' || c > '9') return false;
		}
		return true;
	}

	public Mono<AuthTokenEntity> issue(UUID userId, String code) {
		return Mono.defer(() -> {
			long now = clock.millis();
			AuthTokenEntity entity = new AuthTokenEntity(
				UUID.randomUUID(),
				userId,
				GuardianUtils.sha256(code),
				now + properties.getExpiry().toMillis(), // expiresAt
				null, // usedAt
				now // createdAt
			);
			return r2dbc.insert(entity);
		});
	}

	/**
	 * Finds the valid token matching the code for the given user, the most recent one if several match.
	 * Empty for a malformed, unknown, used or expired code: the reason is not exposed.
	 */
	public Mono<AuthTokenEntity> redeem(UUID userId, String code) {
		if (!isWellFormed(code)) return Mono.empty();
		return Mono.defer(() -> repo.findFirstByUserIdAndTokenHashAndUsedAtIsNullAndExpiresAtGreaterThanOrderByCreatedAtDesc(userId, GuardianUtils.sha256(code), clock.millis()));
	}

	/** Returns true only for the call which actually consumed the token. */
	public Mono<Boolean> markUsed(AuthTokenEntity token) {
		return Mono.defer(() -> {
			long now = clock.millis();
			return repo.markUsed(token.getId(), now)
			.map(updated -> {
				if (updated == 0) return false;
				token.setUsedAt(now);
				return true;
			});
		});
	}

	/** Deletes every token past its expiry, used or not, and returns how many were removed. */
	public Mono<Long> reapExpired() {
		return Mono.defer(() -> repo.deleteAllByExpiresAtLessThan(clock.millis()));
	}

}
