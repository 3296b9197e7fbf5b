package org.guardian.token.db;

import java.util.UUID;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Mono;

public interface AuthTokenRepository extends ReactiveCrudRepository<AuthTokenEntity, UUID> {

	Mono<AuthTokenEntity> findFirstByUserIdAndTokenHashAndUsedAtIsNullAndExpiresAtGreaterThanOrderByCreatedAtDesc(UUID userId, String tokenHash, long now);

	Mono<Long> countByUserIdAndCreatedAtGreaterThanEqual(UUID userId, long since);

	Mono<AuthTokenEntity> findFirstByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(UUID userId, long since);

	Mono<Long> deleteAllByExpiresAtLessThan(long now);

	/** Consumes the token if nobody did before, returns the number of updated rows (0 or 1). */
	@Modifying
	@Query("UPDATE auth_tokens SET used_at = :now WHERE id = :id AND used_at IS NULL")
	Mono<Long> markUsed(UUID id, long now);

}
