package org.guardian.user.db;

import java.util.UUID;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Mono;

public interface UserRepository extends ReactiveCrudRepository<UserEntity, UUID> {

	Mono<UserEntity> findByEmail(String email);

	/** Same as {@link #findByEmail(String)} but locks the row until the end of the current transaction. */
	@Query("SELECT * FROM users WHERE email = :email FOR UPDATE")
	Mono<UserEntity> findByEmailForUpdate(String email);

	@Modifying
	@Query("UPDATE users SET last_login = :lastLogin WHERE id = :id")
	Mono<Long> updateLastLogin(UUID id, long lastLogin);

	@Modifying
	@Query("UPDATE users SET is_active = :active WHERE email = :email")
	Mono<Long> updateActive(String email, boolean active);

}
