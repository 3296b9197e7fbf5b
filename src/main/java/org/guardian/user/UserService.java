package org.guardian.user;

import java.time.Clock;
import java.util.UUID;

import org.guardian.global.GuardianUtils;
import org.guardian.user.db.UserEntity;
import org.guardian.user.db.UserRepository;
import org.guardian.user.dto.User;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Resolves identities by email. Emails are always normalized (trimmed, lower case) before any lookup or insert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

	private final UserRepository userRepo;
	private final R2dbcEntityTemplate r2dbc;
	private final Clock clock;

	public Mono<UserEntity> resolve(String email) {
		return Mono.defer(() -> userRepo.findByEmail(GuardianUtils.normalizeEmail(email)));
	}

	/** Resolves the user and locks its row, must be called inside a transaction. */
	public Mono<UserEntity> resolveForUpdate(String email) {
		return Mono.defer(() -> userRepo.findByEmailForUpdate(GuardianUtils.normalizeEmail(email)));
	}

	public Mono<UserEntity> findById(UUID id) {
		return userRepo.findById(id);
	}

	public Mono<UserEntity> createUser(String emailInput) {
		return Mono.defer(() -> {
			String email = GuardianUtils.normalizeEmail(emailInput);
			log.info("Creating new user: {}", GuardianUtils.maskEmail(email));
			UserEntity entity = new UserEntity(
				UUID.randomUUID(),
				email,
				true, // isActive
				clock.millis(), // createdAt
				null // lastLogin
			);
			return r2dbc.insert(entity);
		});
	}

	/**
	 * Returns the existing user or creates it.
	 * When a concurrent call creates the same email first, the user it created is returned.
	 */
	public Mono<UserEntity> resolveOrCreate(String email) {
		return resolve(email)
		.switchIfEmpty(Mono.defer(() -> createUser(email)))
		.onErrorResume(DuplicateKeyException.class, e -> resolve(email));
	}

	public Mono<UserEntity> recordLogin(UserEntity user) {
		return Mono.defer(() -> {
			long now = clock.millis();
			return userRepo.updateLastLogin(user.getId(), now)
			.then(Mono.fromSupplier(() -> {
				user.setLastLogin(now);
				return user;
			}));
		});
	}

	/** Activates or deactivates an account. An inactive account can neither receive login codes nor use its sessions. */
	public Mono<Boolean> setActive(String email, boolean active) {
		return Mono.defer(() -> userRepo.updateActive(GuardianUtils.normalizeEmail(email), active))
		.map(updated -> updated > 0)
		.doOnNext(updated -> {
			if (Boolean.TRUE.equals(updated)) log.info("User {} is now {}", GuardianUtils.maskEmail(email), active ? "active" : "inactive");
		});
	}

	public User toDto(UserEntity entity) {
		return new User(
			entity.getId(),
			entity.getEmail(),
			entity.getCreatedAt(),
			entity.getLastLogin(),
			entity.isActive()
		);
	}

}
