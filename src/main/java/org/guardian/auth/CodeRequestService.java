package org.guardian.auth;

import java.util.Optional;

import org.guardian.auth.dto.IssuedCode;
import org.guardian.global.GuardianUtils;
import org.guardian.global.exceptions.TooManyRequestsException;
import org.guardian.ratelimit.RateLimitService;
import org.guardian.token.AuthTokenService;
import org.guardian.user.UserService;
import org.guardian.user.WhitelistProperties;
import org.guardian.user.db.UserEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Decides whether a code can be issued for an email and stores it.
 * <p>
 * Everything runs in one transaction and the user row is locked first, so concurrent requests for the same
 * email are serialized and cannot exceed the rate limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeRequestService {

	private final UserService userService;
	private final RateLimitService rateLimitService;
	private final AuthTokenService tokenService;
	private final WhitelistProperties whitelist;

	/**
	 * Issues a code for the given email.
	 * Empty when no code must be issued (unknown email in whitelist mode, inactive user),
	 * error {@link TooManyRequestsException} when the user is rate limited.
	 */
	@Transactional
	public Mono<IssuedCode> reserveAndIssue(String email) {
		return userService.resolveForUpdate(email)
		.map(Optional::of)
		.defaultIfEmpty(Optional.empty())
		.flatMap(userOpt -> {
			if (userOpt.isEmpty()) {
				if (whitelist.isEnabled()) {
					log.info("Login code requested for unknown email {}, ignored in whitelist mode", GuardianUtils.maskEmail(email));
					return Mono.empty();
				}
				return userService.createUser(email).flatMap(this::issue);
			}
			UserEntity user = userOpt.get();
			return rateLimitService.check(user.getId()).flatMap(decision -> {
				if (!decision.isAllowed()) {
					log.info("Login code request rate limited for {}, retry after {} seconds", GuardianUtils.maskEmail(email), decision.getRetryAfterSeconds());
					return Mono.error(new TooManyRequestsException(decision.getRetryAfterSeconds()));
				}
				if (!user.isActive()) {
					log.info("Login code requested for inactive user {}, ignored", GuardianUtils.maskEmail(email));
					return Mono.empty();
				}
				return issue(user);
			});
		});
	}

	private Mono<IssuedCode> issue(UserEntity user) {
		String code = tokenService.generateCode();
		return tokenService.issue(user.getId(), code).map(token -> new IssuedCode(user, token, code));
	}

}
