package org.guardian.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.guardian.auth.dto.IssuedCode;
import org.guardian.auth.dto.LogoutResponse;
import org.guardian.auth.dto.TokenRequest;
import org.guardian.auth.dto.TokenRequestResponse;
import org.guardian.auth.dto.TokenValidation;
import org.guardian.auth.dto.TokenValidationResponse;
import org.guardian.email.CodeDelivery;
import org.guardian.global.GuardianProperties;
import org.guardian.global.GuardianUtils;
import org.guardian.global.exceptions.ServiceUnavailableException;
import org.guardian.global.exceptions.UnauthorizedException;
import org.guardian.global.exceptions.ValidationUtils;
import org.guardian.session.SessionService;
import org.guardian.token.AuthTokenService;
import org.guardian.token.TokenProperties;
import org.guardian.user.UserService;
import org.guardian.user.db.UserEntity;
import org.guardian.user.dto.User;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Entry point of the passwordless flow: request a code by email, redeem it for a session, then use the session.
 * <p>
 * Responses never tell whether an account exists: a code request always gets the same answer,
 * and every redemption failure is the same invalid credentials error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

	public static final String CODE_REQUESTED_MESSAGE = "If this email is registered, a login code has been sent";
	public static final String LOGOUT_MESSAGE = "Successfully logged out";

	private final CodeRequestService codeRequestService;
	private final AuthTokenService tokenService;
	private final SessionService sessionService;
	private final UserService userService;
	private final CodeDelivery delivery;
	private final TokenProperties tokenProperties;
	private final GuardianProperties properties;
	private final Clock clock;

	public Mono<TokenRequestResponse> requestCode(TokenRequest request) {
		return Mono.defer(() -> {
			ValidationUtils.field("email", request.getEmail()).email();
			return requestCode(GuardianUtils.normalizeEmail(request.getEmail()));
		});
	}

	private Mono<TokenRequestResponse> requestCode(String email) {
		return codeRequestService.reserveAndIssue(email)
		// two first requests for a new email: the loser sees the user created by the winner on retry
		.onErrorResume(DuplicateKeyException.class, e -> codeRequestService.reserveAndIssue(email))
		.timeout(storeTimeout())
		.onErrorMap(TimeoutException.class, e -> {
			log.error("Timeout issuing login code for {}", GuardianUtils.maskEmail(email));
			return new ServiceUnavailableException();
		})
		.doOnNext(this::deliver)
		.then(Mono.fromSupplier(() -> new TokenRequestResponse(CODE_REQUESTED_MESSAGE, GuardianUtils.maskEmail(email), tokenProperties.getExpiry().toMinutes())));
	}

	private void deliver(IssuedCode issued) {
		String email = issued.getUser().getEmail();
		delivery.deliver(email, issued.getCode())
		.checkpoint("Deliver login code")
		.subscribe(
			null,
			error -> log.error("Unable to deliver login code to {}: {}", GuardianUtils.maskEmail(email), error.getMessage())
		);
	}

	public Mono<TokenValidationResponse> redeemCode(TokenValidation request) {
		return Mono.defer(() -> {
			ValidationUtils.field("email", request.getEmail()).email();
			ValidationUtils.field("token", request.getToken()).digits(tokenProperties.getLength());
			return redeemCode(GuardianUtils.normalizeEmail(request.getEmail()), request.getToken());
		});
	}

	private Mono<TokenValidationResponse> redeemCode(String email, String code) {
		return userService.resolve(email)
		.filter(user -> {
			if (!user.isActive()) log.info("Login code redemption refused for inactive user {}", GuardianUtils.maskEmail(email));
			return user.isActive();
		})
		.flatMap(user -> tokenService.redeem(user.getId(), code)
			.flatMap(tokenService::markUsed)
			.filter(Boolean::booleanValue)
			.flatMap(consumed -> userService.recordLogin(user))
		)
		.timeout(storeTimeout())
		.onErrorResume(TimeoutException.class, e -> {
			log.error("Timeout redeeming login code for {}", GuardianUtils.maskEmail(email));
			return Mono.empty();
		})
		.switchIfEmpty(Mono.defer(() -> {
			log.info("Invalid login code for {}", GuardianUtils.maskEmail(email));
			return Mono.error(UnauthorizedException.invalidCredentials());
		}))
		.map(user -> {
			log.info("User {} logged in", GuardianUtils.maskEmail(email));
			return newSession(user);
		});
	}

	/** Resolves the active user owning a bearer credential, empty if the credential or the user is not valid. */
	public Mono<UserEntity> verifyBearer(String token) {
		return Mono.justOrEmpty(sessionService.verify(token))
		.flatMap(claims -> userService.findById(claims.getSubject()))
		.filter(UserEntity::isActive)
		.timeout(storeTimeout())
		.onErrorResume(e -> {
			log.warn("Unable to verify session: {}", e.getClass().getSimpleName());
			return Mono.empty();
		});
	}

	public Mono<User> me(Authentication auth) {
		return currentUser(auth).map(userService::toDto);
	}

	public Mono<TokenValidationResponse> refresh(Authentication auth) {
		return currentUser(auth)
		.filter(UserEntity::isActive)
		.switchIfEmpty(Mono.error(new UnauthorizedException()))
		.map(this::newSession);
	}

	public Mono<LogoutResponse> logout(Authentication auth) {
		return Mono.fromSupplier(() -> {
			log.info("User {} logged out", auth.getPrincipal());
			return new LogoutResponse(LOGOUT_MESSAGE);
		});
	}

	private Mono<UserEntity> currentUser(Authentication auth) {
		return Mono.justOrEmpty(GuardianUtils.ifUuid(auth == null ? null : String.valueOf(auth.getPrincipal())))
		.flatMap(userService::findById)
		.switchIfEmpty(Mono.error(new UnauthorizedException()));
	}

	private TokenValidationResponse newSession(UserEntity user) {
		var session = sessionService.mint(user);
		long expiresIn = Math.max(0, Duration.between(clock.instant(), session.getExpiresAt()).getSeconds());
		return new TokenValidationResponse(session.getToken(), TokenValidationResponse.TOKEN_TYPE, expiresIn, userService.toDto(user));
	}

	private Duration storeTimeout() {
		return properties.getStoreTimeout();
	}

}
