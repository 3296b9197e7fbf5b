package org.guardian.session;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import org.guardian.global.GuardianProperties;
import org.guardian.global.GuardianUtils;
import org.guardian.session.dto.SessionClaims;
import org.guardian.session.dto.SessionToken;
import org.guardian.user.db.UserEntity;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Service;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mints and verifies the stateless session credentials given after a successful code redemption.
 * Credentials are HMAC signed JWTs, there is no server side session and no revocation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements InitializingBean {

	public static final String CLAIM_EMAIL = "email";
	public static final String CLAIM_ACTIVE = "active";
	public static final String CLAIM_TYPE = "type";
	public static final String TYPE_ACCESS = "access";

	private final SessionProperties properties;
	private final GuardianProperties guardianProperties;
	private final Clock clock;

	private Algorithm algo;
	private com.auth0.jwt.interfaces.JWTVerifier verifier;

	@Override
	public void afterPropertiesSet() {
		String secret = properties.getSecret();
		if (guardianProperties.isProduction()) {
			if (isDefaultSecret())
				throw new IllegalStateException("guardian.jwt.secret must be changed from its default value in production");
			if (secret.length() < SessionProperties.MIN_PRODUCTION_SECRET_LENGTH)
				throw new IllegalStateException("guardian.jwt.secret must be at least " + SessionProperties.MIN_PRODUCTION_SECRET_LENGTH + " characters long in production");
		}
		algo = algorithm(properties.getAlgorithm(), secret);
		verifier = ((JWTVerifier.BaseVerification) JWT.require(algo).withClaim(CLAIM_TYPE, TYPE_ACCESS)).build(clock);
	}

	private static Algorithm algorithm(String name, String secret) {
		switch (name) {
		case "HS384": return Algorithm.HMAC384(secret);
		case "HS512": return Algorithm.HMAC512(secret);
		case "HS256": return Algorithm.HMAC256(secret);
		default: throw new IllegalStateException("Unsupported JWT algorithm: " + name);
		}
	}

	public boolean isDefaultSecret() {
		return SessionProperties.DEFAULT_SECRET.equals(properties.getSecret());
	}

	public SessionToken mint(UserEntity user) {
		Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
		Instant expires = now.plus(properties.getValidity());
		String token = JWT.create()
			.withSubject(user.getId().toString())
			.withIssuedAt(now)
			.withExpiresAt(expires)
			.withClaim(CLAIM_EMAIL, user.getEmail())
			.withClaim(CLAIM_ACTIVE, user.isActive())
			.withClaim(CLAIM_TYPE, TYPE_ACCESS)
			.sign(algo);
		log.debug("Session issued for {} until {}", GuardianUtils.maskEmail(user.getEmail()), expires);
		return new SessionToken(token, expires);
	}

	/** Checks signature, structure and expiry. Any failure gives an empty result, the reason is only logged. */
	public Optional<SessionClaims> verify(String token) {
		if (token == null || token.isBlank()) return Optional.empty();
		DecodedJWT decoded;
		try {
			decoded = verifier.verify(token);
		} catch (JWTVerificationException e) {
			log.debug("Invalid session token: {}", e.getMessage());
			return Optional.empty();
		}
		Optional<UUID> subject = GuardianUtils.ifUuid(decoded.getSubject());
		if (subject.isEmpty()) {
			log.debug("Invalid session token: subject is not a user id");
			return Optional.empty();
		}
		Instant expiresAt = decoded.getExpiresAtAsInstant();
		if (expiresAt == null || !expiresAt.isAfter(clock.instant())) {
			log.debug("Invalid session token: expired");
			return Optional.empty();
		}
		Boolean active = decoded.getClaim(CLAIM_ACTIVE).asBoolean();
		return Optional.of(new SessionClaims(
			subject.get(),
			decoded.getClaim(CLAIM_EMAIL).asString(),
			Boolean.TRUE.equals(active),
			decoded.getIssuedAtAsInstant(),
			expiresAt
		));
	}

	public Optional<UUID> subjectOf(String token) {
		return verify(token).map(SessionClaims::getSubject);
	}

}
