package org.guardian.global;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.apache.commons.codec.digest.DigestUtils;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class GuardianUtils {

	public static final String SERVICE_NAME = "guardian";

	/** SHA-256 of the given value, as 64 lowercase hexadecimal characters. */
	public static String sha256(String value) {
		return DigestUtils.sha256Hex(value);
	}

	public static String normalizeEmail(String email) {
		if (email == null) return null;
		return email.trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Hides the local part of an email for logs and responses: <code>user@example.com</code> becomes <code>u***@example.com</code>.
	 */
	public static String maskEmail(String email) {
		if (email == null) return null;
		int at = email.indexOf('@');
		if (at < 0) return "***";
		if (at == 0) return "***" + email.substring(at);
		return email.charAt(0) + "***" + email.substring(at);
	}

	/** Reads a resource from the classpath, empty if it does not exist. */
	public static Mono<String> readResource(String filename) {
		return Mono.fromCallable(() -> {
			try (InputStream in = GuardianUtils.class.getClassLoader().getResourceAsStream(filename)) {
				if (in == null) return null;
				return new String(in.readAllBytes(), StandardCharsets.UTF_8);
			}
		}).subscribeOn(Schedulers.boundedElastic()).publishOn(Schedulers.parallel());
	}

	public static Optional<UUID> ifUuid(String s) {
		if (s == null) return Optional.empty();
		try {
			return Optional.of(UUID.fromString(s));
		} catch (IllegalArgumentException e) {
			return Optional.empty();
		}
	}

}
