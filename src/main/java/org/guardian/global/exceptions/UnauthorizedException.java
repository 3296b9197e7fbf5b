package org.guardian.global.exceptions;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends GuardianException {

	private static final long serialVersionUID = 1L;

	public static final String INVALID_CREDENTIALS = "invalid-credentials";

	public UnauthorizedException() {
		super(HttpStatus.UNAUTHORIZED, "unauthorized", "You must authenticate");
	}

	/** The same error whatever the reason: unknown email, wrong, expired or used code, inactive account. */
	public static UnauthorizedException invalidCredentials() {
		return new UnauthorizedException(INVALID_CREDENTIALS, "Invalid or expired login code");
	}

	private UnauthorizedException(String errorCode, String message) {
		super(HttpStatus.UNAUTHORIZED, errorCode, message);
	}

}
