package org.guardian.global.exceptions;

import org.guardian.global.rest.ApiError;
import org.springframework.http.HttpStatus;

import lombok.Getter;

@Getter
public class TooManyRequestsException extends GuardianException {

	private static final long serialVersionUID = 1L;

	private final long retryAfterSeconds;

	public TooManyRequestsException(long retryAfterSeconds) {
		super(HttpStatus.TOO_MANY_REQUESTS, "rate-limited", "Too many login code requests, retry in " + retryAfterSeconds + " seconds");
		this.retryAfterSeconds = retryAfterSeconds;
	}

	@Override
	public ApiError toApiError() {
		var error = super.toApiError();
		error.setRetryAfter(retryAfterSeconds);
		return error;
	}

}
