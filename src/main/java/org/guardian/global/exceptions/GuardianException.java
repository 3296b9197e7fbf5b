package org.guardian.global.exceptions;

import org.guardian.global.rest.ApiError;
import org.springframework.http.HttpStatus;

import lombok.Getter;

@Getter
public abstract class GuardianException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final HttpStatus status;
	private final String errorCode;

	protected GuardianException(HttpStatus status, String errorCode, String message) {
		super(message);
		this.status = status;
		this.errorCode = errorCode;
	}

	public ApiError toApiError() {
		return new ApiError(status.value(), errorCode, getMessage());
	}

}
