package org.guardian.global.exceptions;

import org.springframework.http.HttpStatus;

public class ServiceUnavailableException extends GuardianException {

	private static final long serialVersionUID = 1L;

	public ServiceUnavailableException() {
		super(HttpStatus.SERVICE_UNAVAILABLE, "service-unavailable", "Service temporarily unavailable, please retry later");
	}

}
