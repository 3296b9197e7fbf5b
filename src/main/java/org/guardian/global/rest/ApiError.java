package org.guardian.global.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

	private int httpCode;
	private String errorCode;
	private String errorMessage;
	/** Seconds before the client may retry, only set on rate limited requests. */
	private Long retryAfter;

	public ApiError(int httpCode, String errorCode, String errorMessage) {
		this.httpCode = httpCode;
		this.errorCode = errorCode;
		this.errorMessage = errorMessage;
	}

}
