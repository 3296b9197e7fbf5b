package org.guardian.global.rest;

import org.guardian.global.exceptions.GuardianException;
import org.guardian.global.exceptions.TooManyRequestsException;
import org.guardian.global.exceptions.ValidationUtils;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@Slf4j
public class RestExceptions {

	@ExceptionHandler(GuardianException.class)
	public Mono<ResponseEntity<ApiError>> handleGuardianError(GuardianException error, ServerWebExchange exchange) {
		log.warn("Error returned by {} {}: {} - {} - {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), error.getClass().getSimpleName(), error.getErrorCode(), error.getMessage());
		return Mono.fromSupplier(() -> {
			var response = ResponseEntity.status(error.getStatus());
			if (error instanceof TooManyRequestsException tooMany)
				response.header(HttpHeaders.RETRY_AFTER, Long.toString(tooMany.getRetryAfterSeconds()));
			return response.body(error.toApiError());
		});
	}

	@ExceptionHandler(WebExchangeBindException.class)
	public Mono<ResponseEntity<ApiError>> handleBindError(WebExchangeBindException error, ServerWebExchange exchange) {
		ApiError result;
		var fieldError = error.getFieldError();
		if (fieldError != null) {
			result = new ApiError(400, ValidationUtils.INVALID_PREFIX + fieldError.getField(), fieldError.getDefaultMessage());
		} else {
			result = new ApiError(400, "invalid-input", "Invalid request");
		}
		log.warn("Bind error returned by {} {}: 400 - {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), result.getErrorCode());
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	@ExceptionHandler(ServerWebInputException.class)
	public Mono<ResponseEntity<ApiError>> handleInputError(ServerWebInputException error, ServerWebExchange exchange) {
		ApiError result;
		MethodParameter parameter = error.getMethodParameter();
		if (parameter != null && parameter.getParameterName() != null) {
			result = new ApiError(400, ValidationUtils.INVALID_PREFIX + parameter.getParameterName(), "Invalid request");
		} else {
			result = new ApiError(400, "invalid-input", "Invalid request");
		}
		log.warn("Input error returned by {} {}: 400 - {} => {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), error.getReason(), result.getErrorCode());
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}

	@ExceptionHandler(ErrorResponseException.class)
	public Mono<ResponseEntity<ApiError>> handleFrameworkError(ErrorResponseException error, ServerWebExchange exchange) {
		int status = error.getStatusCode().value();
		var body = error.getBody();
		var result = new ApiError(status, body.getTitle(), body.getDetail());
		log.warn("Framework error returned by {} {}: {} - {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), error.getClass().getSimpleName(), status);
		return Mono.fromSupplier(() -> ResponseEntity.status(status).body(result));
	}

	@ExceptionHandler(AccessDeniedException.class)
	public Mono<ResponseEntity<ApiError>> handleAccessDenied(AccessDeniedException error, ServerWebExchange exchange) {
		log.warn("Access denied for {} {}: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), error.getMessage());
		return Mono.fromSupplier(() -> ResponseEntity.status(403).body(new ApiError(403, "forbidden", "Access denied")));
	}

	@ExceptionHandler(Exception.class)
	public Mono<ResponseEntity<ApiError>> handleOtherError(Exception error, ServerWebExchange exchange) {
		log.error("Unexpected error returned by {} {}: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), error.getClass().getSimpleName(), error);
		return Mono.fromSupplier(() -> ResponseEntity.status(500).body(new ApiError(500, "internal-error", "Internal server error")));
	}

}
