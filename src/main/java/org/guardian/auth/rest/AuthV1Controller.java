package org.guardian.auth.rest;

import org.guardian.auth.AuthService;
import org.guardian.auth.dto.LogoutResponse;
import org.guardian.auth.dto.TokenRequest;
import org.guardian.auth.dto.TokenRequestResponse;
import org.guardian.auth.dto.TokenValidation;
import org.guardian.auth.dto.TokenValidationResponse;
import org.guardian.global.rest.RetryRest;
import org.guardian.user.dto.User;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/auth/v1")
@RequiredArgsConstructor
public class AuthV1Controller {

	private final AuthService service;

	@PostMapping("request-token")
	public Mono<TokenRequestResponse> requestToken(@Valid @RequestBody TokenRequest request) {
		return RetryRest.retry(service.requestCode(request));
	}

	@PostMapping("validate-token")
	public Mono<TokenValidationResponse> validateToken(@Valid @RequestBody TokenValidation request) {
		return RetryRest.retry(service.redeemCode(request));
	}

	@GetMapping("me")
	public Mono<User> me(Authentication auth) {
		return RetryRest.retry(service.me(auth));
	}

	@PostMapping("refresh")
	public Mono<TokenValidationResponse> refresh(Authentication auth) {
		return RetryRest.retry(service.refresh(auth));
	}

	@PostMapping("logout")
	public Mono<LogoutResponse> logout(Authentication auth) {
		return service.logout(auth);
	}

}
