package org.guardian.global.rest;

import java.util.List;

import org.guardian.auth.AuthService;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Accepts a bearer credential when it verifies and belongs to an active user.
 * The principal of the resulting authentication is the user id.
 */
@Component
@RequiredArgsConstructor
public class SessionAuthenticationManager implements ReactiveAuthenticationManager {

	private final AuthService authService;

	@Override
	public Mono<Authentication> authenticate(Authentication authentication) {
		return Mono.defer(() -> {
			String token = authentication.getCredentials().toString();
			return authService.verifyBearer(token)
				.map(user -> new UsernamePasswordAuthenticationToken(user.getId().toString(), token, List.of()));
		});
	}

}
