package org.guardian.global;

import java.security.SecureRandom;
import java.time.Clock;

import org.guardian.email.BrandingProperties;
import org.guardian.email.EmailProperties;
import org.guardian.global.rest.HttpFilter;
import org.guardian.global.rest.JwtFilter;
import org.guardian.ratelimit.RateLimitProperties;
import org.guardian.session.SessionProperties;
import org.guardian.token.TokenProperties;
import org.guardian.user.WhitelistProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity.CsrfSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.FormLoginSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.HttpBasicSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.LogoutSpec;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.web.server.session.WebSessionManager;

import reactor.core.publisher.Mono;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({
	GuardianProperties.class,
	TokenProperties.class,
	RateLimitProperties.class,
	SessionProperties.class,
	EmailProperties.class,
	BrandingProperties.class,
	WhitelistProperties.class
})
public class GuardianConfiguration {

	@Bean
	WebSessionManager webSessionManager() {
		return exchange -> Mono.empty();
	}

	@Bean
	SecurityWebFilterChain springSecurityFilterChain(ServerHttpSecurity http, ReactiveAuthenticationManager authManager, GuardianProperties properties) {
		return http
		.csrf(CsrfSpec::disable)
		.formLogin(FormLoginSpec::disable)
		.httpBasic(HttpBasicSpec::disable)
		.logout(LogoutSpec::disable)
		.authorizeExchange(auth -> auth
			.pathMatchers(HttpMethod.POST, "/api/auth/v1/request-token").permitAll()
			.pathMatchers(HttpMethod.POST, "/api/auth/v1/validate-token").permitAll()
			.pathMatchers(HttpMethod.GET, "/api/health", "/api/health/**").permitAll()
			.pathMatchers("/**").authenticated()
		)
		.addFilterBefore(new HttpFilter(properties.getSlowRequest(), properties.getUncommittedRequest()), SecurityWebFiltersOrder.HTTP_BASIC)
		.addFilterBefore(new JwtFilter(authManager), SecurityWebFiltersOrder.HTTP_BASIC)
		.securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
		.exceptionHandling(handling ->
			handling.authenticationEntryPoint(
				(exchange, error) -> {
					var response = exchange.getResponse();
					response.setStatusCode(HttpStatus.UNAUTHORIZED);
					return Mono.empty();
				}
			)
		)
		.build();
	}

	@Bean
	SecureRandom secureRandom() {
		return new SecureRandom();
	}

	@Bean
	Clock clock() {
		return Clock.systemUTC();
	}

}
