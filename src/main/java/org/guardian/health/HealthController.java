package org.guardian.health;

import java.time.Duration;

import org.guardian.global.GuardianProperties;
import org.guardian.global.GuardianUtils;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

	private static final Duration DATABASE_CHECK_TIMEOUT = Duration.ofSeconds(3);

	private final R2dbcEntityTemplate db;
	private final GuardianProperties properties;

	@GetMapping
	public Mono<HealthResponse> health() {
		return databaseConnected().map(connected -> new HealthResponse(
			connected ? "healthy" : "degraded",
			GuardianUtils.SERVICE_NAME,
			properties.getVersion(),
			connected ? "connected" : "disconnected",
			properties.getEnvironment()
		));
	}

	@GetMapping("/live")
	public Mono<StatusResponse> live() {
		return Mono.just(new StatusResponse("alive"));
	}

	@GetMapping("/ready")
	public Mono<ResponseEntity<StatusResponse>> ready() {
		return databaseConnected().map(connected -> connected
			? ResponseEntity.ok(new StatusResponse("ready"))
			: ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new StatusResponse("not ready"))
		);
	}

	private Mono<Boolean> databaseConnected() {
		return db.getDatabaseClient().sql("SELECT 1").fetch().first()
		.map(row -> true)
		.defaultIfEmpty(false)
		.timeout(DATABASE_CHECK_TIMEOUT)
		.onErrorResume(e -> {
			log.warn("Database health check failed: {}", e.getMessage());
			return Mono.just(false);
		});
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class HealthResponse {
		private String status;
		private String service;
		private String version;
		private String database;
		private String environment;
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class StatusResponse {
		private String status;
	}

}
