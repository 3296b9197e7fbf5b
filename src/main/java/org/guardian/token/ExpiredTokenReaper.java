package org.guardian.token;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
@Slf4j
public class ExpiredTokenReaper {

	private final AuthTokenService tokenService;

	@Scheduled(fixedDelayString = "${guardian.token.reaper-delay:1h}", initialDelayString = "${guardian.token.reaper-initial-delay:5m}")
	public void clean() {
		log.info("Cleaning expired login codes");
		reap()
		.checkpoint("Clean expired login codes")
		.subscribe(
			nb -> log.info("Expired login codes removed: {}", nb),
			error -> log.error("Error cleaning expired login codes", error)
		);
	}

	public Mono<Long> reap() {
		return tokenService.reapExpired();
	}

}
