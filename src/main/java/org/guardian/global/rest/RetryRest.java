package org.guardian.global.rest;

import java.time.Duration;

import org.apache.commons.lang3.RandomUtils;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.r2dbc.UncategorizedR2dbcException;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

/** Retries a REST operation when the store fails with a transient error. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryRest {

	private static final int MAX_RETRIES = 2;

	public static boolean isRetryable(Throwable t) {
		return t instanceof UncategorizedR2dbcException || t instanceof TransientDataAccessException;
	}

	public static <T> Mono<T> retry(Mono<T> operation) {
		return retry(operation, 0);
	}

	private static <T> Mono<T> retry(Mono<T> operation, int numRetry) {
		if (numRetry == MAX_RETRIES) return operation;
		return operation.onErrorResume(error -> {
			if (isRetryable(error)) return delay(numRetry).then(retry(operation, numRetry + 1));
			return Mono.error(error);
		});
	}

	private static Mono<Long> delay(int numRetry) {
		long min = (numRetry + 1) * 10L;
		long max = (numRetry + 1) * 200L;
		return Mono.delay(Duration.ofMillis(RandomUtils.insecure().randomLong(min, max)));
	}

}
