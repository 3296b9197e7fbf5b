package org.guardian.global.rest;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.mutable.MutableObject;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@RequiredArgsConstructor
public class HttpFilter implements WebFilter {

	private final Duration slowRequest;
	private final Duration uncommittedRequest;

	@Override
	public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
		long start = System.nanoTime();
		var request = exchange.getRequest();
		MutableObject<Disposable> watchdog = new MutableObject<>(null);
		exchange.getResponse().beforeCommit(() -> Mono.fromRunnable(() -> {
			Disposable d = watchdog.getValue();
			if (d != null && !d.isDisposed()) d.dispose();
			long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
			if (millis > slowRequest.toMillis())
				log.info("Slow request: {} {} answered {} in {} ms", request.getMethod(), request.getPath(), exchange.getResponse().getStatusCode(), millis);
		}));
		watchdog.setValue(Schedulers.boundedElastic().schedule(() -> {
			watchdog.setValue(null);
			log.warn("Request not committed after {} ms: {} {}", uncommittedRequest.toMillis(), request.getMethod(), request.getPath());
		}, uncommittedRequest.toMillis(), TimeUnit.MILLISECONDS));
		return chain.filter(exchange);
	}

}
