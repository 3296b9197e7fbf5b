package org.guardian.email;

import reactor.core.publisher.Mono;

/** Sends a freshly issued login code to its owner. */
public interface CodeDelivery {

	Mono<Void> deliver(String email, String code);

}
