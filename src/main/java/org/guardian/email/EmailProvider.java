package org.guardian.email;

import reactor.core.publisher.Mono;

public interface EmailProvider {

	String getName();

	/** False when the provider does not actually send emails. */
	default boolean isDelivering() {
		return true;
	}

	Mono<Void> send(Email email);

}
