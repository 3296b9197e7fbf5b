package org.guardian.email.provider.log;

import org.guardian.email.Email;
import org.guardian.email.EmailProvider;
import org.guardian.global.GuardianUtils;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/** Development provider: nothing is sent, only a notice without the code is logged. */
@Slf4j
public class LogProvider implements EmailProvider {

	@Override
	public String getName() {
		return "log";
	}

	@Override
	public boolean isDelivering() {
		return false;
	}

	@Override
	public Mono<Void> send(Email email) {
		return Mono.fromRunnable(() -> log.info("Email not sent (log provider) to {}: {}", GuardianUtils.maskEmail(email.getTo()), email.getSubject()));
	}

}
