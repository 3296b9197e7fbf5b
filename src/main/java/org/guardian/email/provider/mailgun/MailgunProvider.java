package org.guardian.email.provider.mailgun;

import java.time.Duration;

import org.guardian.email.Email;
import org.guardian.email.EmailProvider;
import org.guardian.global.GuardianUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/** Sends emails through the Mailgun HTTP API. */
@Slf4j
public class MailgunProvider implements EmailProvider {

	private final WebClient client;
	private final String domain;
	private final String from;
	private final Duration timeout;

	public MailgunProvider(String url, String apiKey, String domain, String from, Duration timeout) {
		this.client = WebClient.builder()
			.baseUrl(url)
			.defaultHeaders(headers -> headers.setBasicAuth("api", apiKey))
			.build();
		this.domain = domain;
		this.from = from;
		this.timeout = timeout;
	}

	@Override
	public String getName() {
		return "mailgun";
	}

	@Override
	public Mono<Void> send(Email email) {
		MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
		form.add("from", from);
		form.add("to", email.getTo());
		form.add("subject", email.getSubject());
		form.add("text", email.getText());
		if (email.getHtml() != null) form.add("html", email.getHtml());
		return client.post()
		.uri("/{domain}/messages", domain)
		.body(BodyInserters.fromFormData(form))
		.retrieve()
		.toBodilessEntity()
		.timeout(timeout)
		.doOnNext(response -> log.info("Email sent to {} via Mailgun", GuardianUtils.maskEmail(email.getTo())))
		.then();
	}

}
