package org.guardian.email;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "guardian.mail")
public class EmailProperties {

	/** mailgun, smtp or log. */
	private String provider = "log";
	private String fromEmail = "noreply@example.com";
	private String fromName = "Guardian";
	private String language = "en";
	private Duration timeout = Duration.ofSeconds(10);

	private Mailgun mailgun = new Mailgun();

	@Data
	public static class Mailgun {
		private String url = "https://api.mailgun.net/v3";
		private String apiKey;
		private String domain;
	}

}
