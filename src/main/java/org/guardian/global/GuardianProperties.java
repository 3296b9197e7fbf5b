package org.guardian.global;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "guardian")
public class GuardianProperties {

	public static final String PRODUCTION = "production";

	private String environment = "development";
	private String version = "1.0.0";
	private Duration storeTimeout = Duration.ofSeconds(5);
	private Duration slowRequest = Duration.ofSeconds(2);
	private Duration uncommittedRequest = Duration.ofSeconds(10);

	public boolean isProduction() {
		return PRODUCTION.equalsIgnoreCase(environment);
	}

}
