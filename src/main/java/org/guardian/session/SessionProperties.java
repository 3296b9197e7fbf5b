package org.guardian.session;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "guardian.jwt")
public class SessionProperties {

	public static final String DEFAULT_SECRET = "change-me-in-production";
	public static final int MIN_PRODUCTION_SECRET_LENGTH = 32;

	@NotBlank
	private String secret = DEFAULT_SECRET;

	/** Lifetime of a session credential. */
	private Duration validity = Duration.ofDays(7);

	@Pattern(regexp = "HS256|HS384|HS512")
	private String algorithm = "HS256";

	@AssertTrue(message = "guardian.jwt.validity must be between 1 and 30 days")
	public boolean isValidityValid() {
		return validity != null && validity.compareTo(Duration.ofDays(1)) >= 0 && validity.compareTo(Duration.ofDays(30)) <= 0;
	}

}
