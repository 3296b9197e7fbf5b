package org.guardian.token;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "guardian.token")
public class TokenProperties {

	/** Number of digits of a login code. */
	@Min(4)
	@Max(8)
	private int length = 6;

	/** Lifetime of a login code. */
	private Duration expiry = Duration.ofMinutes(2);

	@AssertTrue(message = "guardian.token.expiry must be between 1 and 60 minutes")
	public boolean isExpiryValid() {
		return expiry != null && expiry.compareTo(Duration.ofMinutes(1)) >= 0 && expiry.compareTo(Duration.ofMinutes(60)) <= 0;
	}

}
