package org.guardian.ratelimit;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "guardian.rate-limit")
public class RateLimitProperties {

	/** Maximum number of codes issued to a user within the window. */
	@Min(1)
	@Max(10)
	private int requests = 3;

	private Duration window = Duration.ofMinutes(15);

	@AssertTrue(message = "guardian.rate-limit.window must be between 5 and 60 minutes")
	public boolean isWindowValid() {
		return window != null && window.compareTo(Duration.ofMinutes(5)) >= 0 && window.compareTo(Duration.ofMinutes(60)) <= 0;
	}

}
