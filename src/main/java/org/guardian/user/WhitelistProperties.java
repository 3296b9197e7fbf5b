package org.guardian.user;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "guardian.whitelist")
public class WhitelistProperties {

	/** When enabled, login codes are only issued to existing users. */
	private boolean enabled = true;
	/** Users created at startup, comma separated when given through the environment. */
	private List<String> initialUsers = new ArrayList<>();

}
