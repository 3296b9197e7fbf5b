package org.guardian.email;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "guardian.branding")
public class BrandingProperties {

	private String companyName = "Guardian";
	private String appName = "Guardian";
	private String supportEmail = "support@example.com";
	private String primaryColor = "#2563eb";

}
