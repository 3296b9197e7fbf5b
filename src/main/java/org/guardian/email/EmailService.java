package org.guardian.email;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.guardian.email.provider.log.LogProvider;
import org.guardian.email.provider.mailgun.MailgunProvider;
import org.guardian.email.provider.smtp.SmtpProvider;
import org.guardian.global.GuardianUtils;
import org.guardian.token.TokenProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Delivers login codes by email, rendering <code>templates/token_code.{lang}.*</code> and handing the result to the configured provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailService implements CodeDelivery {

	private final EmailProperties properties;
	private final BrandingProperties branding;
	private final TokenProperties tokenProperties;
	private final ObjectProvider<JavaMailSender> mailSender;

	private static final String TEMPLATES_DIR = "templates/";
	public static final String TOKEN_CODE_TEMPLATE = "token_code";

	@Getter
	private EmailProvider provider;

	@PostConstruct
	@SuppressWarnings("java:S112") // RuntimeException
	public void init() {
		String type = properties.getProvider() == null ? "log" : properties.getProvider().toLowerCase(Locale.ROOT);
		switch (type) {
		case "mailgun":
			var mailgun = properties.getMailgun();
			if (StringUtils.isBlank(mailgun.getApiKey()) || StringUtils.isBlank(mailgun.getDomain())) {
				log.error("Mailgun provider selected but guardian.mail.mailgun.api-key or domain is missing, falling back to log provider");
				provider = new LogProvider();
			} else {
				provider = new MailgunProvider(mailgun.getUrl(), mailgun.getApiKey(), mailgun.getDomain(), from(), properties.getTimeout());
			}
			break;
		case "smtp":
			JavaMailSender sender = mailSender.getIfAvailable();
			if (sender == null) throw new RuntimeException("SMTP provider selected but no mail server is configured (spring.mail.host)");
			provider = new SmtpProvider(sender, properties.getFromEmail(), properties.getFromName());
			break;
		case "log":
			provider = new LogProvider();
			break;
		default:
			throw new RuntimeException("Invalid email provider: " + properties.getProvider());
		}
	}

	private String from() {
		return properties.getFromName() + " <" + properties.getFromEmail() + ">";
	}

	public String getProviderName() {
		return provider.getName();
	}

	public boolean isDelivering() {
		return provider.isDelivering();
	}

	@Override
	public Mono<Void> deliver(String email, String code) {
		Map<String, String> data = new HashMap<>();
		data.put("code", code);
		data.put("expiry_minutes", Long.toString(tokenProperties.getExpiry().toMinutes()));
		data.put("token_length", Integer.toString(tokenProperties.getLength()));
		return render(TOKEN_CODE_TEMPLATE, properties.getLanguage(), email, data)
		.switchIfEmpty(Mono.fromSupplier(() -> fallbackTokenCodeEmail(email, code)))
		.flatMap(provider::send);
	}

	/** Renders the given template, empty when the template does not exist. */
	public Mono<Email> render(String template, String lang, String to, Map<String, String> templateData) {
		String language = getLanguage(lang);
		Mono<Optional<String>> readSubject = read(TEMPLATES_DIR + template + "." + language + ".subject.txt");
		Mono<Optional<String>> readText = read(TEMPLATES_DIR + template + "." + language + ".body.txt");
		Mono<Optional<String>> readHtml = read(TEMPLATES_DIR + template + "." + language + ".body.html");
		return Mono.zip(readSubject, readText, readHtml).flatMap(files -> {
			if (files.getT1().isEmpty() || files.getT2().isEmpty()) {
				log.warn("Email template {} missing for language {}", template, language);
				return Mono.empty();
			}
			Map<String, String> data = brandingData(templateData);
			return Mono.just(new Email(
				to,
				applyTemplate(files.getT1().get().trim(), data),
				applyTemplate(files.getT2().get(), data),
				files.getT3().map(html -> applyTemplate(html, data)).orElse(null)
			));
		});
	}

	private static Mono<Optional<String>> read(String filename) {
		return GuardianUtils.readResource(filename).map(Optional::of).defaultIfEmpty(Optional.empty());
	}

	@SuppressWarnings("java:S1301") // switch instead of if
	private String getLanguage(String lang) {
		if (lang == null) return "en";
		switch (lang.toLowerCase(Locale.ROOT)) {
		case "fr": return "fr";
		default: return "en";
		}
	}

	private Map<String, String> brandingData(Map<String, String> templateData) {
		Map<String, String> data = new HashMap<>();
		data.put("company_name", branding.getCompanyName());
		data.put("app_name", branding.getAppName());
		data.put("support_email", branding.getSupportEmail());
		data.put("brand_primary_color", branding.getPrimaryColor());
		data.putAll(templateData);
		return data;
	}

	private static String applyTemplate(String template, Map<String, String> data) {
		String result = template;
		for (var entry : data.entrySet()) result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
		return result;
	}

	private Email fallbackTokenCodeEmail(String to, String code) {
		long minutes = tokenProperties.getExpiry().toMinutes();
		return new Email(
			to,
			"Your " + branding.getAppName() + " login code",
			"Your login code is " + code + ".\n\nIt expires in " + minutes + " minutes and can only be used once.\n"
				+ "If you did not request it, you can ignore this email.\n\n" + branding.getCompanyName() + "\n",
			null
		);
	}

}
