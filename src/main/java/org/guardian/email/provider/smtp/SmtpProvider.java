package org.guardian.email.provider.smtp;

import org.guardian.email.Email;
import org.guardian.email.EmailProvider;
import org.guardian.global.GuardianUtils;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Sends emails through the SMTP server configured with <code>spring.mail.*</code>. */
@Slf4j
@RequiredArgsConstructor
public class SmtpProvider implements EmailProvider {

	private final JavaMailSender emailSender;
	private final String fromEmail;
	private final String fromName;

	@Override
	public String getName() {
		return "smtp";
	}

	@Override
	public Mono<Void> send(Email email) {
		return Mono.<Void>fromCallable(() -> {
			MimeMessage message = emailSender.createMimeMessage();
			MimeMessageHelper helper = new MimeMessageHelper(message, MimeMessageHelper.MULTIPART_MODE_MIXED_RELATED);
			helper.setFrom(new InternetAddress(fromEmail, fromName));
			helper.setTo(email.getTo());
			helper.setSubject(email.getSubject());
			if (email.getHtml() != null) helper.setText(email.getText(), email.getHtml());
			else helper.setText(email.getText());
			emailSender.send(message);
			log.info("Email sent to {} via SMTP", GuardianUtils.maskEmail(email.getTo()));
			return null;
		}).subscribeOn(Schedulers.boundedElastic());
	}

}
