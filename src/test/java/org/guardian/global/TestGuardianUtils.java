package org.guardian.global;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import org.guardian.global.exceptions.BadRequestException;
import org.guardian.global.exceptions.ValidationUtils;
import org.junit.jupiter.api.Test;

import reactor.test.StepVerifier;

class TestGuardianUtils {

	@Test
	void testSha256() {
		assertThat(GuardianUtils.sha256("123456")).isEqualTo("8d969eef6ecad3c29a3a629280e686cf0c3f5d5a86aff3ca12020c923adc6c92");
		assertThat(GuardianUtils.sha256("123457")).hasSize(64).isNotEqualTo(GuardianUtils.sha256("123456"));
	}

	@Test
	void testNormalizeEmail() {
		assertThat(GuardianUtils.normalizeEmail("  John.Doe@Example.COM ")).isEqualTo("john.doe@example.com");
		assertThat(GuardianUtils.normalizeEmail(null)).isNull();
	}

	@Test
	void testMaskEmail() {
		assertThat(GuardianUtils.maskEmail("user@example.com")).isEqualTo("u***@example.com");
		assertThat(GuardianUtils.maskEmail("u@example.com")).isEqualTo("u***@example.com");
		assertThat(GuardianUtils.maskEmail("@example.com")).isEqualTo("***@example.com");
		assertThat(GuardianUtils.maskEmail("no-at-sign")).isEqualTo("***");
		assertThat(GuardianUtils.maskEmail(null)).isNull();
	}

	@Test
	void testIfUuid() {
		var uuid = UUID.randomUUID();
		assertThat(GuardianUtils.ifUuid(uuid.toString())).contains(uuid);
		assertThat(GuardianUtils.ifUuid("not-a-uuid")).isEmpty();
		assertThat(GuardianUtils.ifUuid(null)).isEmpty();
	}

	@Test
	void testReadResource() {
		StepVerifier.create(GuardianUtils.readResource("templates/token_code.en.subject.txt"))
			.assertNext(content -> assertThat(content).contains("{{app_name}}"))
			.verifyComplete();
		StepVerifier.create(GuardianUtils.readResource("templates/nothing.txt")).verifyComplete();
	}

	@Test
	void testEmailValidation() {
		ValidationUtils.field("email", "someone@example.com").email();
		ValidationUtils.field("email", " someone@example.com ").email();
		assertThatThrownBy(() -> ValidationUtils.field("email", null).email())
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("missing-email");
		assertThatThrownBy(() -> ValidationUtils.field("email", " ").email())
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("missing-email");
		assertThatThrownBy(() -> ValidationUtils.field("email", "someone").email())
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("invalid-email");
		assertThatThrownBy(() -> ValidationUtils.field("email", "someone@example").email())
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("invalid-email");
		assertThatThrownBy(() -> ValidationUtils.field("email", "a b@example.com").email())
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("invalid-email");
		assertThatThrownBy(() -> ValidationUtils.field("email", "a".repeat(250) + "@example.com").email())
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("invalid-email");
	}

	@Test
	void testDigitsValidation() {
		ValidationUtils.field("token", "012345").digits(6);
		assertThatThrownBy(() -> ValidationUtils.field("token", "12345").digits(6))
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("invalid-token");
		assertThatThrownBy(() -> ValidationUtils.field("token", "12345x").digits(6))
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("invalid-token");
		assertThatThrownBy(() -> ValidationUtils.field("token", "").digits(6))
			.isInstanceOf(BadRequestException.class).extracting("errorCode").isEqualTo("missing-token");
	}

}
