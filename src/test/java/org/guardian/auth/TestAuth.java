package org.guardian.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Map;

import org.guardian.auth.dto.LogoutResponse;
import org.guardian.auth.dto.TokenRequestResponse;
import org.guardian.auth.dto.TokenValidationResponse;
import org.guardian.global.exceptions.UnauthorizedException;
import org.guardian.ratelimit.RateLimitService;
import org.guardian.ratelimit.dto.RateLimitDecision;
import org.guardian.test.AbstractTest;
import org.guardian.test.TestUtils;
import org.guardian.test.stubs.MailgunStub;
import org.guardian.user.UserService;
import org.guardian.user.WhitelistProperties;
import org.guardian.user.dto.User;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import reactor.test.StepVerifier;

class TestAuth extends AbstractTest {

	@Autowired
	private RateLimitService rateLimitService;

	@Autowired
	private UserService userService;

	@Autowired
	private WhitelistProperties whitelist;

	@Test
	void testLoginScenario() {
		var user = test.createUser();
		String email = user.getEmail();

		var response = test.requestCode(email);
		assertThat(response.statusCode()).isEqualTo(200);
		var body = response.getBody().as(TokenRequestResponse.class);
		assertThat(body.getMessage()).isEqualTo(AuthService.CODE_REQUESTED_MESSAGE);
		assertThat(body.getEmail()).isEqualTo(email.charAt(0) + "***" + email.substring(email.indexOf('@')));
		assertThat(body.getExpiresInMinutes()).isEqualTo(2);

		String code = test.awaitCode(email);
		response = test.validateCode(email, code);
		assertThat(response.statusCode()).isEqualTo(200);
		var auth = response.getBody().as(TokenValidationResponse.class);
		assertThat(auth.getAccessToken()).isNotBlank();
		assertThat(auth.getTokenType()).isEqualTo("bearer");
		assertThat(auth.getExpiresIn()).isBetween(Duration.ofDays(7).toSeconds() - 1, Duration.ofDays(7).toSeconds());
		assertThat(auth.getUser().getId()).isEqualTo(user.getId());
		assertThat(auth.getUser().getEmail()).isEqualTo(email);
		assertThat(auth.getUser().isActive()).isTrue();
		assertThat(auth.getUser().getLastLogin()).isEqualTo(clock.millis());

		// a code is consumed by its first use
		TestUtils.expectError(test.validateCode(email, code), 401, UnauthorizedException.INVALID_CREDENTIALS);

		// second code of the window
		assertThat(test.requestCode(email).statusCode()).isEqualTo(200);
		String code2 = test.awaitCode(email, 2);
		StepVerifier.create(rateLimitService.check(email)).expectNext(RateLimitDecision.allow(0)).verifyComplete();
		assertThat(test.validateCode(email, code2).statusCode()).isEqualTo(200);
	}

	@Test
	void testEmailIsNormalized() {
		var user = test.createUser();
		String email = user.getEmail();
		assertThat(test.requestCode("  " + email.toUpperCase() + " ").statusCode()).isEqualTo(200);
		String code = test.awaitCode(email);
		var response = test.validateCode(email.toUpperCase(), code);
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(TokenValidationResponse.class).getUser().getEmail()).isEqualTo(email);
	}

	@Test
	void testUnknownEmailInWhitelistMode() {
		var known = test.createUser().getEmail();
		String unknown = test.email();

		var knownResponse = test.requestCode(known);
		var unknownResponse = test.requestCode(unknown);
		assertThat(unknownResponse.statusCode()).isEqualTo(knownResponse.statusCode()).isEqualTo(200);
		var knownBody = knownResponse.getBody().as(TokenRequestResponse.class);
		var unknownBody = unknownResponse.getBody().as(TokenRequestResponse.class);
		assertThat(unknownBody.getMessage()).isEqualTo(knownBody.getMessage());
		assertThat(unknownBody.getExpiresInMinutes()).isEqualTo(knownBody.getExpiresInMinutes());
		assertThat(unknownBody.getEmail()).endsWith(unknown.substring(unknown.indexOf('@')));

		test.awaitCode(known);
		assertThat(test.countCodesSent(unknown)).isZero();
		StepVerifier.create(userService.resolve(unknown)).verifyComplete();

		// never rate limited since nothing is issued
		for (int i = 0; i < 5; i++) assertThat(test.requestCode(unknown).statusCode()).isEqualTo(200);

		TestUtils.expectError(test.validateCode(unknown, "123456"), 401, UnauthorizedException.INVALID_CREDENTIALS);
	}

	@Test
	void testOpenRegistration() {
		whitelist.setEnabled(false);
		try {
			String email = test.email();
			assertThat(test.requestCode(email).statusCode()).isEqualTo(200);
			String code = test.awaitCode(email);
			StepVerifier.create(userService.resolve(email))
				.assertNext(user -> {
					assertThat(user.isActive()).isTrue();
					assertThat(user.getLastLogin()).isNull();
				})
				.verifyComplete();
			assertThat(test.validateCode(email, code).statusCode()).isEqualTo(200);
		} finally {
			whitelist.setEnabled(true);
		}
	}

	@Test
	void testInitialUserCanLogin() {
		var logged = test.login("first.user@guardian.test");
		assertThat(logged.getAuth().getUser().getEmail()).isEqualTo("first.user@guardian.test");
	}

	@Test
	void testRateLimited() {
		String email = test.createUser().getEmail();
		for (int i = 0; i < 3; i++) assertThat(test.requestCode(email).statusCode()).isEqualTo(200);

		var response = test.requestCode(email);
		var error = TestUtils.expectError(response, 429, "rate-limited");
		assertThat(response.getHeader("Retry-After")).isEqualTo("900");
		assertThat(error.getRetryAfter()).isEqualTo(900L);

		clock.advance(Duration.ofMinutes(10));
		response = test.requestCode(email);
		TestUtils.expectError(response, 429, "rate-limited");
		assertThat(response.getHeader("Retry-After")).isEqualTo("300");

		clock.advance(Duration.ofMinutes(5).plusMillis(1));
		assertThat(test.requestCode(email).statusCode()).isEqualTo(200);
		test.awaitCode(email, 4);
	}

	@Test
	void testInvalidCodes() {
		String email = test.createUser().getEmail();
		assertThat(test.requestCode(email).statusCode()).isEqualTo(200);
		String code = test.awaitCode(email);
		String wrong = code.equals("000000") ? "000001" : "000000";

		TestUtils.expectError(test.validateCode(email, wrong), 401, UnauthorizedException.INVALID_CREDENTIALS);
		TestUtils.expectError(test.validateCode(test.email(), code), 401, UnauthorizedException.INVALID_CREDENTIALS);
		TestUtils.expectError(test.validateCode(email, "12345"), 400, "invalid-token");
		TestUtils.expectError(test.validateCode(email, "abcdef"), 400, "invalid-token");
		TestUtils.expectError(test.validateCode("not-an-email", code), 400, "invalid-email");

		// failed attempts do not consume the code
		assertThat(test.validateCode(email, code).statusCode()).isEqualTo(200);
	}

	@Test
	void testInvalidEmail() {
		TestUtils.expectError(test.requestCode("not-an-email"), 400, "invalid-email");
		TestUtils.expectError(test.requestCode(""), 400, "invalid-email");
		var response = RestAssured.given().contentType(ContentType.JSON).body(Map.of()).post("/api/auth/v1/request-token");
		TestUtils.expectError(response, 400, "invalid-email");
	}

	@Test
	void testExpiredCode() {
		String email = test.createUser().getEmail();
		assertThat(test.requestCode(email).statusCode()).isEqualTo(200);
		String code = test.awaitCode(email);
		clock.advance(Duration.ofMinutes(2));
		TestUtils.expectError(test.validateCode(email, code), 401, UnauthorizedException.INVALID_CREDENTIALS);
	}

	@Test
	void testMeRefreshLogout() {
		var logged = test.createUserAndLogin();

		var response = logged.request().get("/api/auth/v1/me");
		assertThat(response.statusCode()).isEqualTo(200);
		var me = response.getBody().as(User.class);
		assertThat(me.getEmail()).isEqualTo(logged.getEmail());
		assertThat(me.getId()).isEqualTo(logged.getAuth().getUser().getId());
		assertThat(me.isActive()).isTrue();
		assertThat(response.getBody().jsonPath().getBoolean("isActive")).isTrue();

		clock.advance(Duration.ofHours(1));
		response = logged.request().post("/api/auth/v1/refresh");
		assertThat(response.statusCode()).isEqualTo(200);
		var refreshed = response.getBody().as(TokenValidationResponse.class);
		assertThat(refreshed.getAccessToken()).isNotEqualTo(logged.getAuth().getAccessToken());
		assertThat(refreshed.getTokenType()).isEqualTo("bearer");
		assertThat(refreshed.getUser().getEmail()).isEqualTo(logged.getEmail());

		response = RestAssured.given().header("Authorization", "Bearer " + refreshed.getAccessToken()).get("/api/auth/v1/me");
		assertThat(response.statusCode()).isEqualTo(200);

		response = logged.request().post("/api/auth/v1/logout");
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(LogoutResponse.class).getMessage()).isEqualTo(AuthService.LOGOUT_MESSAGE);
	}

	@Test
	void testBearerRequired() {
		var logged = test.createUserAndLogin();
		assertThat(RestAssured.given().get("/api/auth/v1/me").statusCode()).isEqualTo(401);
		assertThat(RestAssured.given().post("/api/auth/v1/refresh").statusCode()).isEqualTo(401);
		assertThat(RestAssured.given().post("/api/auth/v1/logout").statusCode()).isEqualTo(401);
		assertThat(RestAssured.given().header("Authorization", "Bearer ").get("/api/auth/v1/me").statusCode()).isEqualTo(401);
		assertThat(RestAssured.given().header("Authorization", "Basic abc").get("/api/auth/v1/me").statusCode()).isEqualTo(401);

		String token = logged.getAuth().getAccessToken();
		String[] parts = token.split("\\.");
		String tampered = parts[0] + "." + parts[1] + "." + (parts[2].charAt(0) == 'A' ? 'B' : 'A') + parts[2].substring(1);
		assertThat(RestAssured.given().header("Authorization", "Bearer " + tampered).get("/api/auth/v1/me").statusCode()).isEqualTo(401);
	}

	@Test
	void testSessionExpires() {
		var logged = test.createUserAndLogin();
		clock.advance(Duration.ofDays(7));
		assertThat(logged.request().get("/api/auth/v1/me").statusCode()).isEqualTo(401);
	}

	@Test
	void testInactiveUser() {
		var logged = test.createUserAndLogin();
		String email = logged.getEmail();
		assertThat(test.requestCode(email).statusCode()).isEqualTo(200);
		String pendingCode = test.awaitCode(email, 2);

		test.deactivate(email);

		assertThat(logged.request().get("/api/auth/v1/me").statusCode()).isEqualTo(401);
		TestUtils.expectError(test.validateCode(email, pendingCode), 401, UnauthorizedException.INVALID_CREDENTIALS);

		var response = test.requestCode(email);
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(TokenRequestResponse.class).getMessage()).isEqualTo(AuthService.CODE_REQUESTED_MESSAGE);
		StepVerifier.create(userService.setActive(email, true)).expectNext(true).verifyComplete();
		// nothing was issued while inactive
		StepVerifier.create(rateLimitService.check(email)).expectNext(RateLimitDecision.allow(0)).verifyComplete();
		assertThat(test.countCodesSent(email)).isEqualTo(2);
	}

	@Test
	void testDeliveryFailureDoesNotChangeResponse() {
		MailgunStub.stubFailure(wireMockServer);
		String email = test.createUser().getEmail();
		var response = test.requestCode(email);
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.getBody().as(TokenRequestResponse.class).getMessage()).isEqualTo(AuthService.CODE_REQUESTED_MESSAGE);
		// the code was issued even if it could not be delivered
		StepVerifier.create(rateLimitService.check(email)).expectNext(RateLimitDecision.allow(1)).verifyComplete();
	}

}
