package org.guardian.auth.dto;

import org.guardian.user.dto.User;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenValidationResponse {

	public static final String TOKEN_TYPE = "bearer";

	private String accessToken;
	private String tokenType;
	/** Seconds before the access token expires. */
	private long expiresIn;
	private User user;

}
