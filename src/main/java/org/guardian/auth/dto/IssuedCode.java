package org.guardian.auth.dto;

import org.guardian.token.db.AuthTokenEntity;
import org.guardian.user.db.UserEntity;

import lombok.AllArgsConstructor;
import lombok.Data;

/** A code just stored for a user, with its plaintext value which only lives until it is delivered. */
@Data
@AllArgsConstructor
public class IssuedCode {

	private UserEntity user;
	private AuthTokenEntity token;
	private String code;

}
