package org.guardian.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequestResponse {

	private String message;
	/** Masked email, the same whether or not a code was issued. */
	private String email;
	private long expiresInMinutes;

}
