package org.guardian.session.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SessionToken {

	private String token;
	private Instant expiresAt;

}
