package org.guardian.session.dto;

import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SessionClaims {

	private UUID subject;
	private String email;
	private boolean active;
	private Instant issuedAt;
	private Instant expiresAt;

}
