package org.guardian.token.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table(AuthTokenEntity.TABLE_NAME)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class AuthTokenEntity {

	public static final String TABLE_NAME = "auth_tokens";

	@Id
	private UUID id;
	private UUID userId;
	private String tokenHash;
	private long expiresAt;
	private Long usedAt;
	private long createdAt;

}
