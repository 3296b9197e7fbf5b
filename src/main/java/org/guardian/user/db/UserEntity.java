package org.guardian.user.db;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table(UserEntity.TABLE_NAME)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UserEntity {

	public static final String TABLE_NAME = "users";

	@Id
	private UUID id;
	private String email;
	private boolean isActive;
	private long createdAt;
	private Long lastLogin;

}
