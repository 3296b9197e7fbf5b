package org.guardian.user.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

	private UUID id;
	private String email;
	private long createdAt;
	private Long lastLogin;
	@JsonProperty("isActive")
	private boolean active;

}
