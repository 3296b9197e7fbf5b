package org.guardian.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenValidation {

	@NotBlank
	@Size(max = 255)
	private String email;

	@NotBlank
	private String token;

}
