package org.guardian.global.exceptions;

import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationUtils {

	public static final String INVALID_PREFIX = "invalid-";
	public static final String MISSING_PREFIX = "missing-";

	public static final int EMAIL_MAX_LENGTH = 255;

	private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

	public static FieldString field(String name, String value) {
		return new FieldString(name, value);
	}

	@RequiredArgsConstructor
	public static class FieldString {

		protected final String name;
		protected final String value;

		public FieldString notNull() {
			if (value == null) throw new BadRequestException(MISSING_PREFIX + name, name + " cannot be null");
			return this;
		}

		public FieldString notBlank() {
			notNull();
			if (value.isBlank()) throw new BadRequestException(MISSING_PREFIX + name, name + " cannot be empty");
			return this;
		}

		public FieldString maxLength(int max) {
			if (value.length() > max) throw new BadRequestException(INVALID_PREFIX + name, name + " exceeds the maximum length of " + max + " characters");
			return this;
		}

		public FieldString email() {
			notBlank();
			maxLength(EMAIL_MAX_LENGTH);
			if (!EMAIL.matcher(value.trim()).matches()) throw new BadRequestException(INVALID_PREFIX + name, "Invalid " + name + ": not a valid email address");
			return this;
		}

		public FieldString digits(int length) {
			notBlank();
			if (value.length() != length || !value.chars().allMatch(c -> c >= '0' && c <= '9'))
				throw new BadRequestException(INVALID_PREFIX + name, "Invalid " + name + ": expected " + length + " digits");
			return this;
		}

	}
}
