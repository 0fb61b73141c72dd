package dev.openresearch.mcp.format;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presentation of a tool result requested through the {@code format} argument.
 */
public enum ResponseFormat {

	JSON("json"), MARKDOWN("markdown");

	private final String value;

	ResponseFormat(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	/**
	 * Parse a client supplied format name, case insensitively.
	 * @param value format name, {@code null} selects {@link #JSON}
	 * @return matching format
	 * @throws IllegalArgumentException for unknown names
	 */
	@JsonCreator
	public static ResponseFormat from(String value) {
		if (value == null || value.isBlank()) {
			return JSON;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (ResponseFormat format : values()) {
			if (format.value.equals(normalized)) {
				return format;
			}
		}
		throw new IllegalArgumentException("Unsupported format '" + value + "', expected json or markdown");
	}

}
