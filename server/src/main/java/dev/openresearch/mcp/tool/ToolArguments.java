package dev.openresearch.mcp.tool;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes the raw argument map of a tool call into a typed argument record. Records validate and
 * default their own components; the helpers below are shared by those compact constructors.
 */
@Component
public class ToolArguments {

	private final ObjectMapper objectMapper;

	public ToolArguments(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Convert raw arguments into the given record type.
	 * @param arguments raw arguments from the client
	 * @param type target record type
	 * @param <T> argument type
	 * @return decoded arguments
	 * @throws InvalidToolArgumentsException when decoding or validation fails
	 */
	public <T> T decode(Map<String, Object> arguments, Class<T> type) {
		try {
			return objectMapper.convertValue(arguments != null ? arguments : Map.of(), type);
		}
		catch (IllegalArgumentException ex) {
			throw new InvalidToolArgumentsException("Invalid arguments: " + rootMessage(ex), ex);
		}
	}

	static String requireText(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new InvalidToolArgumentsException(name + " is required");
		}
		return value.trim();
	}

	static List<String> requireNonEmpty(List<String> values, String name) {
		if (values == null || values.isEmpty()) {
			throw new InvalidToolArgumentsException(name + " must contain at least one entry");
		}
		for (String value : values) {
			requireText(value, name + " entry");
		}
		return List.copyOf(values);
	}

	static int inRange(Integer value, int defaultValue, int minimum, int maximum, String name) {
		int resolved = value != null ? value : defaultValue;
		if (resolved < minimum || resolved > maximum) {
			throw new InvalidToolArgumentsException(
					"%s must be between %d and %d, got %d".formatted(name, minimum, maximum, resolved));
		}
		return resolved;
	}

	static String oneOf(String value, String defaultValue, List<String> allowed, String name) {
		String resolved = value != null && !value.isBlank() ? value.trim() : defaultValue;
		if (!allowed.contains(resolved)) {
			throw new InvalidToolArgumentsException(name + " must be one of " + allowed + ", got " + resolved);
		}
		return resolved;
	}

	static List<String> allOf(List<String> values, List<String> defaultValues, List<String> allowed, String name) {
		List<String> resolved = values != null && !values.isEmpty() ? values : defaultValues;
		for (String value : resolved) {
			if (!allowed.contains(value)) {
				throw new InvalidToolArgumentsException(name + " entries must be one of " + allowed + ", got " + value);
			}
		}
		return List.copyOf(resolved);
	}

	private static String rootMessage(Throwable failure) {
		Throwable root = failure;
		while (root.getCause() != null && root.getCause() != root) {
			root = root.getCause();
		}
		if (root instanceof JsonProcessingException jsonFailure) {
			return jsonFailure.getOriginalMessage();
		}
		return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
	}

}
