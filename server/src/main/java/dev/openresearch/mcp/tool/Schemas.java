package dev.openresearch.mcp.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * JSON schema fragments shared by the tool providers.
 */
final class Schemas {

	static final List<String> FORMATS = List.of("json", "markdown");

	private Schemas() {
	}

	static McpSchema.JsonSchema object(Map<String, Object> properties, List<String> required) {
		return new McpSchema.JsonSchema("object", properties, required, false, null, null);
	}

	static Map<String, Object> string(String description) {
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "string");
		schema.put("description", description);
		return schema;
	}

	static Map<String, Object> string(String description, String defaultValue) {
		Map<String, Object> schema = string(description);
		schema.put("default", defaultValue);
		return schema;
	}

	static Map<String, Object> enumeration(String description, List<String> values, String defaultValue) {
		Map<String, Object> schema = string(description, defaultValue);
		schema.put("enum", values);
		return schema;
	}

	static Map<String, Object> integer(String description, int defaultValue, int minimum, int maximum) {
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "integer");
		schema.put("description", description);
		schema.put("minimum", minimum);
		schema.put("maximum", maximum);
		schema.put("default", defaultValue);
		return schema;
	}

	static Map<String, Object> stringArray(String description) {
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "array");
		schema.put("items", Map.of("type", "string"));
		schema.put("minItems", 1);
		schema.put("description", description);
		return schema;
	}

	static Map<String, Object> enumArray(String description, List<String> values, List<String> defaultValues) {
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "array");
		schema.put("items", Map.of("type", "string", "enum", values));
		schema.put("default", defaultValues);
		schema.put("description", description);
		return schema;
	}

	static Map<String, Object> filters(String description, Map<String, Object> properties) {
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "object");
		schema.put("properties", properties);
		schema.put("description", description);
		return schema;
	}

	static Map<String, Object> format() {
		return enumeration("Response format: json (raw data) or markdown (formatted text).", FORMATS, "json");
	}

}
