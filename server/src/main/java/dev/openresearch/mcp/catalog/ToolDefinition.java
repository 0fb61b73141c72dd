package dev.openresearch.mcp.catalog;

import java.util.Objects;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * A named tool: its descriptive metadata, input schema and the handler that executes it.
 * @param name unique tool name
 * @param title short human readable title
 * @param description description shown to clients
 * @param inputSchema JSON schema of the accepted arguments
 * @param handler handler invoked on {@code tools/call}
 */
public record ToolDefinition(String name, String title, String description, McpSchema.JsonSchema inputSchema,
		ToolHandler handler) {

	public ToolDefinition {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(inputSchema, "inputSchema must not be null");
		Objects.requireNonNull(handler, "handler must not be null");
	}

	/**
	 * Protocol view of this definition, as returned by {@code tools/list}.
	 * @return tool metadata without the handler
	 */
	public McpSchema.Tool toTool() {
		return McpSchema.Tool.builder()
			.name(name)
			.title(title)
			.description(description)
			.inputSchema(inputSchema)
			.build();
	}

}
