package dev.openresearch.mcp.dispatch;

/**
 * Wraps any failure thrown while a tool handler runs.
 */
public class ToolExecutionException extends RuntimeException {

	private final String toolName;

	public ToolExecutionException(String toolName, Throwable cause) {
		super("Tool execution failed: " + describe(cause), cause);
		this.toolName = toolName;
	}

	public String getToolName() {
		return toolName;
	}

	private static String describe(Throwable cause) {
		String message = cause.getMessage();
		return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
	}

}
