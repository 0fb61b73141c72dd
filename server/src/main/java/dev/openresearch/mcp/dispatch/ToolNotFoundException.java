package dev.openresearch.mcp.dispatch;

import java.util.List;

/**
 * Raised for a call naming a tool that is not in the catalog.
 */
public class ToolNotFoundException extends RuntimeException {

	private final String toolName;

	private final List<String> availableTools;

	public ToolNotFoundException(String toolName, List<String> availableTools) {
		super("Unknown tool: " + toolName + ". Available tools: " + String.join(", ", availableTools));
		this.toolName = toolName;
		this.availableTools = List.copyOf(availableTools);
	}

	public String getToolName() {
		return toolName;
	}

	public List<String> getAvailableTools() {
		return availableTools;
	}

}
