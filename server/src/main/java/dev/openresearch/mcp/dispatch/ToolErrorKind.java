package dev.openresearch.mcp.dispatch;

/**
 * Categories of failures reported by the dispatcher in error results.
 */
public enum ToolErrorKind {

	TOOL_NOT_FOUND, TOOL_EXECUTION

}
