package dev.openresearch.mcp.catalog;

import java.util.Map;

/**
 * Executes one tool with the raw argument map received from the client. The return value is
 * coerced into protocol content by the dispatcher; any exception becomes a tool error result.
 */
@FunctionalInterface
public interface ToolHandler {

	Object handle(Map<String, Object> arguments) throws Exception;

}
