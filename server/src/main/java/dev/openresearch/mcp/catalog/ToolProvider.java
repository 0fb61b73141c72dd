package dev.openresearch.mcp.catalog;

import java.util.List;

/**
 * Source of tool definitions collected into the {@link ToolCatalog} at startup.
 */
public interface ToolProvider {

	List<ToolDefinition> tools();

}
