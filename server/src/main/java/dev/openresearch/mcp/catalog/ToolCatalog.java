package dev.openresearch.mcp.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Immutable registry of tools keyed by name. The listing and the dispatch table are derived from the
 * same map, so every listed tool can be resolved and nothing unlisted can be. Registering the same
 * name twice fails at construction.
 */
public final class ToolCatalog {

	private final Map<String, ToolDefinition> definitions;

	private final List<McpSchema.Tool> tools;

	public ToolCatalog(List<ToolDefinition> definitions) {
		Map<String, ToolDefinition> byName = new LinkedHashMap<>();
		for (ToolDefinition definition : definitions) {
			if (byName.putIfAbsent(definition.name(), definition) != null) {
				throw new IllegalStateException("Duplicate tool name: " + definition.name());
			}
		}
		if (byName.isEmpty()) {
			throw new IllegalStateException("Tool catalog must contain at least one tool");
		}
		this.definitions = Collections.unmodifiableMap(byName);
		this.tools = byName.values().stream().map(ToolDefinition::toTool).collect(Collectors.toUnmodifiableList());
	}

	/**
	 * Build a catalog from every provider, keeping provider order.
	 * @param providers tool providers
	 * @return catalog holding all provided tools
	 */
	public static ToolCatalog fromProviders(List<? extends ToolProvider> providers) {
		List<ToolDefinition> definitions = new ArrayList<>();
		providers.forEach(provider -> definitions.addAll(provider.tools()));
		return new ToolCatalog(definitions);
	}

	/**
	 * Listing of every tool in registration order.
	 * @return unmodifiable list, identical across calls
	 */
	public List<McpSchema.Tool> allDefinitions() {
		return tools;
	}

	/**
	 * Look up a tool by its exact name.
	 * @param name tool name, may be {@code null}
	 * @return the definition, or empty when no tool has that name
	 */
	public Optional<ToolDefinition> resolve(String name) {
		return Optional.ofNullable(name).map(definitions::get);
	}

	/**
	 * Names of all tools in registration order.
	 * @return immutable list of names
	 */
	public List<String> names() {
		return List.copyOf(definitions.keySet());
	}

	/**
	 * @return number of registered tools
	 */
	public int size() {
		return definitions.size();
	}

}
