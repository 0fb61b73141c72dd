package dev.openresearch.mcp.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import dev.openresearch.backend.ResearchBackendClient;
import dev.openresearch.mcp.catalog.ToolDefinition;
import dev.openresearch.mcp.catalog.ToolProvider;
import dev.openresearch.mcp.format.MarkdownRenderer;
import dev.openresearch.mcp.format.ResponseFormat;
import dev.openresearch.mcp.format.ToolResponseWriter;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;

/**
 * Graph tools over citations and co-authorship.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class NetworkTools implements ToolProvider {

	static final List<String> DIRECTIONS = List.of("incoming", "outgoing", "both");

	private final ResearchBackendClient backendClient;

	private final ToolArguments toolArguments;

	private final ToolResponseWriter responseWriter;

	private final MarkdownRenderer markdownRenderer;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("get_citation_network", "Get citation network",
						"Build the citation graph around seed papers.", citationNetworkSchema(),
						this::handleCitationNetwork),
				new ToolDefinition("get_collaboration_network", "Get collaboration network",
						"Build the co-authorship graph around authors.", collaborationNetworkSchema(),
						this::handleCollaborationNetwork));
	}

	private McpSchema.CallToolResult handleCitationNetwork(Map<String, Object> arguments)
			throws JsonProcessingException {
		CitationNetworkArguments args = toolArguments.decode(arguments, CitationNetworkArguments.class);
		Map<String, Object> result = backendClient.getCitationNetwork(args.seedPapers(), args.depth(),
				args.direction(), args.maxNodes());
		return responseWriter.write(args.format(), result, () -> markdownRenderer.citationNetwork(result));
	}

	private McpSchema.CallToolResult handleCollaborationNetwork(Map<String, Object> arguments)
			throws JsonProcessingException {
		CollaborationNetworkArguments args = toolArguments.decode(arguments, CollaborationNetworkArguments.class);
		Map<String, Object> result = backendClient.getCollaborationNetwork(args.authors(), args.timeRange(),
				args.maxNodes());
		return responseWriter.write(args.format(), result, () -> markdownRenderer.collaborationNetwork(result));
	}

	private McpSchema.JsonSchema citationNetworkSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("seed_papers", Schemas.stringArray("Identifiers of the papers to start from."));
		properties.put("depth", Schemas.integer("Traversal depth.", 2, 1, 3));
		properties.put("direction", Schemas.enumeration(
				"Citation direction: incoming (cited by), outgoing (cites) or both.", DIRECTIONS, "both"));
		properties.put("max_nodes", Schemas.integer("Maximum number of nodes.", 50, 10, 200));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("seed_papers"));
	}

	private McpSchema.JsonSchema collaborationNetworkSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("authors", Schemas.stringArray("Author identifiers."));
		properties.put("time_range", Schemas.string("Year range, formatted YYYY-YYYY."));
		properties.put("max_nodes", Schemas.integer("Maximum number of nodes.", 50, 10, 200));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("authors"));
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CitationNetworkArguments(@JsonProperty("seed_papers") List<String> seedPapers, Integer depth,
			String direction, @JsonProperty("max_nodes") Integer maxNodes, ResponseFormat format) {

		public CitationNetworkArguments {
			seedPapers = ToolArguments.requireNonEmpty(seedPapers, "seed_papers");
			depth = ToolArguments.inRange(depth, 2, 1, 3, "depth");
			direction = ToolArguments.oneOf(direction, "both", DIRECTIONS, "direction");
			maxNodes = ToolArguments.inRange(maxNodes, 50, 10, 200, "max_nodes");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CollaborationNetworkArguments(List<String> authors, @JsonProperty("time_range") String timeRange,
			@JsonProperty("max_nodes") Integer maxNodes, ResponseFormat format) {

		public CollaborationNetworkArguments {
			authors = ToolArguments.requireNonEmpty(authors, "authors");
			timeRange = timeRange != null && !timeRange.isBlank() ? timeRange.trim() : null;
			maxNodes = ToolArguments.inRange(maxNodes, 50, 10, 200, "max_nodes");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

}
