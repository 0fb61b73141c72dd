package dev.openresearch.mcp.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import dev.openresearch.backend.ResearchBackendClient;
import dev.openresearch.mcp.catalog.ToolDefinition;
import dev.openresearch.mcp.catalog.ToolProvider;
import dev.openresearch.mcp.config.ToolProperties;
import dev.openresearch.mcp.format.MarkdownRenderer;
import dev.openresearch.mcp.format.ResponseFormat;
import dev.openresearch.mcp.format.ToolResponseWriter;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;

/**
 * Author tools: search, details and publication lists.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class AuthorTools implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(AuthorTools.class);

	private final ResearchBackendClient backendClient;

	private final ToolArguments toolArguments;

	private final ToolResponseWriter responseWriter;

	private final MarkdownRenderer markdownRenderer;

	private final ToolProperties toolProperties;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("search_authors", "Search authors",
						"Search authors by name, with optional affiliation and research area filters.",
						searchAuthorsSchema(), this::handleSearchAuthors),
				new ToolDefinition("get_author_details", "Get author details",
						"Fetch profiles of authors by identifier.", authorDetailsSchema(),
						this::handleAuthorDetails),
				new ToolDefinition("get_author_papers", "Get author papers", "List the papers written by an author.",
						authorPapersSchema(), this::handleAuthorPapers));
	}

	private McpSchema.CallToolResult handleSearchAuthors(Map<String, Object> arguments) throws JsonProcessingException {
		SearchAuthorsArguments args = toolArguments.decode(arguments, SearchAuthorsArguments.class);
		logger.debug("Searching authors for '{}'", args.query());
		Map<String, Object> result = backendClient.searchAuthors(args.query(), args.filters(),
				toolProperties.clampLimit(args.limit()));
		return responseWriter.write(args.format(), result, () -> markdownRenderer.authorSearch(result, args.query()));
	}

	private McpSchema.CallToolResult handleAuthorDetails(Map<String, Object> arguments) throws JsonProcessingException {
		AuthorDetailsArguments args = toolArguments.decode(arguments, AuthorDetailsArguments.class);
		Map<String, Object> result = backendClient.getAuthorDetails(args.authorIds());
		return responseWriter.write(args.format(), result, () -> markdownRenderer.authorDetails(result));
	}

	private McpSchema.CallToolResult handleAuthorPapers(Map<String, Object> arguments) throws JsonProcessingException {
		AuthorPapersArguments args = toolArguments.decode(arguments, AuthorPapersArguments.class);
		Map<String, Object> result = backendClient.getAuthorPapers(args.authorId(),
				toolProperties.clampLimit(args.limit()));
		return responseWriter.write(args.format(), result,
				() -> markdownRenderer.authorPapers(result, args.authorId()));
	}

	private McpSchema.JsonSchema searchAuthorsSchema() {
		Map<String, Object> filterProperties = new LinkedHashMap<>();
		filterProperties.put("affiliation", Schemas.string("Institution name."));
		filterProperties.put("research_area", Schemas.string("Research area."));

		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("query", Schemas.string("Author name to search for."));
		properties.put("filters", Schemas.filters("Optional search filters.", filterProperties));
		properties.put("limit", Schemas.integer("Maximum number of authors.", 20, 1, 100));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("query"));
	}

	private McpSchema.JsonSchema authorDetailsSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("author_ids", Schemas.stringArray("Author identifiers."));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("author_ids"));
	}

	private McpSchema.JsonSchema authorPapersSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("author_id", Schemas.string("Author identifier."));
		properties.put("limit", Schemas.integer("Maximum number of papers.", 20, 1, 100));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("author_id"));
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record SearchAuthorsArguments(String query, Map<String, Object> filters, Integer limit,
			ResponseFormat format) {

		public SearchAuthorsArguments {
			query = ToolArguments.requireText(query, "query");
			filters = filters != null ? filters : Map.of();
			limit = ToolArguments.inRange(limit, 20, 1, 100, "limit");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record AuthorDetailsArguments(@JsonProperty("author_ids") List<String> authorIds, ResponseFormat format) {

		public AuthorDetailsArguments {
			authorIds = ToolArguments.requireNonEmpty(authorIds, "author_ids");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record AuthorPapersArguments(@JsonProperty("author_id") String authorId, Integer limit,
			ResponseFormat format) {

		public AuthorPapersArguments {
			authorId = ToolArguments.requireText(authorId, "author_id");
			limit = ToolArguments.inRange(limit, 20, 1, 100, "limit");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

}
