package dev.openresearch.mcp.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
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
 * Paper tools: free text search, details resolved from titles and citation lookups.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class PaperTools implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(PaperTools.class);

	static final int TITLE_MATCH_CANDIDATES = 5;

	private final ResearchBackendClient backendClient;

	private final ToolArguments toolArguments;

	private final ToolResponseWriter responseWriter;

	private final MarkdownRenderer markdownRenderer;

	private final ToolProperties toolProperties;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(searchPapersTool(), paperDetailsTool(), paperCitationsTool());
	}

	ToolDefinition searchPapersTool() {
		return new ToolDefinition("search_papers", "Search papers",
				"Search academic papers by title keywords, with optional filters on keywords, author, year, venue or DOI.",
				searchPapersSchema(), this::handleSearchPapers);
	}

	ToolDefinition paperDetailsTool() {
		return new ToolDefinition("get_paper_details", "Get paper details",
				"Look up full details of papers by title. Each title is matched against search results.",
				paperDetailsSchema(), this::handlePaperDetails);
	}

	ToolDefinition paperCitationsTool() {
		return new ToolDefinition("get_paper_citations", "Get paper citations",
				"List the papers citing a paper and the papers it cites.", paperCitationsSchema(),
				this::handlePaperCitations);
	}

	private McpSchema.CallToolResult handleSearchPapers(Map<String, Object> arguments) throws JsonProcessingException {
		SearchPapersArguments args = toolArguments.decode(arguments, SearchPapersArguments.class);
		int limit = toolProperties.clampLimit(args.limit());
		logger.debug("Searching papers for '{}' (limit {}, offset {})", args.query(), limit, args.offset());
		Map<String, Object> result = backendClient.searchPapers(args.query(), args.filters(), args.sortBy(), limit,
				args.offset());
		return responseWriter.write(args.format(), result, () -> markdownRenderer.paperSearch(result, args.query()));
	}

	private McpSchema.CallToolResult handlePaperDetails(Map<String, Object> arguments) throws JsonProcessingException {
		PaperDetailsArguments args = toolArguments.decode(arguments, PaperDetailsArguments.class);
		List<Map<String, Object>> matched = new ArrayList<>();
		List<String> unmatched = new ArrayList<>();
		for (String title : args.titles()) {
			Map<String, Object> found = backendClient.searchPapers(title, null, "relevance", TITLE_MATCH_CANDIDATES, 0);
			List<Map<String, Object>> candidates = papers(found);
			if (candidates.isEmpty()) {
				logger.info("No paper found for title '{}'", title);
				unmatched.add(title);
			}
			else {
				matched.add(bestTitleMatch(title, candidates));
			}
		}
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("papers", matched);
		payload.put("count", matched.size());
		payload.put("not_found", unmatched);
		return responseWriter.write(args.format(), payload, () -> markdownRenderer.paperDetails(matched, unmatched));
	}

	private McpSchema.CallToolResult handlePaperCitations(Map<String, Object> arguments)
			throws JsonProcessingException {
		PaperCitationsArguments args = toolArguments.decode(arguments, PaperCitationsArguments.class);
		Map<String, Object> result = backendClient.getPaperCitations(args.paperId());
		return responseWriter.write(args.format(), result,
				() -> markdownRenderer.paperCitations(result, args.paperId()));
	}

	/**
	 * Pick the candidate whose title best matches the requested one: an exact case-insensitive
	 * match, then a title containing or contained in the request, then the first candidate.
	 * @param title requested title
	 * @param candidates search results, not empty
	 * @return best matching candidate
	 */
	static Map<String, Object> bestTitleMatch(String title, List<Map<String, Object>> candidates) {
		String wanted = title.trim().toLowerCase(Locale.ROOT);
		for (Map<String, Object> candidate : candidates) {
			if (wanted.equals(candidateTitle(candidate))) {
				return candidate;
			}
		}
		for (Map<String, Object> candidate : candidates) {
			String candidateTitle = candidateTitle(candidate);
			if (!candidateTitle.isEmpty() && (candidateTitle.contains(wanted) || wanted.contains(candidateTitle))) {
				return candidate;
			}
		}
		return candidates.get(0);
	}

	private static String candidateTitle(Map<String, Object> candidate) {
		Object value = candidate.get("title");
		return value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
	}

	@SuppressWarnings("unchecked")
	private static List<Map<String, Object>> papers(Map<String, Object> result) {
		List<Map<String, Object>> papers = new ArrayList<>();
		if (result.get("papers") instanceof List<?> items) {
			for (Object item : items) {
				if (item instanceof Map<?, ?>) {
					papers.add((Map<String, Object>) item);
				}
			}
		}
		return papers;
	}

	private McpSchema.JsonSchema searchPapersSchema() {
		Map<String, Object> filterProperties = new LinkedHashMap<>();
		filterProperties.put("keywords", Schemas.string("Keywords the paper must carry."));
		filterProperties.put("author", Schemas.string("Author name."));
		filterProperties.put("year", Map.of("type", "integer", "description", "Publication year."));
		filterProperties.put("venue", Schemas.string("Conference or journal name."));
		filterProperties.put("doi", Schemas.string("DOI."));

		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("query", Schemas.string("Search query, matched against title keywords."));
		properties.put("filters", Schemas.filters("Optional search filters.", filterProperties));
		properties.put("sort_by", Schemas.string("Sort key.", "relevance"));
		properties.put("limit", Schemas.integer("Maximum number of papers.", 20, 1, 100));
		properties.put("offset", Schemas.integer("Number of results to skip.", 0, 0, 10_000));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("query"));
	}

	private McpSchema.JsonSchema paperDetailsSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("titles", Schemas.stringArray("Paper titles to look up."));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("titles"));
	}

	private McpSchema.JsonSchema paperCitationsSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("paper_id", Schemas.string("Paper identifier."));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("paper_id"));
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record SearchPapersArguments(String query, Map<String, Object> filters,
			@JsonProperty("sort_by") String sortBy, Integer limit, Integer offset, ResponseFormat format) {

		public SearchPapersArguments {
			query = ToolArguments.requireText(query, "query");
			filters = filters != null ? filters : Map.of();
			sortBy = sortBy != null && !sortBy.isBlank() ? sortBy : "relevance";
			limit = ToolArguments.inRange(limit, 20, 1, 100, "limit");
			offset = ToolArguments.inRange(offset, 0, 0, 10_000, "offset");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record PaperDetailsArguments(List<String> titles, ResponseFormat format) {

		public PaperDetailsArguments {
			titles = ToolArguments.requireNonEmpty(titles, "titles");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record PaperCitationsArguments(@JsonProperty("paper_id") String paperId, ResponseFormat format) {

		public PaperCitationsArguments {
			paperId = ToolArguments.requireText(paperId, "paper_id");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

}
