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
 * Trend tools: trending papers, popular keywords and domain level analyses.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class TrendTools implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(TrendTools.class);

	static final List<String> TIME_WINDOWS = List.of("week", "month", "year");

	static final List<String> METRICS = List.of("publication_count", "citation_count", "author_count");

	static final List<String> GRANULARITIES = List.of("year", "quarter", "month");

	static final List<String> DIMENSIONS = List.of("topics", "authors", "trends", "institutions");

	static final String DEFAULT_TIME_RANGE = "2020-2024";

	private final ResearchBackendClient backendClient;

	private final ToolArguments toolArguments;

	private final ToolResponseWriter responseWriter;

	private final MarkdownRenderer markdownRenderer;

	private final ToolProperties toolProperties;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("get_trending_papers", "Get trending papers",
						"List the most popular papers of the past week, month or year.", trendingPapersSchema(),
						this::handleTrendingPapers),
				new ToolDefinition("get_top_keywords", "Get top keywords",
						"List the research keywords attached to the most papers.", topKeywordsSchema(),
						this::handleTopKeywords),
				new ToolDefinition("analyze_domain_trends", "Analyze domain trends",
						"Analyze how a research domain evolves over time.", domainTrendsSchema(),
						this::handleDomainTrends),
				new ToolDefinition("analyze_research_landscape", "Analyze research landscape",
						"Summarize a research domain: hot topics, active authors, emerging trends and institutions.",
						landscapeSchema(), this::handleLandscape));
	}

	private McpSchema.CallToolResult handleTrendingPapers(Map<String, Object> arguments)
			throws JsonProcessingException {
		TrendingPapersArguments args = toolArguments.decode(arguments, TrendingPapersArguments.class);
		Map<String, Object> result = backendClient.getTrendingPapers(args.timeWindow(),
				toolProperties.clampLimit(args.limit()));
		return responseWriter.write(args.format(), result,
				() -> markdownRenderer.trendingPapers(result, args.timeWindow()));
	}

	private McpSchema.CallToolResult handleTopKeywords(Map<String, Object> arguments) throws JsonProcessingException {
		TopKeywordsArguments args = toolArguments.decode(arguments, TopKeywordsArguments.class);
		Map<String, Object> result = backendClient.getTopKeywords(toolProperties.clampLimit(args.limit()),
				args.timeRange());
		return responseWriter.write(args.format(), result, () -> markdownRenderer.topKeywords(result));
	}

	private McpSchema.CallToolResult handleDomainTrends(Map<String, Object> arguments) throws JsonProcessingException {
		DomainTrendsArguments args = toolArguments.decode(arguments, DomainTrendsArguments.class);
		logger.debug("Analyzing trends of {} over {} by {}", args.domain(), args.timeRange(), args.granularity());
		Map<String, Object> result = backendClient.getResearchTrends(args.domain(), args.timeRange(), args.metrics(),
				args.granularity());
		return responseWriter.write(args.format(), result,
				() -> markdownRenderer.domainTrends(result, args.domain()));
	}

	private McpSchema.CallToolResult handleLandscape(Map<String, Object> arguments) throws JsonProcessingException {
		LandscapeArguments args = toolArguments.decode(arguments, LandscapeArguments.class);
		Map<String, Object> result = backendClient.analyzeResearchLandscape(args.domain(), args.analysisDimensions());
		return responseWriter.write(args.format(), result, () -> markdownRenderer.landscape(result, args.domain()));
	}

	private McpSchema.JsonSchema trendingPapersSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("time_window", Schemas.enumeration("Time window.", TIME_WINDOWS, "month"));
		properties.put("limit", Schemas.integer("Maximum number of papers.", 20, 1, 100));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of());
	}

	private McpSchema.JsonSchema topKeywordsSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("limit", Schemas.integer("Maximum number of keywords.", 20, 1, 100));
		properties.put("time_range", Schemas.string("Year range, formatted YYYY-YYYY."));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of());
	}

	private McpSchema.JsonSchema domainTrendsSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("domain", Schemas.string("Research domain name."));
		properties.put("time_range", Schemas.string("Year range, formatted YYYY-YYYY.", DEFAULT_TIME_RANGE));
		properties.put("metrics", Schemas.enumArray("Metrics to compute.", METRICS, List.of("publication_count")));
		properties.put("granularity", Schemas.enumeration("Time granularity.", GRANULARITIES, "year"));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("domain"));
	}

	private McpSchema.JsonSchema landscapeSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("domain", Schemas.string("Research domain name."));
		properties.put("analysis_dimensions",
				Schemas.enumArray("Dimensions to analyze.", DIMENSIONS, List.of("topics", "authors", "trends")));
		properties.put("format", Schemas.format());
		return Schemas.object(properties, List.of("domain"));
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TrendingPapersArguments(@JsonProperty("time_window") String timeWindow, Integer limit,
			ResponseFormat format) {

		public TrendingPapersArguments {
			timeWindow = ToolArguments.oneOf(timeWindow, "month", TIME_WINDOWS, "time_window");
			limit = ToolArguments.inRange(limit, 20, 1, 100, "limit");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TopKeywordsArguments(Integer limit, @JsonProperty("time_range") String timeRange,
			ResponseFormat format) {

		public TopKeywordsArguments {
			limit = ToolArguments.inRange(limit, 20, 1, 100, "limit");
			timeRange = timeRange != null && !timeRange.isBlank() ? timeRange.trim() : null;
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DomainTrendsArguments(String domain, @JsonProperty("time_range") String timeRange,
			List<String> metrics, String granularity, ResponseFormat format) {

		public DomainTrendsArguments {
			domain = ToolArguments.requireText(domain, "domain");
			timeRange = timeRange != null && !timeRange.isBlank() ? timeRange.trim() : DEFAULT_TIME_RANGE;
			metrics = ToolArguments.allOf(metrics, List.of("publication_count"), METRICS, "metrics");
			granularity = ToolArguments.oneOf(granularity, "year", GRANULARITIES, "granularity");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record LandscapeArguments(String domain,
			@JsonProperty("analysis_dimensions") List<String> analysisDimensions, ResponseFormat format) {

		public LandscapeArguments {
			domain = ToolArguments.requireText(domain, "domain");
			analysisDimensions = ToolArguments.allOf(analysisDimensions, List.of("topics", "authors", "trends"),
					DIMENSIONS, "analysis_dimensions");
			format = format != null ? format : ResponseFormat.JSON;
		}

	}

}
