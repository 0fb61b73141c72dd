package dev.openresearch.mcp.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.openresearch.backend.ResearchBackendClient;
import dev.openresearch.mcp.catalog.ToolDefinition;
import dev.openresearch.mcp.config.ToolProperties;
import dev.openresearch.mcp.format.MarkdownRenderer;
import dev.openresearch.mcp.format.ToolResponseWriter;
import io.modelcontextprotocol.spec.McpSchema;

@ExtendWith(MockitoExtension.class)
class TrendToolsTest {

	@Mock
	private ResearchBackendClient backendClient;

	private TrendTools trendTools;

	@BeforeEach
	void setUp() {
		ObjectMapper objectMapper = new ObjectMapper();
		trendTools = new TrendTools(backendClient, new ToolArguments(objectMapper),
				new ToolResponseWriter(objectMapper), new MarkdownRenderer(), new ToolProperties());
	}

	@Test
	void domainTrendsApplyDefaults() throws Exception {
		when(backendClient.getResearchTrends("nlp", "2020-2024", List.of("publication_count"), "year"))
			.thenReturn(Map.of("domain", "nlp", "data_points", List.of()));

		call("analyze_domain_trends", Map.of("domain", "nlp"));

		verify(backendClient).getResearchTrends("nlp", "2020-2024", List.of("publication_count"), "year");
	}

	@Test
	void landscapeDefaultsToTopicsAuthorsAndTrends() throws Exception {
		when(backendClient.analyzeResearchLandscape("robotics", List.of("topics", "authors", "trends")))
			.thenReturn(Map.of("domain", "robotics", "topics", List.of("manipulation")));

		McpSchema.CallToolResult result = call("analyze_research_landscape",
				Map.of("domain", "robotics", "format", "markdown"));

		assertThat(((McpSchema.TextContent) result.content().get(0)).text())
			.contains("# Research landscape: robotics")
			.contains("- manipulation");
	}

	@Test
	void trendingPapersDefaultToMonthlyWindow() throws Exception {
		when(backendClient.getTrendingPapers("month", 20)).thenReturn(Map.of("trending_papers", List.of(), "count", 0));

		call("get_trending_papers", Map.of());

		verify(backendClient).getTrendingPapers("month", 20);
	}

	@Test
	void invalidEnumerationValuesAreRejectedBeforeCallingTheBackend() {
		assertThatThrownBy(() -> call("get_trending_papers", Map.of("time_window", "decade")))
			.isInstanceOf(InvalidToolArgumentsException.class)
			.hasMessageContaining("time_window");
		assertThatThrownBy(() -> call("analyze_domain_trends", Map.of("domain", "nlp", "metrics", List.of("h_index"))))
			.isInstanceOf(InvalidToolArgumentsException.class)
			.hasMessageContaining("metrics");
		verifyNoInteractions(backendClient);
	}

	@Test
	void keywordsPassTimeRangeThrough() throws Exception {
		when(backendClient.getTopKeywords(5, "2021-2023")).thenReturn(Map.of("keywords", List.of(), "count", 0));

		call("get_top_keywords", Map.of("limit", 5, "time_range", "2021-2023"));

		verify(backendClient).getTopKeywords(5, "2021-2023");
	}

	private McpSchema.CallToolResult call(String name, Map<String, Object> arguments) throws Exception {
		ToolDefinition definition = trendTools.tools()
			.stream()
			.filter(tool -> tool.name().equals(name))
			.findFirst()
			.orElseThrow();
		return (McpSchema.CallToolResult) definition.handler().handle(arguments);
	}

}
