package dev.openresearch.mcp.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.openresearch.backend.exception.BackendStatusException;
import dev.openresearch.backend.exception.BackendTimeoutException;
import dev.openresearch.mcp.catalog.ToolCatalog;
import dev.openresearch.mcp.catalog.ToolDefinition;
import dev.openresearch.mcp.catalog.ToolHandler;
import io.modelcontextprotocol.spec.McpSchema;

class ToolDispatcherTest {

	private static final McpSchema.JsonSchema EMPTY_SCHEMA = new McpSchema.JsonSchema("object", Map.of(), List.of(),
			false, null, null);

	@Test
	void listReturnsCatalogListing() {
		ToolCatalog catalog = catalog(tool("echo", arguments -> "ok"));

		assertThat(new ToolDispatcher(catalog, new ToolContentMapper(new ObjectMapper())).list())
			.isEqualTo(catalog.allDefinitions());
	}

	@Test
	void unknownToolIsReportedWithAvailableNames() {
		ToolDispatcher dispatcher = dispatcher(tool("search_papers", arguments -> "ok"),
				tool("get_top_keywords", arguments -> "ok"));

		McpSchema.CallToolResult result = dispatcher.call("nonexistent_tool", Map.of());

		assertThat(result.isError()).isTrue();
		assertThat(text(result)).contains("nonexistent_tool").contains("search_papers").contains("get_top_keywords");
		assertThat(structured(result)).containsEntry("kind", "TOOL_NOT_FOUND")
			.containsEntry("tool", "nonexistent_tool")
			.containsEntry("available_tools", List.of("search_papers", "get_top_keywords"));
	}

	@Test
	void handlerFailureBecomesExecutionError() {
		ToolDispatcher dispatcher = dispatcher(tool("search_papers", arguments -> {
			throw new BackendStatusException("search_papers", 503, "service unavailable");
		}));

		McpSchema.CallToolResult result = dispatcher.call("search_papers", Map.of("query", "graphs"));

		assertThat(result.isError()).isTrue();
		assertThat(text(result)).startsWith("Tool execution failed:")
			.contains("503")
			.contains("service unavailable");
		assertThat(structured(result)).containsEntry("kind", "TOOL_EXECUTION")
			.containsEntry("backend_error", "HTTP_STATUS")
			.containsEntry("status", 503);
	}

	@Test
	void checkedAndUncheckedFailuresAreContained() {
		ToolDispatcher dispatcher = dispatcher(tool("checked", arguments -> {
			throw new IOException("disk gone");
		}), tool("unchecked", arguments -> {
			throw new NullPointerException();
		}), tool("timeout", arguments -> {
			throw new BackendTimeoutException("get_trending_papers", Duration.ofSeconds(30), null);
		}), tool("healthy", arguments -> "still serving"));

		assertThat(text(dispatcher.call("checked", Map.of()))).isEqualTo("Tool execution failed: disk gone");
		assertThat(text(dispatcher.call("unchecked", Map.of())))
			.isEqualTo("Tool execution failed: NullPointerException");
		assertThat(structured(dispatcher.call("timeout", Map.of()))).containsEntry("backend_error", "TIMEOUT");
		McpSchema.CallToolResult healthy = dispatcher.call("healthy", Map.of());
		assertThat(healthy.isError()).isNotEqualTo(Boolean.TRUE);
		assertThat(text(healthy)).isEqualTo("still serving");
	}

	@Test
	void nullArgumentsArePassedAsEmptyMap() {
		AtomicReference<Map<String, Object>> received = new AtomicReference<>();
		ToolDispatcher dispatcher = dispatcher(tool("echo", arguments -> {
			received.set(arguments);
			return "done";
		}));

		dispatcher.call("echo", null);

		assertThat(received.get()).isNotNull().isEmpty();
	}

	@Test
	void returnValuesAreCoercedIntoContent() {
		ToolDispatcher dispatcher = dispatcher(
				tool("mixed", arguments -> List.of("first", new McpSchema.TextContent("second"), Map.of("k", 1))));

		McpSchema.CallToolResult result = dispatcher.call("mixed", Map.of());

		assertThat(result.content()).hasSize(3).hasOnlyElementsOfType(McpSchema.TextContent.class);
		assertThat(((McpSchema.TextContent) result.content().get(0)).text()).isEqualTo("first");
		assertThat(((McpSchema.TextContent) result.content().get(1)).text()).isEqualTo("second");
		assertThat(((McpSchema.TextContent) result.content().get(2)).text()).contains("\"k\"").contains("1");
	}

	private static ToolDispatcher dispatcher(ToolDefinition... definitions) {
		return new ToolDispatcher(catalog(definitions), new ToolContentMapper(new ObjectMapper()));
	}

	private static ToolCatalog catalog(ToolDefinition... definitions) {
		return new ToolCatalog(List.of(definitions));
	}

	private static ToolDefinition tool(String name, ToolHandler handler) {
		return new ToolDefinition(name, name, name, EMPTY_SCHEMA, handler);
	}

	private static String text(McpSchema.CallToolResult result) {
		return ((McpSchema.TextContent) result.content().get(0)).text();
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> structured(McpSchema.CallToolResult result) {
		return (Map<String, Object>) result.structuredContent();
	}

}
