package dev.openresearch.mcp.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.modelcontextprotocol.spec.McpSchema;

class ToolContentMapperTest {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final ToolContentMapper mapper = new ToolContentMapper(objectMapper);

	@Test
	void callToolResultPassesThrough() throws Exception {
		McpSchema.CallToolResult result = McpSchema.CallToolResult.builder().addTextContent("ready").build();

		assertThat(mapper.toResult(result)).isSameAs(result);
	}

	@Test
	void stringBecomesSingleTextItem() throws Exception {
		McpSchema.CallToolResult result = mapper.toResult("hello");

		assertThat(result.content()).containsExactly(new McpSchema.TextContent("hello"));
	}

	@Test
	void contentItemIsWrapped() throws Exception {
		McpSchema.TextContent item = new McpSchema.TextContent("as is");

		assertThat(mapper.toResult(item).content()).containsExactly(item);
	}

	@Test
	void mapBecomesJsonTextAndStructuredContent() throws Exception {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("keywords", List.of("llm"));
		payload.put("count", 1);

		McpSchema.CallToolResult result = mapper.toResult(payload);

		String text = ((McpSchema.TextContent) result.content().get(0)).text();
		assertThat(objectMapper.readValue(text, Map.class)).isEqualTo(payload);
		assertThat(result.structuredContent()).isEqualTo(payload);
	}

	@Test
	void nullBecomesEmptyContent() throws Exception {
		assertThat(mapper.toResult(null).content()).isEmpty();
	}

	@Test
	void collectionItemsAreCoercedOneByOneSkippingNulls() throws Exception {
		assertThat(mapper.toContent(Arrays.asList("a", null, 42)))
			.containsExactly(new McpSchema.TextContent("a"), new McpSchema.TextContent("42"));
	}

	@Test
	void otherValuesUseTheirStringForm() throws Exception {
		assertThat(mapper.toContent(3.5)).containsExactly(new McpSchema.TextContent("3.5"));
	}

}
