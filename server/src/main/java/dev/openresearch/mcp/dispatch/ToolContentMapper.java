package dev.openresearch.mcp.dispatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;

/**
 * Coerces whatever a tool handler returns into a {@link McpSchema.CallToolResult}. Results pass
 * through untouched; strings and content items are wrapped; maps become JSON text with the map as
 * structured content; collections are converted item by item.
 */
@Component
@RequiredArgsConstructor
public class ToolContentMapper {

	private final ObjectMapper objectMapper;

	public McpSchema.CallToolResult toResult(Object value) throws JsonProcessingException {
		if (value instanceof McpSchema.CallToolResult result) {
			return result;
		}
		McpSchema.CallToolResult.Builder builder = McpSchema.CallToolResult.builder().content(toContent(value));
		if (value instanceof Map<?, ?> map) {
			builder.structuredContent(structured(map));
		}
		return builder.build();
	}

	/**
	 * Convert a value into an ordered list of content items.
	 * @param value handler return value, may be {@code null}
	 * @return content items, empty for {@code null}
	 * @throws JsonProcessingException when a map cannot be serialized
	 */
	public List<McpSchema.Content> toContent(Object value) throws JsonProcessingException {
		List<McpSchema.Content> content = new ArrayList<>();
		if (value == null) {
			return content;
		}
		if (value instanceof Collection<?> items) {
			for (Object item : items) {
				if (item != null) {
					content.add(toItem(item));
				}
			}
			return content;
		}
		content.add(toItem(value));
		return content;
	}

	private McpSchema.Content toItem(Object value) throws JsonProcessingException {
		if (value instanceof McpSchema.Content item) {
			return item;
		}
		if (value instanceof CharSequence text) {
			return new McpSchema.TextContent(text.toString());
		}
		if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
			return new McpSchema.TextContent(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
		}
		return new McpSchema.TextContent(String.valueOf(value));
	}

	private Map<String, Object> structured(Map<?, ?> map) {
		Map<String, Object> structured = new LinkedHashMap<>();
		map.forEach((key, item) -> structured.put(String.valueOf(key), item));
		return structured;
	}

}
