package dev.openresearch.mcp.format;

import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;

/**
 * Builds successful tool results. The text content follows the requested format while the
 * normalized backend payload is always attached as structured content.
 */
@Component
@RequiredArgsConstructor
public class ToolResponseWriter {

	private static final Logger logger = LoggerFactory.getLogger(ToolResponseWriter.class);

	private final ObjectMapper objectMapper;

	/**
	 * Compose a successful tool result.
	 * @param format requested presentation
	 * @param payload normalized backend payload
	 * @param markdown lazily rendered Markdown, only evaluated for {@link ResponseFormat#MARKDOWN}
	 * @return tool result with text and structured content
	 * @throws JsonProcessingException when the payload cannot be serialized
	 */
	public McpSchema.CallToolResult write(ResponseFormat format, Map<String, Object> payload,
			Supplier<String> markdown) throws JsonProcessingException {
		String text = format == ResponseFormat.MARKDOWN ? markdown.get()
				: objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
		logger.info("Success response ({}, {} chars)", format.value(), text.length());
		return McpSchema.CallToolResult.builder().addTextContent(text).structuredContent(payload).build();
	}

}
