package dev.openresearch.mcp.dispatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import dev.openresearch.backend.exception.BackendException;
import dev.openresearch.backend.exception.BackendStatusException;
import dev.openresearch.mcp.catalog.ToolCatalog;
import dev.openresearch.mcp.catalog.ToolDefinition;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;

/**
 * Entry point for {@code tools/list} and {@code tools/call}. A call never throws: unknown tools and
 * handler failures are reported as error results so the server keeps serving.
 */
@Component
@RequiredArgsConstructor
public class ToolDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

	private final ToolCatalog catalog;

	private final ToolContentMapper contentMapper;

	public List<McpSchema.Tool> list() {
		return catalog.allDefinitions();
	}

	/**
	 * Execute the named tool.
	 * @param name tool name
	 * @param arguments raw arguments, {@code null} treated as empty
	 * @return handler result coerced to content, or an error result
	 */
	public McpSchema.CallToolResult call(String name, Map<String, Object> arguments) {
		Optional<ToolDefinition> definition = catalog.resolve(name);
		if (definition.isEmpty()) {
			ToolNotFoundException notFound = new ToolNotFoundException(name, catalog.names());
			Map<String, Object> structured = errorStructure(ToolErrorKind.TOOL_NOT_FOUND, name, notFound.getMessage());
			structured.put("available_tools", notFound.getAvailableTools());
			return errorResult(notFound.getMessage(), structured);
		}
		Map<String, Object> safeArguments = arguments != null ? arguments : Map.of();
		logger.debug("Calling tool {} with arguments {}", name, safeArguments.keySet());
		try {
			Object value = definition.get().handler().handle(safeArguments);
			return contentMapper.toResult(value);
		}
		catch (Exception ex) {
			ToolExecutionException failure = new ToolExecutionException(name, ex);
			logger.error("Tool {} failed", name, ex);
			Map<String, Object> structured = errorStructure(ToolErrorKind.TOOL_EXECUTION, name, failure.getMessage());
			if (ex instanceof BackendException backendFailure) {
				structured.put("backend_error", backendFailure.getKind().name());
				if (backendFailure instanceof BackendStatusException statusFailure) {
					structured.put("status", statusFailure.getStatus());
				}
			}
			return errorResult(failure.getMessage(), structured);
		}
	}

	private Map<String, Object> errorStructure(ToolErrorKind kind, String name, String message) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("kind", kind.name());
		structured.put("tool", name);
		structured.put("message", message);
		return structured;
	}

	private McpSchema.CallToolResult errorResult(String message, Map<String, Object> structuredContent) {
		logger.warn("Error response: {}", message);
		return McpSchema.CallToolResult.builder()
			.addTextContent(message)
			.isError(true)
			.structuredContent(structuredContent)
			.build();
	}

}
