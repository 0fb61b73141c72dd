package dev.openresearch.mcp.config;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.openresearch.mcp.catalog.ToolCatalog;
import dev.openresearch.mcp.catalog.ToolProvider;
import dev.openresearch.mcp.dispatch.ToolDispatcher;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpStreamableServerTransportProvider;

/**
 * Assembles the synchronous MCP server. Tools are registered from the dispatcher listing and every
 * call is routed back through {@link ToolDispatcher#call}, so the error boundary applies to all of
 * them.
 */
@Configuration
@EnableConfigurationProperties({ ResearchServerProperties.class, ToolProperties.class })
public class McpServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(McpServerConfig.class);

	/**
	 * Collect the tools of every provider, in provider order.
	 * @param providers tool providers found in the context
	 * @return immutable catalog
	 */
	@Bean
	public ToolCatalog toolCatalog(List<ToolProvider> providers) {
		ToolCatalog catalog = ToolCatalog.fromProviders(providers);
		logger.info("Registered {} tools: {}", catalog.size(), catalog.names());
		return catalog;
	}

	@Bean(destroyMethod = "close")
	public McpSyncServer mcpServer(McpStreamableServerTransportProvider transportProvider,
			McpTransportProperties transportProperties, ResearchServerProperties serverProperties,
			ToolDispatcher dispatcher) {
		List<McpServerFeatures.SyncToolSpecification> tools = dispatcher.list()
			.stream()
			.map(tool -> McpServerFeatures.SyncToolSpecification.builder()
				.tool(tool)
				.callHandler((exchange, request) -> dispatcher.call(request.name(), request.arguments()))
				.build())
			.collect(Collectors.toList());
		McpSyncServer server = McpServer.sync(transportProvider)
			.serverInfo(serverProperties.getName(), serverProperties.getVersion())
			.instructions(serverProperties.getInstructions())
			.tools(tools)
			.build();
		logger.info("MCP server {} {} initialized on endpoint {}", serverProperties.getName(),
				serverProperties.getVersion(), transportProperties.getEndpoint());
		return server;
	}

}
