package dev.openresearch.mcp.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import io.modelcontextprotocol.server.transport.WebMvcStreamableServerTransportProvider;

/**
 * Exposes the MCP server over the Spring MVC streamable HTTP transport.
 */
@Configuration
@EnableConfigurationProperties(McpTransportProperties.class)
public class WebMvcTransportConfig {

	@Bean
	public WebMvcStreamableServerTransportProvider streamableTransportProvider(
			McpTransportProperties transportProperties) {
		WebMvcStreamableServerTransportProvider.Builder builder = WebMvcStreamableServerTransportProvider.builder()
			.mcpEndpoint(transportProperties.getEndpoint())
			.disallowDelete(transportProperties.isDisallowDelete());
		if (transportProperties.getKeepAliveInterval() != null) {
			builder.keepAliveInterval(transportProperties.getKeepAliveInterval());
		}
		return builder.build();
	}

	@Bean
	public RouterFunction<ServerResponse> mcpRouter(WebMvcStreamableServerTransportProvider transportProvider) {
		return transportProvider.getRouterFunction();
	}

}
