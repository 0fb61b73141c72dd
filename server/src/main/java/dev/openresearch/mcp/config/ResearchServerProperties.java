package dev.openresearch.mcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity of this MCP server as announced to clients and to the backend.
 */
@ConfigurationProperties(prefix = "research.server")
public class ResearchServerProperties {

	/**
	 * Server name reported during MCP initialization.
	 */
	private String name = "OpenResearch MCP Server";

	/**
	 * Server version reported during MCP initialization.
	 */
	private String version = "1.0.0";

	/**
	 * Usage instructions sent to clients on initialization.
	 */
	private String instructions = "Search academic papers and authors, explore citation and collaboration networks, "
			+ "and analyze research trends. Every tool accepts format=json or format=markdown.";

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public String getInstructions() {
		return instructions;
	}

	public void setInstructions(String instructions) {
		this.instructions = instructions;
	}

	/**
	 * Value of the {@code User-Agent} header sent to the backend.
	 * @return {@code name/version}
	 */
	public String userAgent() {
		return name + "/" + version;
	}

}
