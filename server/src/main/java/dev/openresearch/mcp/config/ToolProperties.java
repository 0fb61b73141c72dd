package dev.openresearch.mcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits applied by the tool providers independently of what clients request.
 */
@ConfigurationProperties(prefix = "research.tools")
public class ToolProperties {

	/**
	 * Upper bound applied to every {@code limit} argument.
	 */
	private int maxResults = 100;

	public int getMaxResults() {
		return maxResults;
	}

	public void setMaxResults(int maxResults) {
		this.maxResults = maxResults;
	}

	/**
	 * Clamp a requested result count to {@link #getMaxResults()}.
	 * @param requested requested count
	 * @return the smaller of the request and the configured maximum
	 */
	public int clampLimit(int requested) {
		return Math.min(requested, maxResults);
	}

}
