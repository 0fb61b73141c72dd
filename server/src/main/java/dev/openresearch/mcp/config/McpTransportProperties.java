package dev.openresearch.mcp.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;

/**
 * Settings of the streamable HTTP transport that exposes the MCP endpoint.
 */
@ConfigurationProperties(prefix = "mcp.research.transport")
public class McpTransportProperties {

	/**
	 * HTTP path of the MCP endpoint.
	 */
	private String endpoint = "/mcp";

	/**
	 * Reject HTTP DELETE session termination requests when {@code true}.
	 */
	private boolean disallowDelete = false;

	/**
	 * Interval of keep-alive pings sent to connected clients; the SDK default applies when unset.
	 */
	@Nullable
	private Duration keepAliveInterval;

	/**
	 * Retrieve the HTTP path the transport is mounted on.
	 * @return endpoint path
	 */
	public String getEndpoint() {
		return endpoint;
	}

	/**
	 * Change the HTTP path the transport is mounted on.
	 * @param endpoint new endpoint path
	 */
	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	/**
	 * Whether clients are refused when they end their session with HTTP DELETE.
	 * @return {@code true} when DELETE is rejected
	 */
	public boolean isDisallowDelete() {
		return disallowDelete;
	}

	/**
	 * Allow or reject session termination through HTTP DELETE.
	 * @param disallowDelete {@code true} to reject DELETE
	 */
	public void setDisallowDelete(boolean disallowDelete) {
		this.disallowDelete = disallowDelete;
	}

	/**
	 * Keep-alive interval override.
	 * @return interval, or {@code null} to keep the SDK default
	 */
	@Nullable
	public Duration getKeepAliveInterval() {
		return keepAliveInterval;
	}

	/**
	 * Override the keep-alive interval.
	 * @param keepAliveInterval interval, or {@code null} to fall back to the SDK default
	 */
	public void setKeepAliveInterval(@Nullable Duration keepAliveInterval) {
		this.keepAliveInterval = keepAliveInterval;
	}

}
