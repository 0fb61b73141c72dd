package dev.openresearch.mcp.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.openresearch.backend.BackendSettings;

/**
 * Connection settings of the research backend, bound from {@code research.backend.*}.
 */
@ConfigurationProperties(prefix = "research.backend")
public class BackendProperties {

	/**
	 * Base URL of the backend service. Request paths are appended to it.
	 */
	private String url = "https://test.nftkash.xyz/neo4j";

	/**
	 * Total deadline of a single backend request.
	 */
	private Duration timeout = BackendSettings.DEFAULT_TIMEOUT;

	/**
	 * Maximum number of pooled connections.
	 */
	private int maxConnections = BackendSettings.DEFAULT_MAX_CONNECTIONS;

	/**
	 * Maximum number of pooled connections to the backend host.
	 */
	private int maxConnectionsPerHost = BackendSettings.DEFAULT_MAX_CONNECTIONS_PER_HOST;

	/**
	 * Idle time after which a pooled connection is released.
	 */
	private Duration keepAlive = BackendSettings.DEFAULT_KEEP_ALIVE;

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public Duration getTimeout() {
		return timeout;
	}

	public void setTimeout(Duration timeout) {
		this.timeout = timeout;
	}

	public int getMaxConnections() {
		return maxConnections;
	}

	public void setMaxConnections(int maxConnections) {
		this.maxConnections = maxConnections;
	}

	public int getMaxConnectionsPerHost() {
		return maxConnectionsPerHost;
	}

	public void setMaxConnectionsPerHost(int maxConnectionsPerHost) {
		this.maxConnectionsPerHost = maxConnectionsPerHost;
	}

	public Duration getKeepAlive() {
		return keepAlive;
	}

	public void setKeepAlive(Duration keepAlive) {
		this.keepAlive = keepAlive;
	}

	/**
	 * Convert into the immutable settings used by the backend session.
	 * @param userAgent client identification sent with every request
	 * @return backend settings
	 */
	public BackendSettings toSettings(String userAgent) {
		return new BackendSettings(url, timeout, userAgent, maxConnections, maxConnectionsPerHost, keepAlive);
	}

}
