package dev.openresearch.backend;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection settings for the research backend, read once at startup.
 * @param baseUrl absolute base URL every request path is resolved against
 * @param timeout total deadline applied to each request
 * @param userAgent value sent in the {@code User-Agent} header
 * @param maxConnections upper bound of pooled connections
 * @param maxConnectionsPerHost upper bound of pooled connections to the backend host
 * @param keepAlive idle time after which a pooled connection is released
 */
public record BackendSettings(String baseUrl, Duration timeout, String userAgent, int maxConnections,
		int maxConnectionsPerHost, Duration keepAlive) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	public static final int DEFAULT_MAX_CONNECTIONS = 100;

	public static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 30;

	public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(30);

	public BackendSettings {
		Objects.requireNonNull(baseUrl, "baseUrl must not be null");
		timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
		keepAlive = Objects.requireNonNullElse(keepAlive, DEFAULT_KEEP_ALIVE);
		if (timeout.isZero() || timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive: " + timeout);
		}
		if (maxConnections <= 0 || maxConnectionsPerHost <= 0) {
			throw new IllegalArgumentException("connection limits must be positive");
		}
		baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
	}

	/**
	 * Settings with default pool sizing.
	 * @param baseUrl backend base URL
	 * @param timeout per-request deadline
	 * @param userAgent client identification
	 * @return settings instance
	 */
	public static BackendSettings of(String baseUrl, Duration timeout, String userAgent) {
		return new BackendSettings(baseUrl, timeout, userAgent, DEFAULT_MAX_CONNECTIONS,
				DEFAULT_MAX_CONNECTIONS_PER_HOST, DEFAULT_KEEP_ALIVE);
	}

}
