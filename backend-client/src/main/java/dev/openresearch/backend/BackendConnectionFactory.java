package dev.openresearch.backend;

/**
 * Creates pooled connection handles for a {@link BackendSession}. Implementations must release
 * anything they allocated before throwing.
 */
@FunctionalInterface
public interface BackendConnectionFactory {

	BackendConnection create(BackendSettings settings);

}
