package dev.openresearch.backend;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Instant;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.DefaultUriBuilderFactory;

import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Builds {@link BackendConnection}s on top of a dedicated Reactor Netty connection pool sized from
 * {@link BackendSettings}.
 */
public class ReactorBackendConnectionFactory implements BackendConnectionFactory {

	private static final String POOL_NAME = "research-backend";

	@Override
	public BackendConnection create(BackendSettings settings) {
		URI baseUri = parseBaseUrl(settings.baseUrl());
		int port = baseUri.getPort() != -1 ? baseUri.getPort() : ("https".equalsIgnoreCase(baseUri.getScheme()) ? 443 : 80);
		ConnectionProvider provider = ConnectionProvider.builder(POOL_NAME)
			.maxConnections(settings.maxConnections())
			.maxIdleTime(settings.keepAlive())
			.pendingAcquireTimeout(settings.timeout())
			.forRemoteHost(InetSocketAddress.createUnresolved(baseUri.getHost(), port),
					spec -> spec.maxConnections(settings.maxConnectionsPerHost()))
			.build();
		try {
			HttpClient httpClient = HttpClient.create(provider).keepAlive(true);
			DefaultUriBuilderFactory uriBuilderFactory = new DefaultUriBuilderFactory(settings.baseUrl());
			uriBuilderFactory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.TEMPLATE_AND_VALUES);
			WebClient.Builder builder = WebClient.builder()
				.uriBuilderFactory(uriBuilderFactory)
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
			if (settings.userAgent() != null) {
				builder.defaultHeader(HttpHeaders.USER_AGENT, settings.userAgent());
			}
			return new BackendConnection(builder.build(), provider, Instant.now());
		}
		catch (RuntimeException ex) {
			provider.dispose();
			throw ex;
		}
	}

	private static URI parseBaseUrl(String baseUrl) {
		URI uri = URI.create(baseUrl);
		if (uri.getScheme() == null || uri.getHost() == null) {
			throw new IllegalArgumentException("Backend URL must be absolute: " + baseUrl);
		}
		if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
			throw new IllegalArgumentException("Unsupported backend URL scheme: " + uri.getScheme());
		}
		return uri;
	}

}
