package dev.openresearch.backend;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import reactor.core.publisher.Mono;
import reactor.netty.resources.ConnectionProvider;

/**
 * One pooled connection handle to the backend: a {@link WebClient} bound to its own
 * {@link ConnectionProvider}. Closing the handle disposes the pool.
 */
public class BackendConnection {

	private static final String QUERY_VARIABLE_PREFIX = "query.";

	private final WebClient webClient;

	private final ConnectionProvider connectionProvider;

	private final Instant createdAt;

	private final AtomicBoolean closed = new AtomicBoolean();

	public BackendConnection(WebClient webClient, ConnectionProvider connectionProvider, Instant createdAt) {
		this.webClient = webClient;
		this.connectionProvider = connectionProvider;
		this.createdAt = createdAt;
	}

	public Instant createdAt() {
		return createdAt;
	}

	/**
	 * Whether this handle may still serve requests. Only {@link #closeAsync()} ends that; the pool
	 * itself reports disposed until its first channel is acquired, so it is not consulted here.
	 * @return {@code true} until the handle is closed
	 */
	public boolean isOpen() {
		return !closed.get();
	}

	/**
	 * Perform one exchange. Any status is returned as a {@link BackendResponse}; only transport
	 * failures are signalled as errors.
	 * @param request request descriptor
	 * @param jsonBody serialized body, or {@code null} to send none
	 * @return lazily executed exchange
	 */
	public Mono<BackendResponse> exchange(BackendRequest request, String jsonBody) {
		WebClient.RequestBodySpec spec = webClient.method(request.method()).uri(uriBuilder -> {
			Map<String, Object> variables = new HashMap<>(request.pathVariables());
			uriBuilder.path(request.path());
			request.queryParams().forEach((name, value) -> {
				if (value != null) {
					// values go through template expansion so reserved characters are encoded
					String variable = QUERY_VARIABLE_PREFIX + name;
					uriBuilder.queryParam(name, "{" + variable + "}");
					variables.put(variable, value);
				}
			});
			return uriBuilder.build(variables);
		});
		WebClient.RequestHeadersSpec<?> headersSpec = jsonBody == null ? spec
				: spec.contentType(MediaType.APPLICATION_JSON).bodyValue(jsonBody);
		return headersSpec.exchangeToMono(response -> response.bodyToMono(String.class)
			.defaultIfEmpty("")
			.map(body -> new BackendResponse(response.statusCode().value(), body)));
	}

	/**
	 * Dispose the pool without waiting. Only the first call has an effect.
	 * @return completion of the disposal
	 */
	public Mono<Void> closeAsync() {
		if (closed.compareAndSet(false, true)) {
			return connectionProvider.disposeLater();
		}
		return Mono.empty();
	}

	public void close() {
		closeAsync().block();
	}

	@Override
	public String toString() {
		return "BackendConnection[createdAt=" + createdAt + ", open=" + isOpen() + "]";
	}

}
