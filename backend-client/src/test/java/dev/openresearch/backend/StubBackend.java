package dev.openresearch.backend;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

/**
 * In-process HTTP server standing in for the research backend. Routes are keyed by method and path
 * and answer with a canned status and body, optionally after a delay.
 */
final class StubBackend implements AutoCloseable {

	private final Map<String, Route> routes = new ConcurrentHashMap<>();

	private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

	private final DisposableServer server;

	StubBackend() {
		this.server = HttpServer.create()
			.host("127.0.0.1")
			.port(0)
			.handle((request, response) -> request.receive()
				.aggregate()
				.asString(StandardCharsets.UTF_8)
				.defaultIfEmpty("")
				.flatMap(body -> {
					String path = URI.create(request.uri()).getPath();
					String method = request.method().name();
					requests.add(new RecordedRequest(method, request.uri(),
							request.requestHeaders().get("User-Agent"), body));
					Route route = routes.getOrDefault(method + " " + path,
							new Route(404, "{\"error\":\"not found\"}", Duration.ZERO));
					return Mono.delay(route.delay())
						.then(response.status(route.status())
							.header("Content-Type", "application/json")
							.sendString(Mono.just(route.body()))
							.then());
				}))
			.bindNow();
	}

	String baseUrl() {
		return "http://127.0.0.1:" + server.port();
	}

	StubBackend respond(String method, String path, int status, String body) {
		return respond(method, path, status, body, Duration.ZERO);
	}

	StubBackend respond(String method, String path, int status, String body, Duration delay) {
		routes.put(method + " " + path, new Route(status, body, delay));
		return this;
	}

	List<RecordedRequest> requests() {
		return requests;
	}

	RecordedRequest lastRequest() {
		return requests.get(requests.size() - 1);
	}

	@Override
	public void close() {
		server.disposeNow();
	}

	record Route(int status, String body, Duration delay) {
	}

	record RecordedRequest(String method, String uri, String userAgent, String body) {
	}

}
