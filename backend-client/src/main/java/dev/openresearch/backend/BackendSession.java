package dev.openresearch.backend;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.openresearch.backend.exception.BackendConnectionException;
import dev.openresearch.backend.exception.BackendDecodeException;
import dev.openresearch.backend.exception.BackendException;
import dev.openresearch.backend.exception.BackendStatusException;
import dev.openresearch.backend.exception.BackendTimeoutException;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the lifecycle of the single pooled connection to the research backend.
 * <p>
 * The connection is created lazily on first use and shared by every caller. Creation is guarded by
 * a lock with a re-check, so concurrent callers that find no usable connection trigger exactly one
 * construction. When a connection is found closed it is replaced, and the superseded handle is
 * disposed in the background without blocking the caller. Requests themselves are not serialized.
 */
public class BackendSession implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(BackendSession.class);

	private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {
	};

	private final BackendSettings settings;

	private final BackendConnectionFactory connectionFactory;

	private final ObjectMapper objectMapper;

	private final ReentrantLock lock = new ReentrantLock();

	private final AtomicReference<BackendConnection> current = new AtomicReference<>();

	private final Set<BackendConnection> retiring = ConcurrentHashMap.newKeySet();

	private volatile boolean constructing;

	public BackendSession(BackendSettings settings) {
		this(settings, new ReactorBackendConnectionFactory(), new ObjectMapper());
	}

	public BackendSession(BackendSettings settings, BackendConnectionFactory connectionFactory,
			ObjectMapper objectMapper) {
		this.settings = settings;
		this.connectionFactory = connectionFactory;
		this.objectMapper = objectMapper;
	}

	public BackendSettings settings() {
		return settings;
	}

	/**
	 * Eagerly open the connection. A failure here is meant to abort application start.
	 */
	public void start() {
		BackendConnection connection = connect();
		logger.info("Backend session ready for {} (created {})", settings.baseUrl(), connection.createdAt());
	}

	/**
	 * Return the current open connection, creating one when there is none.
	 * @return open connection
	 * @throws BackendConnectionException when a new connection cannot be created
	 */
	public BackendConnection connect() {
		BackendConnection existing = current.get();
		if (existing != null && existing.isOpen()) {
			return existing;
		}
		lock.lock();
		try {
			existing = current.get();
			if (existing != null && existing.isOpen()) {
				return existing;
			}
			constructing = true;
			BackendConnection created;
			try {
				created = connectionFactory.create(settings);
			}
			catch (RuntimeException ex) {
				current.set(null);
				retire(existing);
				logger.error("Failed to open backend connection to {}: {}", settings.baseUrl(), ex.getMessage());
				throw new BackendConnectionException(
						"Failed to open backend connection to " + settings.baseUrl() + ": " + ex.getMessage(), ex);
			}
			finally {
				constructing = false;
			}
			current.set(created);
			retire(existing);
			logger.info("Opened backend connection to {}", settings.baseUrl());
			return created;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Close and forget the current connection. Calling this with no connection is a no-op.
	 */
	public void disconnect() {
		BackendConnection connection;
		lock.lock();
		try {
			connection = current.getAndSet(null);
		}
		finally {
			lock.unlock();
		}
		if (connection != null) {
			connection.close();
			logger.info("Closed backend connection to {}", settings.baseUrl());
		}
	}

	public SessionState state() {
		if (constructing) {
			return SessionState.CONNECTING;
		}
		BackendConnection connection = current.get();
		return connection != null && connection.isOpen() ? SessionState.CONNECTED : SessionState.DISCONNECTED;
	}

	/**
	 * Execute one request with the configured deadline and decode the JSON object it returns.
	 * @param request request descriptor
	 * @return decoded body, empty when the backend sent no content
	 * @throws BackendException categorized failure
	 */
	public Map<String, Object> request(BackendRequest request) {
		BackendConnection connection = connect();
		String jsonBody = encode(request);
		logger.debug("Backend request {} query={}", request.describe(), request.queryParams());
		BackendResponse response = connection.exchange(request, jsonBody)
			.timeout(settings.timeout())
			.onErrorMap(TimeoutException.class, ex -> new BackendTimeoutException(settings.timeout(), ex))
			.onErrorMap(ex -> !(ex instanceof BackendException),
					ex -> new BackendConnectionException("Backend request " + request.describe() + " failed: "
							+ ex.getMessage(), ex))
			.block();
		if (response == null) {
			throw new BackendConnectionException("Backend request " + request.describe() + " produced no response",
					null);
		}
		if (!response.isSuccess()) {
			BackendStatusException failure = new BackendStatusException(response.status(), response.body());
			logger.warn("Backend request {} returned {}: {}", request.describe(), response.status(), failure.getBody());
			throw failure;
		}
		return decode(request, response.body());
	}

	@Override
	public void close() {
		disconnect();
		for (BackendConnection connection : retiring) {
			connection.close();
		}
		retiring.clear();
	}

	int retiringCount() {
		return retiring.size();
	}

	private void retire(BackendConnection connection) {
		if (connection == null) {
			return;
		}
		retiring.add(connection);
		connection.closeAsync()
			.subscribeOn(Schedulers.boundedElastic())
			.doFinally(signal -> retiring.remove(connection))
			.subscribe(null, ex -> logger.warn("Failed to dispose superseded backend connection", ex));
	}

	private String encode(BackendRequest request) {
		if (request.body() == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(request.body());
		}
		catch (JsonProcessingException ex) {
			throw new IllegalArgumentException("Request body for " + request.describe() + " is not serializable", ex);
		}
	}

	private Map<String, Object> decode(BackendRequest request, String body) {
		if (body == null || body.isBlank()) {
			return new LinkedHashMap<>();
		}
		try {
			Map<String, Object> decoded = objectMapper.readValue(body, JSON_OBJECT);
			return decoded != null ? decoded : new LinkedHashMap<>();
		}
		catch (JsonProcessingException ex) {
			logger.warn("Backend request {} returned undecodable body", request.describe());
			throw new BackendDecodeException("Backend returned invalid JSON: " + ex.getOriginalMessage(), ex);
		}
	}

	/**
	 * Observable lifecycle of the session.
	 */
	public enum SessionState {
		DISCONNECTED, CONNECTING, CONNECTED
	}

}
