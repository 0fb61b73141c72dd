package dev.openresearch.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.openresearch.backend.BackendSession.SessionState;
import dev.openresearch.backend.exception.BackendConnectionException;
import dev.openresearch.backend.exception.BackendException;

class BackendSessionTest {

	private static final BackendSettings SETTINGS = BackendSettings.of("http://127.0.0.1:9", Duration.ofSeconds(1),
			"test-agent/1.0");

	private final AtomicInteger created = new AtomicInteger();

	private final ReactorBackendConnectionFactory delegate = new ReactorBackendConnectionFactory();

	private BackendSession session;

	@AfterEach
	void tearDown() {
		if (session != null) {
			session.close();
		}
	}

	@Test
	void concurrentConnectCreatesExactlyOneConnection() throws Exception {
		session = new BackendSession(SETTINGS, slowCountingFactory(), new ObjectMapper());
		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		try {
			List<Future<BackendConnection>> futures = new ArrayList<>();
			for (int i = 0; i < threads; i++) {
				futures.add(executor.submit(() -> {
					start.await();
					return session.connect();
				}));
			}
			start.countDown();
			BackendConnection first = futures.get(0).get(5, TimeUnit.SECONDS);
			for (Future<BackendConnection> future : futures) {
				assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
			}
		}
		finally {
			executor.shutdownNow();
		}
		assertThat(created).hasValue(1);
		assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
	}

	@Test
	void connectIsIdempotentWhileConnectionIsOpen() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());

		BackendConnection first = session.connect();
		BackendConnection second = session.connect();

		assertThat(second).isSameAs(first);
		assertThat(created).hasValue(1);
	}

	@Test
	void freshConnectionFromReactorFactoryIsOpen() {
		BackendConnection connection = delegate.create(SETTINGS);
		try {
			assertThat(connection.isOpen()).isTrue();
		}
		finally {
			connection.close();
		}
		assertThat(connection.isOpen()).isFalse();
	}

	@Test
	void startLeavesSessionConnectedAndReusesTheConnection() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());

		session.start();

		assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
		BackendConnection connection = session.connect();
		assertThat(session.connect()).isSameAs(connection);
		assertThat(created).hasValue(1);
		assertThat(session.retiringCount()).isZero();
	}

	@Test
	void startsDisconnected() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());

		assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
		assertThat(created).hasValue(0);
	}

	@Test
	void failedConstructionLeavesNoCurrentConnectionAndAllowsRetry() {
		AtomicBoolean fail = new AtomicBoolean(true);
		session = new BackendSession(SETTINGS, settings -> {
			if (fail.getAndSet(false)) {
				throw new IllegalStateException("pool exhausted");
			}
			return countingFactory().create(settings);
		}, new ObjectMapper());

		assertThatThrownBy(session::connect).isInstanceOf(BackendConnectionException.class)
			.hasMessageContaining("pool exhausted")
			.extracting(ex -> ((BackendException) ex).getKind())
			.isEqualTo(BackendException.Kind.CONNECTION);
		assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);

		assertThat(session.connect().isOpen()).isTrue();
		assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
	}

	@Test
	void invalidBaseUrlIsAConnectionError() {
		session = new BackendSession(BackendSettings.of("ftp://example.org", Duration.ofSeconds(1), "agent"));

		assertThatThrownBy(session::connect).isInstanceOf(BackendConnectionException.class)
			.hasMessageContaining("ftp");
		assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
	}

	@Test
	void disconnectIsIdempotent() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());
		assertThatCode(session::disconnect).doesNotThrowAnyException();

		BackendConnection connection = session.connect();
		session.disconnect();
		session.disconnect();

		assertThat(connection.isOpen()).isFalse();
		assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
	}

	@Test
	void connectAfterDisconnectCreatesNewConnection() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());
		BackendConnection first = session.connect();

		session.disconnect();
		BackendConnection second = session.connect();

		assertThat(second).isNotSameAs(first);
		assertThat(second.isOpen()).isTrue();
		assertThat(created).hasValue(2);
	}

	@Test
	void closedConnectionIsReplacedOnNextConnect() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());
		BackendConnection first = session.connect();

		first.close();
		assertThat(session.state()).isEqualTo(SessionState.DISCONNECTED);
		BackendConnection second = session.connect();

		assertThat(second).isNotSameAs(first);
		assertThat(created).hasValue(2);
		assertThat(session.state()).isEqualTo(SessionState.CONNECTED);
	}

	@Test
	void closeDisposesCurrentConnection() {
		session = new BackendSession(SETTINGS, countingFactory(), new ObjectMapper());
		BackendConnection connection = session.connect();

		session.close();

		assertThat(connection.isOpen()).isFalse();
		assertThat(session.retiringCount()).isZero();
	}

	private BackendConnectionFactory countingFactory() {
		return settings -> {
			created.incrementAndGet();
			return delegate.create(settings);
		};
	}

	private BackendConnectionFactory slowCountingFactory() {
		return settings -> {
			created.incrementAndGet();
			try {
				Thread.sleep(100);
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException(ex);
			}
			return delegate.create(settings);
		};
	}

}
