package dev.openresearch.backend.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

class BackendExceptionTest {

	@Test
	void taggedConnectionErrorKeepsCauseAndOriginalTrace() {
		IOException cause = new IOException("connection refused");
		BackendConnectionException original = raiseConnectionError(cause);

		BackendConnectionException tagged = original.withOperation("health_check");

		assertThat(tagged.getOperation()).isEqualTo("health_check");
		assertThat(tagged.getKind()).isEqualTo(BackendException.Kind.CONNECTION);
		assertThat(tagged).hasMessage(original.getMessage()).hasCause(cause);
		assertThat(tagged.getStackTrace()).isEqualTo(original.getStackTrace());
		assertThat(tagged.getStackTrace()[0].getMethodName()).isEqualTo("raiseConnectionError");
	}

	@Test
	void taggedTimeoutKeepsDeadlineAndSuppressedErrors() {
		BackendTimeoutException original = new BackendTimeoutException(Duration.ofMillis(250),
				new TimeoutException("no signal"));
		IllegalStateException cleanup = new IllegalStateException("cancel failed");
		original.addSuppressed(cleanup);

		BackendTimeoutException tagged = original.withOperation("get_trending_papers");

		assertThat(tagged.getTimeout()).isEqualTo(Duration.ofMillis(250));
		assertThat(tagged.getCause()).isSameAs(original.getCause());
		assertThat(tagged.getSuppressed()).containsExactly(cleanup);
		assertThat(tagged.getStackTrace()).isEqualTo(original.getStackTrace());
	}

	@Test
	void taggedStatusErrorKeepsStatusBodyAndTrace() {
		BackendStatusException original = new BackendStatusException(503, "service unavailable");

		BackendStatusException tagged = original.withOperation("search_papers");

		assertThat(tagged.getStatus()).isEqualTo(503);
		assertThat(tagged.getBody()).isEqualTo("service unavailable");
		assertThat(tagged.getStackTrace()).isEqualTo(original.getStackTrace());
	}

	@Test
	void statusBodyIsCutToLimit() {
		BackendStatusException failure = new BackendStatusException(500, "y".repeat(BackendStatusException.MAX_BODY_LENGTH + 1));

		assertThat(failure.getBody()).hasSize(BackendStatusException.MAX_BODY_LENGTH);
		assertThat(failure.getMessage()).startsWith("Backend responded with HTTP 500: ");
	}

	private static BackendConnectionException raiseConnectionError(Throwable cause) {
		return new BackendConnectionException("Backend request GET /health failed", cause);
	}

}
