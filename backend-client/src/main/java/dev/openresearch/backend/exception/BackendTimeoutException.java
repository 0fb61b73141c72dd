package dev.openresearch.backend.exception;

import java.time.Duration;

/**
 * Raised when a single backend request exceeds its deadline. The session stays usable.
 */
public class BackendTimeoutException extends BackendException {

	private final Duration timeout;

	public BackendTimeoutException(Duration timeout, Throwable cause) {
		this(null, timeout, cause);
	}

	public BackendTimeoutException(String operation, Duration timeout, Throwable cause) {
		super(Kind.TIMEOUT, operation, "Backend request timed out after " + timeout.toMillis() + " ms", cause);
		this.timeout = timeout;
	}

	public Duration getTimeout() {
		return timeout;
	}

	@Override
	public BackendTimeoutException withOperation(String operation) {
		return retainTrace(new BackendTimeoutException(operation, timeout, getCause()));
	}

}
