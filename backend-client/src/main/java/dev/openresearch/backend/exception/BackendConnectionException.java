package dev.openresearch.backend.exception;

/**
 * Raised when a pooled connection cannot be created or the backend cannot be reached.
 */
public class BackendConnectionException extends BackendException {

	public BackendConnectionException(String message, Throwable cause) {
		this(null, message, cause);
	}

	public BackendConnectionException(String operation, String message, Throwable cause) {
		super(Kind.CONNECTION, operation, message, cause);
	}

	@Override
	public BackendConnectionException withOperation(String operation) {
		return retainTrace(new BackendConnectionException(operation, getMessage(), getCause()));
	}

}
