package dev.openresearch.backend.exception;

/**
 * Raised when a 2xx response body is not a JSON object.
 */
public class BackendDecodeException extends BackendException {

	public BackendDecodeException(String message, Throwable cause) {
		this(null, message, cause);
	}

	public BackendDecodeException(String operation, String message, Throwable cause) {
		super(Kind.DECODE, operation, message, cause);
	}

	@Override
	public BackendDecodeException withOperation(String operation) {
		return retainTrace(new BackendDecodeException(operation, getMessage(), getCause()));
	}

}
