package dev.openresearch.backend.exception;

/**
 * Base type for every failure raised while talking to the research backend. Each subclass maps to
 * one {@link Kind} so callers can report the failure category without inspecting concrete types.
 */
public abstract class BackendException extends RuntimeException {

	private final Kind kind;

	private final String operation;

	protected BackendException(Kind kind, String operation, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.operation = operation;
	}

	/**
	 * Category of the failure.
	 * @return failure kind, never {@code null}
	 */
	public Kind getKind() {
		return kind;
	}

	/**
	 * Name of the backend operation that failed, for example {@code search_papers}.
	 * @return operation name, or {@code null} when the failure happened outside an operation
	 */
	public String getOperation() {
		return operation;
	}

	/**
	 * Return a copy of this exception tagged with the supplied operation name.
	 * @param operation operation that observed the failure
	 * @return tagged exception of the same concrete type
	 */
	public abstract BackendException withOperation(String operation);

	/**
	 * Carry this exception's stack trace and suppressed exceptions over to a tagged copy, so the
	 * copy reports where the failure was raised rather than where it was tagged.
	 * @param copy tagged copy built by {@link #withOperation(String)}
	 * @param <T> concrete exception type
	 * @return the copy
	 */
	protected <T extends BackendException> T retainTrace(T copy) {
		copy.setStackTrace(getStackTrace());
		for (Throwable suppressed : getSuppressed()) {
			copy.addSuppressed(suppressed);
		}
		return copy;
	}

	/**
	 * Failure categories surfaced by the backend client.
	 */
	public enum Kind {
		CONNECTION, TIMEOUT, HTTP_STATUS, DECODE
	}

}
