package dev.openresearch.backend.exception;

/**
 * Raised when the backend answers with a non-2xx status. The response body is kept, truncated to
 * {@value #MAX_BODY_LENGTH} characters.
 */
public class BackendStatusException extends BackendException {

	public static final int MAX_BODY_LENGTH = 500;

	private final int status;

	private final String body;

	public BackendStatusException(int status, String body) {
		this(null, status, body);
	}

	public BackendStatusException(String operation, int status, String body) {
		super(Kind.HTTP_STATUS, operation, "Backend responded with HTTP " + status + ": " + truncate(body), null);
		this.status = status;
		this.body = truncate(body);
	}

	public int getStatus() {
		return status;
	}

	/**
	 * Response body as received, cut to at most {@value #MAX_BODY_LENGTH} characters.
	 * @return truncated body, empty when the backend sent none
	 */
	public String getBody() {
		return body;
	}

	@Override
	public BackendStatusException withOperation(String operation) {
		return retainTrace(new BackendStatusException(operation, status, body));
	}

	static String truncate(String body) {
		if (body == null) {
			return "";
		}
		return body.length() <= MAX_BODY_LENGTH ? body : body.substring(0, MAX_BODY_LENGTH);
	}

}
