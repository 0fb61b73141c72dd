package dev.openresearch.backend;

/**
 * Raw backend answer before decoding.
 * @param status HTTP status code
 * @param body response body, empty when the backend sent none
 */
public record BackendResponse(int status, String body) {

	public boolean isSuccess() {
		return status >= 200 && status < 300;
	}

}
