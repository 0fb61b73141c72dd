package dev.openresearch.backend;

import java.util.Map;
import java.util.Objects;

import org.springframework.http.HttpMethod;

/**
 * Description of one backend call: method, path template, its variables, query parameters and an
 * optional JSON body.
 * @param method HTTP method
 * @param path path relative to the base URL, may contain {@code {name}} placeholders
 * @param pathVariables values for the placeholders in {@code path}
 * @param queryParams query parameters appended to the URI
 * @param body JSON body, {@code null} when the request carries none
 */
public record BackendRequest(HttpMethod method, String path, Map<String, Object> pathVariables,
		Map<String, Object> queryParams, Object body) {

	public BackendRequest {
		Objects.requireNonNull(method, "method must not be null");
		Objects.requireNonNull(path, "path must not be null");
		pathVariables = pathVariables == null ? Map.of() : pathVariables;
		queryParams = queryParams == null ? Map.of() : queryParams;
	}

	public static BackendRequest get(String path) {
		return new BackendRequest(HttpMethod.GET, path, Map.of(), Map.of(), null);
	}

	public static BackendRequest get(String path, Map<String, Object> pathVariables, Map<String, Object> queryParams) {
		return new BackendRequest(HttpMethod.GET, path, pathVariables, queryParams, null);
	}

	public static BackendRequest post(String path, Object body) {
		return new BackendRequest(HttpMethod.POST, path, Map.of(), Map.of(), body);
	}

	/**
	 * Short form used in log lines.
	 * @return method and path template
	 */
	public String describe() {
		return method.name() + " " + path;
	}

}
