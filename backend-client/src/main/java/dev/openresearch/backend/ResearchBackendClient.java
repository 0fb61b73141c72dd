package dev.openresearch.backend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.openresearch.backend.exception.BackendException;

/**
 * Typed access to the research backend. Every method maps to one backend endpoint and returns the
 * decoded JSON object with the documented keys always present, so callers never need to guard
 * against missing lists or counts. Failures are rethrown tagged with the operation name.
 */
public class ResearchBackendClient {

	private static final Logger logger = LoggerFactory.getLogger(ResearchBackendClient.class);

	private final BackendSession session;

	public ResearchBackendClient(BackendSession session) {
		this.session = session;
	}

	/**
	 * Search papers by free text.
	 * @param query search text
	 * @param filters backend filter object, may be {@code null}
	 * @param sortBy sort key such as {@code relevance}
	 * @param limit maximum number of papers returned
	 * @param offset pagination offset
	 * @return response with {@code papers} (at most {@code limit}) and {@code count}
	 */
	public Map<String, Object> searchPapers(String query, Map<String, Object> filters, String sortBy, int limit,
			int offset) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("query", query);
		body.put("filters", filters != null ? filters : Map.of());
		body.put("sort_by", sortBy);
		body.put("limit", limit);
		body.put("offset", offset);
		Map<String, Object> result = execute("search_papers", BackendRequest.post("/api/v1/papers/search", body));
		truncateList(result, "papers", limit);
		defaultCount(result, "count", "papers");
		defaultCount(result, "total_count", "papers");
		logger.info("Paper search for '{}' returned {} papers", query, listOf(result, "papers").size());
		return result;
	}

	/**
	 * Full records of the given papers.
	 * @param paperIds paper identifiers
	 * @return response with {@code papers}; unknown identifiers are simply absent
	 */
	public Map<String, Object> getPaperDetails(List<String> paperIds) {
		Map<String, Object> result = execute("get_paper_details",
				BackendRequest.post("/api/v1/papers/details", Map.of("paper_ids", paperIds)));
		defaultList(result, "papers");
		return result;
	}

	/**
	 * Citations of one paper in both directions.
	 * @param paperId paper identifier
	 * @return response with {@code citing_papers}, {@code cited_papers} and their counts
	 */
	public Map<String, Object> getPaperCitations(String paperId) {
		Map<String, Object> result = execute("get_paper_citations", BackendRequest
			.get("/api/v1/papers/{paperId}/citations", Map.of("paperId", paperId), Map.of()));
		defaultCount(result, "incoming_citations_count", "citing_papers");
		defaultCount(result, "outgoing_citations_count", "cited_papers");
		if (!(result.get("total_citations_count") instanceof Number)) {
			result.put("total_citations_count", intValue(result, "incoming_citations_count")
					+ intValue(result, "outgoing_citations_count"));
		}
		return result;
	}

	/**
	 * Papers gaining the most attention in a recent window.
	 * @param timeWindow {@code week}, {@code month} or {@code year}
	 * @param limit maximum number of papers returned
	 * @return response with {@code trending_papers} and {@code count}
	 */
	public Map<String, Object> getTrendingPapers(String timeWindow, int limit) {
		Map<String, Object> query = new LinkedHashMap<>();
		query.put("time_window", timeWindow);
		query.put("limit", limit);
		Map<String, Object> result = execute("get_trending_papers",
				BackendRequest.get("/api/v1/papers/trending", Map.of(), query));
		truncateList(result, "trending_papers", limit);
		defaultCount(result, "count", "trending_papers");
		return result;
	}

	/**
	 * Search authors by name or affiliation.
	 * @param query search text
	 * @param filters backend filter object, may be {@code null}
	 * @param limit maximum number of authors returned
	 * @return response with {@code authors} and {@code count}
	 */
	public Map<String, Object> searchAuthors(String query, Map<String, Object> filters, int limit) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("query", query);
		body.put("filters", filters != null ? filters : Map.of());
		body.put("limit", limit);
		Map<String, Object> result = execute("search_authors", BackendRequest.post("/api/v1/authors/search", body));
		truncateList(result, "authors", limit);
		defaultCount(result, "count", "authors");
		return result;
	}

	/**
	 * Profiles of the given authors.
	 * @param authorIds author identifiers
	 * @return response with {@code authors}
	 */
	public Map<String, Object> getAuthorDetails(List<String> authorIds) {
		Map<String, Object> result = execute("get_author_details",
				BackendRequest.post("/api/v1/authors/details", Map.of("author_ids", authorIds)));
		defaultList(result, "authors");
		return result;
	}

	/**
	 * Papers written by one author.
	 * @param authorId author identifier
	 * @param limit maximum number of papers returned
	 * @return response with {@code papers} and {@code count}
	 */
	public Map<String, Object> getAuthorPapers(String authorId, int limit) {
		Map<String, Object> result = execute("get_author_papers", BackendRequest
			.get("/api/v1/authors/{authorId}/papers", Map.of("authorId", authorId), Map.of("limit", limit)));
		truncateList(result, "papers", limit);
		defaultCount(result, "count", "papers");
		return result;
	}

	/**
	 * Citation graph grown from seed papers.
	 * @param seedPapers paper identifiers to start from
	 * @param depth traversal depth
	 * @param direction {@code incoming}, {@code outgoing} or {@code both}
	 * @param maxNodes node budget of the returned graph
	 * @return response with {@code nodes} and {@code edges}
	 */
	public Map<String, Object> getCitationNetwork(List<String> seedPapers, int depth, String direction,
			int maxNodes) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("seed_papers", seedPapers);
		body.put("depth", depth);
		body.put("direction", direction);
		body.put("max_nodes", maxNodes);
		Map<String, Object> result = execute("get_citation_network",
				BackendRequest.post("/api/v1/networks/citation", body));
		defaultList(result, "nodes");
		defaultList(result, "edges");
		return result;
	}

	/**
	 * Co-authorship graph around the given authors.
	 * @param authors author identifiers or names
	 * @param timeRange optional year range, {@code null} for all years
	 * @param maxNodes node budget of the returned graph
	 * @return response with {@code nodes} and {@code edges}
	 */
	public Map<String, Object> getCollaborationNetwork(List<String> authors, String timeRange, int maxNodes) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("authors", authors);
		if (timeRange != null) {
			body.put("time_range", timeRange);
		}
		body.put("max_nodes", maxNodes);
		Map<String, Object> result = execute("get_collaboration_network",
				BackendRequest.post("/api/v1/networks/collaboration", body));
		defaultList(result, "nodes");
		defaultList(result, "edges");
		return result;
	}

	/**
	 * Time series of publication metrics for a domain.
	 * @param domain research domain
	 * @param timeRange year range such as {@code 2019-2024}
	 * @param metrics metric names
	 * @param granularity {@code year}, {@code quarter} or {@code month}
	 * @return response with {@code data_points} and {@code domain}
	 */
	public Map<String, Object> getResearchTrends(String domain, String timeRange, List<String> metrics,
			String granularity) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("domain", domain);
		body.put("time_range", timeRange);
		body.put("metrics", metrics);
		body.put("granularity", granularity);
		Map<String, Object> result = execute("get_research_trends",
				BackendRequest.post("/api/v1/trends/research", body));
		defaultList(result, "data_points");
		result.putIfAbsent("domain", domain);
		return result;
	}

	/**
	 * Structural overview of a domain along the requested dimensions.
	 * @param domain research domain
	 * @param dimensions analysis dimensions
	 * @return backend analysis, always carrying {@code domain}
	 */
	public Map<String, Object> analyzeResearchLandscape(String domain, List<String> dimensions) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("domain", domain);
		body.put("analysis_dimensions", dimensions);
		Map<String, Object> result = execute("analyze_research_landscape",
				BackendRequest.post("/api/v1/analysis/landscape", body));
		result.putIfAbsent("domain", domain);
		return result;
	}

	/**
	 * Most frequent keywords across all years.
	 * @param limit maximum number of keywords
	 * @return response with {@code keywords} and {@code count}
	 */
	public Map<String, Object> getTopKeywords(int limit) {
		return getTopKeywords(limit, null);
	}

	/**
	 * Most frequent keywords, optionally restricted to a year range.
	 * @param limit maximum number of keywords
	 * @param timeRange range such as {@code 2020-2024}, {@code null} for all years
	 * @return response with {@code keywords} and {@code count}
	 */
	public Map<String, Object> getTopKeywords(int limit, String timeRange) {
		Map<String, Object> query = new LinkedHashMap<>();
		query.put("limit", limit);
		query.put("time_range", timeRange);
		Map<String, Object> result = execute("get_top_keywords",
				BackendRequest.get("/api/v1/keywords/top", Map.of(), query));
		truncateList(result, "keywords", limit);
		defaultCount(result, "count", "keywords");
		return result;
	}

	/**
	 * Backend liveness.
	 * @return response whose {@code status} defaults to {@code unknown}
	 */
	public Map<String, Object> healthCheck() {
		Map<String, Object> result = execute("health_check", BackendRequest.get("/health"));
		result.putIfAbsent("status", "unknown");
		return result;
	}

	/**
	 * Backend version and build information, returned as sent.
	 * @return decoded response
	 */
	public Map<String, Object> getServiceInfo() {
		return execute("get_service_info", BackendRequest.get("/api/v1/info"));
	}

	private Map<String, Object> execute(String operation, BackendRequest request) {
		try {
			return session.request(request);
		}
		catch (BackendException ex) {
			logger.error("Backend operation {} failed ({}): {}", operation, ex.getKind(), ex.getMessage());
			throw ex.withOperation(operation);
		}
	}

	@SuppressWarnings("unchecked")
	static List<Object> listOf(Map<String, Object> result, String key) {
		Object value = result.get(key);
		return value instanceof List ? (List<Object>) value : List.of();
	}

	private static List<Object> defaultList(Map<String, Object> result, String key) {
		if (!(result.get(key) instanceof List)) {
			result.put(key, new ArrayList<>());
		}
		return listOf(result, key);
	}

	private static void truncateList(Map<String, Object> result, String key, int limit) {
		List<Object> items = defaultList(result, key);
		if (limit >= 0 && items.size() > limit) {
			result.put(key, new ArrayList<>(items.subList(0, limit)));
		}
	}

	private static void defaultCount(Map<String, Object> result, String countKey, String listKey) {
		List<Object> items = defaultList(result, listKey);
		if (!(result.get(countKey) instanceof Number)) {
			result.put(countKey, items.size());
		}
	}

	private static int intValue(Map<String, Object> result, String key) {
		Object value = result.get(key);
		return value instanceof Number ? ((Number) value).intValue() : 0;
	}

}
